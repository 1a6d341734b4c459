package com.mnemo.core.jobs;

import java.util.List;
import java.util.Optional;

/**
 * Storage boundary for consolidation jobs
 */
public interface JobStore {
    ConsolidationJob enqueue(ConsolidationJob job);

    /**
     * Oldest pending jobs first
     *
     * @param limit Maximum number of jobs to return
     * @return Pending jobs
     */
    List<ConsolidationJob> getPendingJobs(int limit);

    /**
     * Move a job to a new status
     *
     * @param jobId  Job id
     * @param status New status
     * @param result Diff for completed jobs, null otherwise
     * @param error  Error message for failed jobs, null otherwise
     * @return true if the job existed
     */
    boolean setJobStatus(String jobId, JobStatus status, MemoryDiff result, String error);

    Optional<ConsolidationJob> findJob(String jobId);
}
