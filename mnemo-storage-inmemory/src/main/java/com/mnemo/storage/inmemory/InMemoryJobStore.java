/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mnemo.storage.inmemory;

import com.mnemo.core.jobs.ConsolidationJob;
import com.mnemo.core.jobs.JobStatus;
import com.mnemo.core.jobs.JobStore;
import com.mnemo.core.jobs.MemoryDiff;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job queue kept in insertion order, so pending jobs come back oldest first
 */
@Slf4j
public class InMemoryJobStore implements JobStore {
    private final Map<String, ConsolidationJob> jobs = new LinkedHashMap<>();

    @Override
    public synchronized ConsolidationJob enqueue(@NonNull ConsolidationJob job) {
        jobs.put(job.getJobId(), job);
        log.debug("Enqueued consolidation job {} for conversation {} ({})",
                  job.getJobId(), job.getConversationId(), job.getReason());
        return job;
    }

    @Override
    public synchronized List<ConsolidationJob> getPendingJobs(int limit) {
        return jobs.values()
                .stream()
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized boolean setJobStatus(String jobId, @NonNull JobStatus status, MemoryDiff result, String error) {
        final var existing = jobs.get(jobId);
        if (existing == null) {
            log.warn("Status update for unknown job {}", jobId);
            return false;
        }
        jobs.put(jobId, existing.withStatus(status).withResult(result).withError(error));
        return true;
    }

    @Override
    public synchronized Optional<ConsolidationJob> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public synchronized List<ConsolidationJob> allJobs() {
        return List.copyOf(jobs.values());
    }
}
