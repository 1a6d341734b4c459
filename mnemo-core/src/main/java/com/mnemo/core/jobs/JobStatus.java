package com.mnemo.core.jobs;

/**
 * Lifecycle of a consolidation job. PENDING -> PROCESSING -> DONE | FAILED
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    DONE,
    FAILED,
}
