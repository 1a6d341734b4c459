package com.mnemo.consolidation;

import lombok.Value;

/**
 * Outcome of one {@link ConsolidationWorker#processPendingJobs()} call
 */
@Value
public class ConsolidationRunSummary {
    int processed;
    int failed;

    public static ConsolidationRunSummary empty() {
        return new ConsolidationRunSummary(0, 0);
    }
}
