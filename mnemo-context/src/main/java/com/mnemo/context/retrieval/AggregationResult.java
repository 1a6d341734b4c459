package com.mnemo.context.retrieval;

import com.mnemo.context.model.ScoredCandidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked, deduplicated candidates plus the names of sources that failed to answer
 */
@Value
@Builder
public class AggregationResult {
    @Builder.Default
    List<ScoredCandidate> candidates = List.of();

    @Builder.Default
    List<String> failedSources = List.of();

    /**
     * Candidates fetched across all sources before deduplication and trimming
     */
    int fetchedCount;
}
