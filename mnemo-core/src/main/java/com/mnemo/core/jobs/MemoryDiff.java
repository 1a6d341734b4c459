package com.mnemo.core.jobs;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * What a consolidation job changed in long-term memory
 */
@Value
@Builder
@Jacksonized
public class MemoryDiff {
    int added;
    int updated;
    /**
     * Consolidation never deletes, so this stays zero
     */
    int removed;

    @Builder.Default
    List<String> addedIds = List.of();

    @Builder.Default
    List<String> updatedIds = List.of();

    @Builder.Default
    List<String> keyFacts = List.of();

    /**
     * Errors of steps that failed while the rest of the job went through, keyed by step name
     */
    @Builder.Default
    Map<String, String> stepErrors = Map.of();

    public static MemoryDiff empty() {
        return MemoryDiff.builder().build();
    }
}
