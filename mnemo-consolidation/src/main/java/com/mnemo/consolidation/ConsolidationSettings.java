package com.mnemo.consolidation;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Knobs for the consolidation worker
 */
@Value
@Builder
@With
public class ConsolidationSettings {
    public static final ConsolidationSettings DEFAULT = ConsolidationSettings.builder().build();

    /**
     * Pending jobs taken per poll
     */
    @Builder.Default
    int batchSize = 5;

    /**
     * Shorter transcripts are not summarised
     */
    @Builder.Default
    int minTurnsForSummary = 3;

    @Builder.Default
    int maxKeyFacts = 7;

    @Builder.Default
    int maxSemanticFacts = 5;

    @Builder.Default
    int summaryTranscriptChars = 4000;

    @Builder.Default
    int factTranscriptChars = 3000;

    @Builder.Default
    int maxGenerationTokens = 1024;

    @Builder.Default
    double summaryConfidence = 0.9;

    @Builder.Default
    double defaultFactConfidence = 0.7;

    /**
     * Recomputed decay is written back only when it moved by more than this
     */
    @Builder.Default
    double decayRefreshDelta = 0.05;

    @Builder.Default
    int decayRefreshLimit = 100;
}
