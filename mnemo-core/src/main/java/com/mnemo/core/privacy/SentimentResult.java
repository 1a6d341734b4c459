package com.mnemo.core.privacy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SentimentResult {
    public static final SentimentResult NEUTRAL = SentimentResult.builder()
            .label(SentimentLabel.NEUTRAL)
            .build();

    @NonNull
    SentimentLabel label;

    /**
     * In [-1, 1]
     */
    double score;

    int positiveHits;

    int negativeHits;

    int volatileHits;
}
