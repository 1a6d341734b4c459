package com.mnemo.context.model;

import com.mnemo.context.scoring.WeightProfile;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Sub-scores of a candidate and the weighted total
 */
@Value
@Builder
public class ScoreVector {
    /**
     * Score given to skill fragments, which are never threshold gated
     */
    public static final ScoreVector SKILL = ScoreVector.builder()
            .relevance(1.0)
            .finalScore(1.0)
            .profile(WeightProfile.LEXICAL)
            .build();

    double relevance;
    double recency;
    double scopeMatch;
    double typePriority;
    /**
     * The stored decay score. Contributes as {@code weight * (1 - decayPenalty)}.
     */
    double decayPenalty;
    double skillWeight;
    double finalScore;

    @NonNull
    WeightProfile profile;
}
