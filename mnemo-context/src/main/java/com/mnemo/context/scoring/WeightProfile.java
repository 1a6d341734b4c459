package com.mnemo.context.scoring;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Fixed weight vectors for combining sub-scores. Which one applies depends only on whether relevance came from
 * embeddings. Each vector sums to one.
 */
@Getter
@AllArgsConstructor
public enum WeightProfile {
    SEMANTIC(0.40, 0.20, 0.15, 0.10, 0.10, 0.05),
    LEXICAL(0.45, 0.20, 0.15, 0.10, 0.05, 0.05),
    ;

    private final double relevance;
    private final double recency;
    private final double scopeMatch;
    private final double typePriority;
    private final double decay;
    private final double skill;

    public static WeightProfile select(boolean semanticRelevance) {
        return semanticRelevance ? SEMANTIC : LEXICAL;
    }

    public double combine(
            double relevanceScore,
            double recencyScore,
            double scopeScore,
            double typeScore,
            double decayPenalty,
            double skillWeight) {
        return relevance * relevanceScore
                + recency * recencyScore
                + scopeMatch * scopeScore
                + typePriority * typeScore
                + decay * (1.0 - decayPenalty)
                + skill * skillWeight;
    }
}
