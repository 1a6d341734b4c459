package com.mnemo.context.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A piece of context competing for a place in the prompt. Lives for a single request.
 */
@Value
@Builder
@With
public class ScoredCandidate {
    @NonNull
    String sourceId;

    @NonNull
    CandidateOrigin origin;

    String label;

    @NonNull
    String content;

    int tokenCount;

    @NonNull
    ScoreVector scores;

    Citation citation;

    /**
     * Only meaningful for skill fragments
     */
    int priority;

    boolean dropped;

    String dropReason;

    public double finalScore() {
        return scores.getFinalScore();
    }

    public ScoredCandidate drop(String reason) {
        return withDropped(true).withDropReason(reason);
    }
}
