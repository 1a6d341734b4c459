package com.mnemo.context.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Which tier a candidate came from
 */
@Getter
@AllArgsConstructor
public enum CandidateOrigin {
    SHORT_TERM_WINDOW("short-term", false),
    LONG_TERM_STORE("long-term", true),
    SEMANTIC_INDEX("semantic-index", true),
    SKILL_FRAGMENT("skill", false),
    ;

    private final String label;

    /**
     * Candidates of this origin are records of the memory store and get touched when surfaced
     */
    private final boolean stored;
}
