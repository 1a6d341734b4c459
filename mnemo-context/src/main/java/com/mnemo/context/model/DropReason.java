package com.mnemo.context.model;

import lombok.experimental.UtilityClass;

/**
 * Reasons recorded on candidates that did not make it into the prompt
 */
@UtilityClass
public class DropReason {
    public static final String SKILL_BUDGET_EXCEEDED = "skill_budget_exceeded";
    public static final String MEMORY_BUDGET_EXCEEDED = "memory_budget_exceeded";

    public static String belowThreshold(double threshold) {
        return "below_threshold(" + threshold + ")";
    }
}
