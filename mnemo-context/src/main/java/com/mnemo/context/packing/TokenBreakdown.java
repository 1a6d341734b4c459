package com.mnemo.context.packing;

import lombok.Builder;
import lombok.Value;

/**
 * Token usage of an assembled prompt, per section
 */
@Value
@Builder
public class TokenBreakdown {
    int system;
    int context;
    int history;
    int user;
    int total;
    /**
     * All budgets including the response reserve, minus {@link #total}, floored at zero
     */
    int remaining;
}
