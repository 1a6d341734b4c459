package com.mnemo.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Token budgets for one model call
 */
@Value
@Builder
@With
@Jacksonized
public class BudgetConfiguration {
    /**
     * Recent conversation turns
     */
    int windowTokens;
    /**
     * Long-term memory blocks
     */
    int longTermTokens;
    /**
     * Skill instruction fragments
     */
    int skillTokens;
    /**
     * Held back for the model's reply
     */
    int responseReserveTokens;

    /**
     * Sum of the budgets that context is packed into. Excludes the response reserve.
     */
    public int packableTokens() {
        return windowTokens + longTermTokens + skillTokens;
    }

    public int totalTokens() {
        return packableTokens() + responseReserveTokens;
    }
}
