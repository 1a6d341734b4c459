package com.mnemo.core.config;

import com.google.common.base.Strings;
import com.mnemo.core.errors.ErrorType;
import com.mnemo.core.errors.MnemoException;
import com.mnemo.core.privacy.PrivacyMode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;

/**
 * Per-session context policy: budgets, gating thresholds and compaction knobs
 */
@Value
@Builder
@With
@Jacksonized
public class ContextPolicy {
    public static final double DEFAULT_RELEVANCE_THRESHOLD = 0.72;
    public static final double DEFAULT_TRIGGER_RATIO = 0.80;
    public static final double DEFAULT_COMPACTION_TARGET_RATIO = 0.6;
    public static final int DEFAULT_MIN_RETAINED_TURNS = 2;
    public static final double DEFAULT_DECAY_CEILING = 0.8;
    public static final int DEFAULT_CANDIDATE_POOL_MULTIPLIER = 3;
    public static final int DEFAULT_TOP_K = 25;

    @NonNull
    String id;

    String name;

    @NonNull
    BudgetConfiguration budgets;

    @Builder.Default
    double relevanceThreshold = DEFAULT_RELEVANCE_THRESHOLD;

    /**
     * Budget pressure at or above which compaction and consolidation kick in
     */
    @Builder.Default
    double triggerRatio = DEFAULT_TRIGGER_RATIO;

    /**
     * Compaction evicts until the window is at or below this share of the window budget
     */
    @Builder.Default
    double compactionTargetRatio = DEFAULT_COMPACTION_TARGET_RATIO;

    @Builder.Default
    int minRetainedTurns = DEFAULT_MIN_RETAINED_TURNS;

    @Builder.Default
    double decayCeiling = DEFAULT_DECAY_CEILING;

    @Builder.Default
    int candidatePoolMultiplier = DEFAULT_CANDIDATE_POOL_MULTIPLIER;

    @Builder.Default
    int topK = DEFAULT_TOP_K;

    @Builder.Default
    PrivacyMode privacyMode = PrivacyMode.STANDARD;

    /**
     * Check ranges of all values
     *
     * @return this
     * @throws MnemoException with {@link ErrorType#INVALID_CONFIGURATION} listing every problem found
     */
    public ContextPolicy validate() {
        final var problems = new ArrayList<String>();
        if (Strings.isNullOrEmpty(id)) {
            problems.add("id must not be empty");
        }
        if (budgets.getWindowTokens() < 0
                || budgets.getLongTermTokens() < 0
                || budgets.getSkillTokens() < 0
                || budgets.getResponseReserveTokens() < 0) {
            problems.add("budgets must be non-negative");
        }
        checkUnitRange(problems, "relevanceThreshold", relevanceThreshold);
        checkUnitRange(problems, "triggerRatio", triggerRatio);
        checkUnitRange(problems, "decayCeiling", decayCeiling);
        if (compactionTargetRatio <= 0 || compactionTargetRatio > 1) {
            problems.add("compactionTargetRatio must be in (0, 1]");
        }
        if (minRetainedTurns < 0) {
            problems.add("minRetainedTurns must be non-negative");
        }
        if (candidatePoolMultiplier < 1) {
            problems.add("candidatePoolMultiplier must be at least 1");
        }
        if (topK < 1) {
            problems.add("topK must be at least 1");
        }
        if (privacyMode == null) {
            problems.add("privacyMode must be set");
        }
        if (!problems.isEmpty()) {
            throw new MnemoException(ErrorType.INVALID_CONFIGURATION,
                                     "policy '%s': %s".formatted(id, String.join(", ", problems)));
        }
        return this;
    }

    private static void checkUnitRange(ArrayList<String> problems, String name, double value) {
        if (value < 0 || value > 1 || Double.isNaN(value)) {
            problems.add(name + " must be in [0, 1]");
        }
    }
}
