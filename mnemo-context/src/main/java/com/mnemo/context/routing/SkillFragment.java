package com.mnemo.context.routing;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.ScoreVector;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.core.tokens.TokenCounter;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * A prompt fragment that is switched on by a trigger pattern
 */
@Value
@Builder
public class SkillFragment {
    @NonNull
    String id;

    String name;

    /**
     * Null means the skill is always active
     */
    Pattern trigger;

    int priority;

    @NonNull
    String fragment;

    int tokenBudget;

    @Builder.Default
    boolean enabled = true;

    public boolean triggeredBy(String message) {
        return trigger == null || (message != null && trigger.matcher(message).find());
    }

    /**
     * Candidate for the skill budget. Token cost is the fragment size, capped by the skill's own budget.
     */
    public ScoredCandidate toCandidate(TokenCounter tokenCounter) {
        final var tokens = tokenCounter.count(fragment);
        return ScoredCandidate.builder()
                .sourceId("skill:" + id)
                .origin(CandidateOrigin.SKILL_FRAGMENT)
                .label("[skill:" + (name == null ? id : name) + "]")
                .content(fragment)
                .tokenCount(tokenBudget > 0 ? Math.min(tokens, tokenBudget) : tokens)
                .scores(ScoreVector.SKILL)
                .priority(priority)
                .build();
    }
}
