package com.mnemo.context.routing;

import com.mnemo.core.config.ContextPolicies;
import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.tokens.TokenCounter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks skills and memory scopes for an incoming message
 */
@Slf4j
public class ContextRouter {
    private static final Pattern MEMORY_KEYWORDS = Pattern.compile(
            "\\b(remember|recall|earlier|before|last time|previously|you said|we discussed|always|never|prefer"
                    + "|profile)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FAST_HINT = Pattern.compile("\\b(quick|fast|simple|brief|tldr)\\b",
                                                             Pattern.CASE_INSENSITIVE);
    private static final Pattern DEEP_HINT = Pattern.compile(
            "\\b(deep dive|thorough|comprehensive|detailed|research|analyze)\\b", Pattern.CASE_INSENSITIVE);
    private static final int DEEP_RETRIEVAL_TOKENS = 50;

    private final SkillRegistry skillRegistry;
    private final TokenCounter tokenCounter;

    public ContextRouter(@NonNull SkillRegistry skillRegistry, @NonNull TokenCounter tokenCounter) {
        this.skillRegistry = skillRegistry;
        this.tokenCounter = tokenCounter;
    }

    public RoutingDecision route(@NonNull String message, String projectId, @NonNull Set<String> skillHints) {
        final var skills = skillRegistry.activate(message, skillHints);
        final var scopes = EnumSet.of(MemoryScope.CONVERSATION);
        if (projectId != null) {
            scopes.add(MemoryScope.PROJECT);
        }
        final var refersBack = MEMORY_KEYWORDS.matcher(message).find();
        if (refersBack) {
            scopes.add(MemoryScope.GLOBAL);
        }
        final var decision = RoutingDecision.builder()
                .activeSkills(skills)
                .scopes(Set.copyOf(scopes))
                .suggestedPolicy(suggestPolicy(message))
                .deepRetrieval(refersBack || tokenCounter.count(message) > DEEP_RETRIEVAL_TOKENS)
                .build();
        log.debug("Routed message: skills={} scopes={} policy={}",
                  decision.activeSkillIds(), decision.getScopes(), decision.getSuggestedPolicy());
        return decision;
    }

    private static String suggestPolicy(String message) {
        if (FAST_HINT.matcher(message).find()) {
            return "fast";
        }
        if (DEEP_HINT.matcher(message).find()) {
            return "deep";
        }
        return ContextPolicies.DEFAULT_POLICY;
    }
}
