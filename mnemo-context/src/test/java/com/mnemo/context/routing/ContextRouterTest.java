package com.mnemo.context.routing;

import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.tokens.EstimatingTokenCounter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextRouterTest {
    private final ContextRouter router = new ContextRouter(SkillRegistry.builtIn(), new EstimatingTokenCounter());

    @Test
    void activatesTriggeredSkillsByPriority() {
        final var decision = router.route("Can you recall the bug in our project code?", "p1", Set.of());
        assertEquals(List.of("memory_aware", "code", "project_scope", "general"),
                     decision.getActiveSkills().stream().map(SkillFragment::getId).toList());
        assertEquals(Set.of(MemoryScope.CONVERSATION, MemoryScope.PROJECT, MemoryScope.GLOBAL), decision.getScopes());
        assertTrue(decision.isDeepRetrieval());
    }

    @Test
    void plainMessageGetsGeneralSkillAndConversationScope() {
        final var decision = router.route("hello there", null, Set.of());
        assertEquals(Set.of("general"), decision.activeSkillIds());
        assertEquals(Set.of(MemoryScope.CONVERSATION), decision.getScopes());
        assertFalse(decision.isDeepRetrieval());
        assertEquals("default", decision.getSuggestedPolicy());
    }

    @Test
    void hintsForceSkillsOn() {
        final var decision = router.route("hello there", null, Set.of("research"));
        assertEquals(Set.of("general", "research"), decision.activeSkillIds());
    }

    @Test
    void suggestsPolicyFromWording() {
        assertEquals("fast", router.route("quick question about maps", null, Set.of()).getSuggestedPolicy());
        assertEquals("deep", router.route("give me a deep dive on GC", null, Set.of()).getSuggestedPolicy());
    }

    @Test
    void customSkillsAndDisabledSkills() {
        final var registry = SkillRegistry.withExtraSkills(List.of(
                SkillFragment.builder()
                        .id("sql")
                        .trigger(Pattern.compile("\\bselect\\b", Pattern.CASE_INSENSITIVE))
                        .priority(20)
                        .fragment("You write careful SQL.")
                        .tokenBudget(50)
                        .build(),
                SkillFragment.builder()
                        .id("off")
                        .priority(30)
                        .fragment("never")
                        .enabled(false)
                        .build()));
        final var active = registry.activate("SELECT * FROM users", Set.of());
        assertEquals("sql", active.get(0).getId());
        assertTrue(active.stream().noneMatch(skill -> skill.getId().equals("off")));
        assertTrue(registry.find("general").isPresent());
    }

    @Test
    void skillCandidateCostCappedByBudget() {
        final var skill = SkillFragment.builder()
                .id("wordy")
                .fragment("x".repeat(400))
                .tokenBudget(60)
                .priority(3)
                .build();
        final var candidate = skill.toCandidate(new EstimatingTokenCounter());
        assertEquals("skill:wordy", candidate.getSourceId());
        assertEquals(60, candidate.getTokenCount());
        assertEquals(1.0, candidate.finalScore());
        assertEquals(3, candidate.getPriority());
    }
}
