package com.mnemo.context.packing;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.Citation;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.window.WindowCompactor;
import com.mnemo.core.config.BudgetConfiguration;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.TurnRole;
import com.mnemo.core.privacy.PrivacyGate;
import com.mnemo.core.tokens.EstimatingTokenCounter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static com.mnemo.context.TestCandidates.memory;
import static com.mnemo.context.TestCandidates.skill;
import static com.mnemo.context.TestCandidates.turns;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetPackerTest {
    private final BudgetPacker packer = new BudgetPacker(new PrivacyGate(),
                                                         new WindowCompactor(),
                                                         new EstimatingTokenCounter());

    @Test
    void dropsOverBudgetAndBelowThresholdWithReasons() {
        final var result = packer.pack(PackingRequest.builder()
                                               .memoryCandidates(List.of(memory("big", 0.9, 50),
                                                                         memory("weak", 0.5, 10)))
                                               .userMessage("hi")
                                               .policy(policy(100, 40, 100, 0.72))
                                               .build());
        assertTrue(result.getPacked().isEmpty());
        final var reasons = reasons(result);
        assertEquals("memory_budget_exceeded", reasons.get("big"));
        assertEquals("below_threshold(0.72)", reasons.get("weak"));
        result.getDropped().forEach(candidate -> assertTrue(candidate.isDropped()));
    }

    @Test
    void greedyPackingSkipsItemsThatDoNotFit() {
        final var result = packer.pack(PackingRequest.builder()
                                               .memoryCandidates(List.of(memory("a", 0.95, 30),
                                                                         memory("b", 0.90, 20),
                                                                         memory("c", 0.85, 10)))
                                               .userMessage("hi")
                                               .policy(policy(100, 40, 100, 0.5))
                                               .build());
        assertEquals(List.of("a", "c"), ids(result.getPacked()));
        assertEquals("memory_budget_exceeded", reasons(result).get("b"));
        assertEquals(40, result.getPrompt().getTokenBreakdown().getContext());
    }

    @Test
    void skillsPackedByPriorityIntoSkillBudget() {
        final var result = packer.pack(PackingRequest.builder()
                                               .baseInstruction("Base.")
                                               .skillCandidates(List.of(skill("general", 0, 20),
                                                                        skill("memory_aware", 15, 30),
                                                                        skill("code", 10, 30)))
                                               .userMessage("hi")
                                               .policy(policy(100, 100, 55, 0.72))
                                               .build());
        assertEquals(List.of("skill:memory_aware", "skill:general"), ids(result.getPacked()));
        assertEquals("skill_budget_exceeded", reasons(result).get("skill:code"));
        assertEquals("Base.\n\nfragment memory_aware\n\nfragment general", result.getPrompt().getSystem());
    }

    @Test
    void assemblesRedactedBlocksHistoryAndUserMessageLast() {
        final var window = new ArrayList<>(turns(4, 10));
        window.add(0, ConversationTurn.builder()
                .messageId("sys")
                .role(TurnRole.SYSTEM)
                .content("system note")
                .tokenCount(5)
                .build());
        final var sensitive = memory("pii", 0.9, 10, "Reach the user at someone@example.com")
                .withCitation(Citation.builder()
                                      .sourceId("pii")
                                      .origin(CandidateOrigin.LONG_TERM_STORE.getLabel())
                                      .relevance(0.9)
                                      .excerpt("Reach the user at someone@example.com")
                                      .build());
        final var result = packer.pack(PackingRequest.builder()
                                               .memoryCandidates(List.of(sensitive))
                                               .windowTurns(window)
                                               .userMessage("what next?")
                                               .policy(policy(25, 100, 100, 0.72))
                                               .build());
        final var prompt = result.getPrompt();
        assertEquals("Reach the user at [REDACTED:EMAIL]", prompt.getContextBlocks().get(0).getContent());
        assertFalse(prompt.getContextBlocks().get(0).getCitation().getExcerpt().contains("@"));
        assertEquals(List.of("turn number 2", "turn number 3", "what next?"),
                     prompt.getTurns().stream().map(PromptTurn::getContent).toList());
        assertEquals(TurnRole.USER, prompt.getTurns().get(prompt.getTurns().size() - 1).getRole());

        final var breakdown = prompt.getTokenBreakdown();
        assertEquals(0, breakdown.getSystem());
        assertEquals(10, breakdown.getContext());
        assertEquals(20, breakdown.getHistory());
        assertEquals(3, breakdown.getUser());
        assertEquals(33, breakdown.getTotal());
        assertEquals(25 + 100 + 100 + 50 - 33, breakdown.getRemaining());
        assertEquals(33.0 / 225, result.getBudgetPressure(), 1e-9);
        assertEquals(1, result.getCitations().size());
    }

    @Test
    void respectsBudgetsAndThresholdOnRandomInput() {
        final var random = new Random(42);
        for (int round = 0; round < 50; round++) {
            final var candidates = new ArrayList<ScoredCandidate>();
            for (int i = 0; i < 30; i++) {
                candidates.add(memory("m" + i, random.nextDouble(), 1 + random.nextInt(120)));
            }
            final var skills = new ArrayList<ScoredCandidate>();
            for (int i = 0; i < 5; i++) {
                skills.add(skill("s" + i, random.nextInt(20), 1 + random.nextInt(200)));
            }
            final var policy = policy(500, 400 + random.nextInt(400), 300, 0.4);
            final var result = packer.pack(PackingRequest.builder()
                                                   .skillCandidates(skills)
                                                   .memoryCandidates(candidates)
                                                   .userMessage("q")
                                                   .policy(policy)
                                                   .build());
            final var memoryTokens = result.getPacked().stream()
                    .filter(candidate -> candidate.getOrigin() != CandidateOrigin.SKILL_FRAGMENT)
                    .mapToInt(ScoredCandidate::getTokenCount)
                    .sum();
            final var skillTokens = result.getPacked().stream()
                    .filter(candidate -> candidate.getOrigin() == CandidateOrigin.SKILL_FRAGMENT)
                    .mapToInt(ScoredCandidate::getTokenCount)
                    .sum();
            assertTrue(memoryTokens <= policy.getBudgets().getLongTermTokens());
            assertTrue(skillTokens <= policy.getBudgets().getSkillTokens());
            result.getPacked().stream()
                    .filter(candidate -> candidate.getOrigin() != CandidateOrigin.SKILL_FRAGMENT)
                    .forEach(candidate -> assertTrue(candidate.finalScore() >= 0.4));
            result.getDropped().stream()
                    .filter(candidate -> candidate.finalScore() < 0.4)
                    .forEach(candidate -> assertEquals("below_threshold(0.4)", candidate.getDropReason()));
            assertEquals(candidates.size() + skills.size(), result.getPacked().size() + result.getDropped().size());
        }
    }

    @Test
    void identicalInputsGiveIdenticalOutput() {
        final var candidates = List.of(memory("x", 0.8, 10), memory("y", 0.8, 10), memory("z", 0.9, 10));
        final var request = PackingRequest.builder()
                .skillCandidates(List.of(skill("a", 1, 5), skill("b", 1, 5)))
                .memoryCandidates(candidates)
                .windowTurns(turns(6, 7))
                .userMessage("same question")
                .policy(policy(30, 25, 100, 0.72))
                .build();
        final var first = packer.pack(request);
        final var second = packer.pack(request);
        assertEquals(first, second);
        assertEquals(List.of("skill:a", "skill:b", "z", "x"), ids(first.getPacked()));
    }

    private static ContextPolicy policy(int window, int longTerm, int skills, double threshold) {
        return ContextPolicy.builder()
                .id("test")
                .budgets(BudgetConfiguration.builder()
                                 .windowTokens(window)
                                 .longTermTokens(longTerm)
                                 .skillTokens(skills)
                                 .responseReserveTokens(50)
                                 .build())
                .relevanceThreshold(threshold)
                .build();
    }

    private static List<String> ids(List<ScoredCandidate> candidates) {
        return candidates.stream().map(ScoredCandidate::getSourceId).toList();
    }

    private static Map<String, String> reasons(PackingResult result) {
        return result.getDropped()
                .stream()
                .collect(Collectors.toMap(ScoredCandidate::getSourceId, ScoredCandidate::getDropReason));
    }
}
