/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mnemo.context.packing;

import com.google.common.base.Strings;
import com.mnemo.context.model.Citation;
import com.mnemo.context.model.DropReason;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.retrieval.SourceAggregator;
import com.mnemo.context.window.WindowCompactor;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.TurnRole;
import com.mnemo.core.privacy.PrivacyGate;
import com.mnemo.core.tokens.TokenCounter;
import com.mnemo.core.utils.MnemoUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns ranked candidates into a prompt that respects every budget.
 * <ol>
 *     <li>Gate: memory below the relevance threshold is dropped</li>
 *     <li>Rank: memory by score, skills by priority</li>
 *     <li>Pack: greedily into the skill and long-term budgets, skipping whatever does not fit</li>
 *     <li>Assemble: system text, redacted context blocks, recent history and the user message</li>
 * </ol>
 * Same input, same output.
 */
@Slf4j
public class BudgetPacker {
    private static final Comparator<ScoredCandidate> SKILL_ORDER = Comparator
            .comparingInt(ScoredCandidate::getPriority)
            .reversed()
            .thenComparing(ScoredCandidate::getSourceId);

    private final PrivacyGate privacyGate;
    private final WindowCompactor windowCompactor;
    private final TokenCounter tokenCounter;

    public BudgetPacker(
            @NonNull PrivacyGate privacyGate,
            @NonNull WindowCompactor windowCompactor,
            @NonNull TokenCounter tokenCounter) {
        this.privacyGate = privacyGate;
        this.windowCompactor = windowCompactor;
        this.tokenCounter = tokenCounter;
    }

    public PackingResult pack(@NonNull PackingRequest request) {
        final var policy = request.getPolicy();
        final var budgets = policy.getBudgets();
        final var threshold = policy.getRelevanceThreshold();

        final var dropped = new ArrayList<ScoredCandidate>();
        final var viable = new ArrayList<ScoredCandidate>();
        for (final var candidate : request.getMemoryCandidates()) {
            if (candidate.finalScore() < threshold) {
                dropped.add(candidate.drop(DropReason.belowThreshold(threshold)));
            }
            else {
                viable.add(candidate);
            }
        }
        viable.sort(SourceAggregator.BY_SCORE);
        final var skills = request.getSkillCandidates()
                .stream()
                .sorted(SKILL_ORDER)
                .toList();

        final var packedSkills = greedyPack(skills, budgets.getSkillTokens(),
                                            DropReason.SKILL_BUDGET_EXCEEDED, dropped);
        final var packedMemory = greedyPack(viable, budgets.getLongTermTokens(),
                                            DropReason.MEMORY_BUDGET_EXCEEDED, dropped);

        final var systemText = systemText(request.getBaseInstruction(), packedSkills);
        final var blocks = packedMemory.stream()
                .map(this::toBlock)
                .toList();
        final var history = windowCompactor.select(request.getWindowTurns(), budgets.getWindowTokens())
                .stream()
                .filter(turn -> turn.getRole() != TurnRole.SYSTEM)
                .toList();
        final var turns = new ArrayList<PromptTurn>();
        history.forEach(turn -> turns.add(new PromptTurn(turn.getRole(), turn.getContent())));
        turns.add(new PromptTurn(TurnRole.USER, request.getUserMessage()));

        final var systemTokens = tokenCounter.count(systemText);
        final var contextTokens = blocks.stream().mapToInt(ContextBlock::getTokenCount).sum();
        final var historyTokens = history.stream().mapToInt(ConversationTurn::getTokenCount).sum();
        final var userTokens = tokenCounter.count(request.getUserMessage());
        final var total = systemTokens + contextTokens + historyTokens + userTokens;
        final var breakdown = TokenBreakdown.builder()
                .system(systemTokens)
                .context(contextTokens)
                .history(historyTokens)
                .user(userTokens)
                .total(total)
                .remaining(Math.max(0, budgets.totalTokens() - total))
                .build();

        final var packed = new ArrayList<ScoredCandidate>(packedSkills);
        packed.addAll(packedMemory);
        final var pressure = (double) total / Math.max(1, budgets.packableTokens());
        log.debug("Packed {} skills and {} memories, dropped {}, {} tokens used, pressure {}",
                  packedSkills.size(), packedMemory.size(), dropped.size(), total, pressure);
        return PackingResult.builder()
                .prompt(AssembledPrompt.builder()
                                .system(systemText)
                                .contextBlocks(blocks)
                                .turns(List.copyOf(turns))
                                .tokenBreakdown(breakdown)
                                .build())
                .packed(List.copyOf(packed))
                .dropped(List.copyOf(dropped))
                .historyTurns(history)
                .citations(packedMemory.stream()
                                   .map(ScoredCandidate::getCitation)
                                   .filter(Objects::nonNull)
                                   .toList())
                .budgetPressure(pressure)
                .build();
    }

    private static List<ScoredCandidate> greedyPack(
            List<ScoredCandidate> ranked,
            int budget,
            String overflowReason,
            List<ScoredCandidate> dropped) {
        final var accepted = new ArrayList<ScoredCandidate>();
        var used = 0;
        for (final var candidate : ranked) {
            if (used + candidate.getTokenCount() <= budget) {
                accepted.add(candidate);
                used += candidate.getTokenCount();
            }
            else {
                dropped.add(candidate.drop(overflowReason));
            }
        }
        return accepted;
    }

    private static String systemText(String baseInstruction, List<ScoredCandidate> skills) {
        final var parts = new ArrayList<String>();
        if (!Strings.isNullOrEmpty(baseInstruction)) {
            parts.add(baseInstruction);
        }
        skills.forEach(skill -> parts.add(skill.getContent()));
        return String.join("\n\n", parts);
    }

    private ContextBlock toBlock(ScoredCandidate candidate) {
        final var citation = candidate.getCitation();
        return ContextBlock.builder()
                .label(candidate.getLabel())
                .content(privacyGate.redact(candidate.getContent()))
                .tokenCount(candidate.getTokenCount())
                .origin(candidate.getOrigin())
                .citation(citation == null
                          ? null
                          : Citation.builder()
                                  .sourceId(citation.getSourceId())
                                  .origin(citation.getOrigin())
                                  .relevance(citation.getRelevance())
                                  .excerpt(MnemoUtils.excerpt(privacyGate.redact(citation.getExcerpt()),
                                                                    Citation.MAX_EXCERPT_CHARS))
                                  .build())
                .build();
    }
}
