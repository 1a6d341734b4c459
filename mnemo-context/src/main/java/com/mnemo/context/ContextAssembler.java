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

package com.mnemo.context;

import com.google.common.base.Stopwatch;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.packing.BudgetPacker;
import com.mnemo.context.packing.PackingRequest;
import com.mnemo.context.retrieval.CandidateSource;
import com.mnemo.context.retrieval.LongTermMemorySource;
import com.mnemo.context.retrieval.SemanticIndexSource;
import com.mnemo.context.retrieval.ShortTermWindowSource;
import com.mnemo.context.retrieval.SourceAggregator;
import com.mnemo.context.retrieval.TouchDispatcher;
import com.mnemo.context.routing.ContextRouter;
import com.mnemo.context.routing.SkillFragment;
import com.mnemo.context.routing.SkillRegistry;
import com.mnemo.context.scoring.CandidateScorer;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.context.trigger.ConsolidationTrigger;
import com.mnemo.context.trigger.TriggerDecision;
import com.mnemo.context.window.WindowCompactor;
import com.mnemo.core.config.ContextPolicies;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.ConversationWindow;
import com.mnemo.core.embedding.EmbeddingModel;
import com.mnemo.core.jobs.ConsolidationJob;
import com.mnemo.core.jobs.JobStore;
import com.mnemo.core.memory.MemoryStore;
import com.mnemo.core.privacy.MemoryPermissions;
import com.mnemo.core.privacy.PrivacyGate;
import com.mnemo.core.semantic.SemanticIndex;
import com.mnemo.core.tokens.EstimatingTokenCounter;
import com.mnemo.core.tokens.TokenCounter;
import com.mnemo.core.utils.MnemoUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Builds the prompt for one user message: routes it, gathers and scores candidates from every memory tier, packs
 * them under the policy budgets, compacts the conversation window when under pressure and hands the conversation
 * to consolidation when warranted.
 * <p>
 * Only configuration errors escape. Unavailable collaborators reduce what ends up in the prompt.
 */
@Slf4j
public class ContextAssembler implements AutoCloseable {
    private final PrivacyGate privacyGate;
    private final TokenCounter tokenCounter;
    private final EmbeddingModel embeddingModel;
    private final JobStore jobStore;
    private final Clock clock;
    private final ContextPolicy defaultPolicy;
    private final List<ContextTraceListener> traceListeners;

    private final ContextRouter router;
    private final SourceAggregator aggregator;
    private final BudgetPacker packer;
    private final WindowCompactor windowCompactor;
    private final ConsolidationTrigger trigger;
    private final TouchDispatcher touchDispatcher;

    /**
     * @param memoryStore    Long-term memory, required
     * @param semanticIndex  Optional vector index
     * @param embeddingModel Optional, used to embed messages that arrive without an embedding
     * @param jobStore       Optional, consolidation jobs are only enqueued when present
     * @param tokenCounter   Defaults to a four characters per token estimate
     * @param privacyGate    Defaults to the standard gate
     * @param skillRegistry  Defaults to the built-in skills
     * @param defaultPolicy  Used when a request carries no policy. Defaults to the bundled "default" preset.
     * @param traceListeners Receivers of per-request traces
     * @param clock          Time source
     */
    @Builder
    public ContextAssembler(
            @NonNull MemoryStore memoryStore,
            SemanticIndex semanticIndex,
            EmbeddingModel embeddingModel,
            JobStore jobStore,
            TokenCounter tokenCounter,
            PrivacyGate privacyGate,
            SkillRegistry skillRegistry,
            ContextPolicy defaultPolicy,
            List<ContextTraceListener> traceListeners,
            Clock clock) {
        this.tokenCounter = Objects.requireNonNullElseGet(tokenCounter, EstimatingTokenCounter::new);
        this.privacyGate = Objects.requireNonNullElseGet(privacyGate, PrivacyGate::new);
        this.embeddingModel = embeddingModel;
        this.jobStore = jobStore;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.defaultPolicy = Objects.requireNonNullElseGet(defaultPolicy,
                                                           () -> ContextPolicies.defaults().defaultPolicy())
                .validate();
        this.traceListeners = Objects.requireNonNullElseGet(traceListeners, List::of);

        final var scorer = new CandidateScorer();
        final List<CandidateSource> sources = List.of(
                new ShortTermWindowSource(scorer, this.tokenCounter),
                new LongTermMemorySource(memoryStore, scorer, this.tokenCounter),
                new SemanticIndexSource(semanticIndex, memoryStore, scorer, this.tokenCounter));
        this.touchDispatcher = new TouchDispatcher(memoryStore);
        this.router = new ContextRouter(Objects.requireNonNullElseGet(skillRegistry, SkillRegistry::builtIn),
                                        this.tokenCounter);
        this.aggregator = new SourceAggregator(sources, touchDispatcher);
        this.windowCompactor = new WindowCompactor();
        this.packer = new BudgetPacker(this.privacyGate, windowCompactor, this.tokenCounter);
        this.trigger = new ConsolidationTrigger();
    }

    public ContextResult assemble(@NonNull ContextRequest request) {
        final var stopwatch = Stopwatch.createStarted();
        final var policy = request.getPolicy() == null ? defaultPolicy : request.getPolicy().validate();
        final var window = request.windowOrEmpty();
        final var budgets = policy.getBudgets();

        final var routing = router.route(request.getMessage(), request.getProjectId(), request.getSkillHints());
        final var permissions = privacyGate.analyze(request.getMessage(), policy.getPrivacyMode());

        final var history = windowCompactor.select(window.getTurns(), budgets.getWindowTokens());
        final var context = RequestContext.builder()
                .query(request.getMessage())
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .projectId(request.getProjectId())
                .activeScopes(routing.getScopes())
                .activeSkillTags(routing.activeSkillIds())
                .queryEmbedding(queryEmbedding(request))
                .shortTermTurns(olderThan(window.getTurns(), history))
                .now(clock.instant())
                .build();
        final var aggregation = aggregator.aggregate(context, policy);

        final var packing = packer.pack(PackingRequest.builder()
                                                .baseInstruction(request.getBaseInstruction())
                                                .skillCandidates(routing.getActiveSkills()
                                                                         .stream()
                                                                         .map(skill -> skill.toCandidate(tokenCounter))
                                                                         .toList())
                                                .memoryCandidates(aggregation.getCandidates())
                                                .windowTurns(window.getTurns())
                                                .userMessage(request.getMessage())
                                                .policy(policy)
                                                .build());
        final var pressure = packing.getBudgetPressure();
        final var compaction = windowCompactor.compact(window, policy, pressure);
        final var decision = trigger.evaluate(pressure, policy, permissions,
                                              request.isSessionEnd(), request.isManualConsolidation());
        final var jobId = decision.isShouldEnqueue()
                          ? enqueue(request, window, permissions, decision)
                          : null;

        final var result = ContextResult.builder()
                .prompt(packing.getPrompt())
                .packing(packing)
                .routing(routing)
                .permissions(permissions)
                .compaction(compaction)
                .trigger(decision)
                .enqueuedJobId(jobId)
                .build();

        final var dropped = new LinkedHashMap<String, String>();
        packing.getDropped().forEach(candidate -> dropped.put(candidate.getSourceId(), candidate.getDropReason()));
        publish(ContextTrace.builder()
                        .traceId(UUID.randomUUID().toString())
                        .userId(request.getUserId())
                        .sessionId(request.getSessionId())
                        .policyId(policy.getId())
                        .activeSkills(routing.getActiveSkills().stream().map(SkillFragment::getId).toList())
                        .fetchedCandidates(aggregation.getFetchedCount())
                        .failedSources(aggregation.getFailedSources())
                        .packedIds(packing.getPacked().stream().map(ScoredCandidate::getSourceId).toList())
                        .dropped(dropped)
                        .tokenBreakdown(packing.getPrompt().getTokenBreakdown())
                        .budgetPressure(pressure)
                        .evictedTurns(compaction.evictedCount())
                        .triggerReason(decision.getReason())
                        .elapsedMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                        .build());
        return result;
    }

    @Override
    public void close() {
        touchDispatcher.close();
    }

    private float[] queryEmbedding(ContextRequest request) {
        if (request.getQueryEmbedding() != null || embeddingModel == null) {
            return request.getQueryEmbedding();
        }
        try {
            return embeddingModel.getEmbedding(request.getMessage());
        }
        catch (Exception e) {
            log.warn("Could not embed message, falling back to lexical relevance: {}", MnemoUtils.errorMessage(e));
            return null;
        }
    }

    private static List<ConversationTurn> olderThan(List<ConversationTurn> turns, List<ConversationTurn> history) {
        final var inHistory = new HashSet<String>();
        history.forEach(turn -> inHistory.add(turn.getMessageId()));
        final var older = new ArrayList<ConversationTurn>();
        for (final var turn : turns) {
            if (!inHistory.contains(turn.getMessageId())) {
                older.add(turn);
            }
        }
        return List.copyOf(older);
    }

    private String enqueue(
            ContextRequest request,
            ConversationWindow window,
            MemoryPermissions permissions,
            TriggerDecision decision) {
        if (jobStore == null) {
            log.debug("Consolidation warranted ({}) but no job store configured", decision.getReason());
            return null;
        }
        try {
            final var job = jobStore.enqueue(ConsolidationJob.pending(request.getSessionId(),
                                                                      request.getUserId(),
                                                                      request.getProjectId(),
                                                                      decision.getReason(),
                                                                      window.getTurns(),
                                                                      permissions,
                                                                      clock.instant()));
            log.info("Enqueued consolidation job {} for session {} ({})",
                     job.getJobId(), request.getSessionId(), decision.getReason());
            return job.getJobId();
        }
        catch (Exception e) {
            log.error("Could not enqueue consolidation job for session {}: {}",
                      request.getSessionId(), MnemoUtils.errorMessage(e));
            return null;
        }
    }

    private void publish(ContextTrace trace) {
        for (final var listener : traceListeners) {
            try {
                listener.onTrace(trace);
            }
            catch (Exception e) {
                log.warn("Trace listener {} failed: {}", listener.getClass().getSimpleName(), MnemoUtils.errorMessage(e));
            }
        }
    }
}
