package com.mnemo.context.retrieval;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.CandidateScorer;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.memory.MemoryFilter;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryStore;
import com.mnemo.core.tokens.TokenCounter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Offers records from the long-term memory store that are visible to the request and not stale
 */
@Slf4j
public class LongTermMemorySource implements CandidateSource {
    private final MemoryStore memoryStore;
    private final CandidateScorer scorer;
    private final TokenCounter tokenCounter;

    public LongTermMemorySource(
            @NonNull MemoryStore memoryStore,
            @NonNull CandidateScorer scorer,
            @NonNull TokenCounter tokenCounter) {
        this.memoryStore = memoryStore;
        this.scorer = scorer;
        this.tokenCounter = tokenCounter;
    }

    @Override
    public String name() {
        return "long-term-store";
    }

    @Override
    public List<ScoredCandidate> fetch(RequestContext context, ContextPolicy policy) {
        final var records = memoryStore.queryRecords(visibleTo(context, policy));
        log.debug("Long-term store returned {} records for user {}", records.size(), context.getUserId());
        return records.stream()
                .map(memoryRecord -> toCandidate(memoryRecord, context))
                .toList();
    }

    /**
     * Records the request may see: owned by its user, reachable from its session or project and below the decay
     * ceiling of the policy
     */
    static MemoryFilter visibleTo(RequestContext context, ContextPolicy policy) {
        return MemoryFilter.builder()
                .userId(context.getUserId())
                .sessionId(context.getSessionId())
                .projectId(context.getProjectId())
                .excludeStale(true)
                .decayCeiling(policy.getDecayCeiling())
                .limit(CandidateSource.poolSize(policy))
                .build();
    }

    private ScoredCandidate toCandidate(MemoryRecord memoryRecord, RequestContext context) {
        return ScoredCandidate.builder()
                .sourceId(memoryRecord.getId())
                .origin(CandidateOrigin.LONG_TERM_STORE)
                .label(label(memoryRecord))
                .content(memoryRecord.getContent())
                .tokenCount(memoryRecord.getTokenCount() > 0
                            ? memoryRecord.getTokenCount()
                            : tokenCounter.count(memoryRecord.getContent()))
                .scores(scorer.score(memoryRecord, context))
                .build();
    }

    static String label(MemoryRecord memoryRecord) {
        final var tags = memoryRecord.getTags().isEmpty() ? "memory" : String.join(", ", memoryRecord.getTags());
        return "[%s:%s] %s".formatted(memoryRecord.getKind().name().toLowerCase(Locale.ROOT),
                                      memoryRecord.getScope().name().toLowerCase(Locale.ROOT),
                                      tags);
    }
}
