package com.mnemo.context.retrieval;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.CandidateScorer;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.memory.MemoryFilter;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryStore;
import com.mnemo.core.semantic.SemanticIndex;
import com.mnemo.core.semantic.SemanticMatch;
import com.mnemo.core.tokens.TokenCounter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Offers nearest neighbours from a semantic index. Yields nothing when there is no index or no query embedding.
 * <p>
 * Every match is resolved against the memory store and scored as the stored record with the precomputed
 * similarity. Matches that are not in the store, belong to another user, are out of reach of the request's
 * session or project, or sit at or above the decay ceiling are dropped.
 */
@Slf4j
public class SemanticIndexSource implements CandidateSource {
    public static final double DEFAULT_MIN_SIMILARITY = 0.3;

    private final SemanticIndex semanticIndex;
    private final MemoryStore memoryStore;
    private final CandidateScorer scorer;
    private final TokenCounter tokenCounter;
    private final double minSimilarity;

    public SemanticIndexSource(
            SemanticIndex semanticIndex,
            MemoryStore memoryStore,
            CandidateScorer scorer,
            TokenCounter tokenCounter) {
        this(semanticIndex, memoryStore, scorer, tokenCounter, DEFAULT_MIN_SIMILARITY);
    }

    public SemanticIndexSource(
            SemanticIndex semanticIndex,
            @NonNull MemoryStore memoryStore,
            @NonNull CandidateScorer scorer,
            @NonNull TokenCounter tokenCounter,
            double minSimilarity) {
        this.semanticIndex = semanticIndex;
        this.memoryStore = memoryStore;
        this.scorer = scorer;
        this.tokenCounter = tokenCounter;
        this.minSimilarity = minSimilarity;
    }

    @Override
    public String name() {
        return "semantic-index";
    }

    @Override
    public List<ScoredCandidate> fetch(RequestContext context, ContextPolicy policy) {
        if (semanticIndex == null || !context.hasQueryEmbedding()) {
            log.debug("Semantic index or query embedding unavailable, skipping semantic candidates");
            return List.of();
        }
        final var filter = LongTermMemorySource.visibleTo(context, policy);
        final var matches = semanticIndex.search(context.getQueryEmbedding(),
                                                 minSimilarity,
                                                 CandidateSource.poolSize(policy));
        final var candidates = matches.stream()
                .flatMap(match -> resolve(match, filter)
                        .map(memoryRecord -> toCandidate(memoryRecord, match.getSimilarity(), context))
                        .stream())
                .toList();
        log.debug("Semantic index returned {} matches, {} visible to user {}",
                  matches.size(), candidates.size(), context.getUserId());
        return candidates;
    }

    private Optional<MemoryRecord> resolve(SemanticMatch match, MemoryFilter filter) {
        final var stored = memoryStore.findRecord(match.getId());
        if (stored.isEmpty()) {
            log.debug("Semantic match {} has no stored record, skipping", match.getId());
            return Optional.empty();
        }
        return stored.filter(filter::admits);
    }

    private ScoredCandidate toCandidate(MemoryRecord memoryRecord, double similarity, RequestContext context) {
        return ScoredCandidate.builder()
                .sourceId(memoryRecord.getId())
                .origin(CandidateOrigin.SEMANTIC_INDEX)
                .label(LongTermMemorySource.label(memoryRecord))
                .content(memoryRecord.getContent())
                .tokenCount(memoryRecord.getTokenCount() > 0
                            ? memoryRecord.getTokenCount()
                            : tokenCounter.count(memoryRecord.getContent()))
                .scores(scorer.score(memoryRecord, context, similarity))
                .build();
    }
}
