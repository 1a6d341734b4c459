package com.mnemo.context.retrieval;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.CandidateScorer;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.context.scoring.WeightProfile;
import com.mnemo.core.config.ContextPolicies;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.TurnRole;
import com.mnemo.core.memory.MemoryKind;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.semantic.SemanticIndex;
import com.mnemo.core.tokens.EstimatingTokenCounter;
import com.mnemo.storage.inmemory.InMemoryMemoryStore;
import com.mnemo.storage.inmemory.InMemorySemanticIndex;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class CandidateSourcesTest {
    private static final Instant NOW = Instant.parse("2025-02-01T00:00:00Z");

    private final CandidateScorer scorer = new CandidateScorer();
    private final EstimatingTokenCounter tokenCounter = new EstimatingTokenCounter();
    private final ContextPolicy policy = ContextPolicies.defaults().defaultPolicy();

    @Test
    void longTermSourceSkipsStaleRecordsAndCountsTokens() {
        final var store = new InMemoryMemoryStore(Clock.fixed(NOW, ZoneOffset.UTC));
        store.insertRecord(record("fresh", 0.1, 0));
        store.insertRecord(record("stale", 0.85, 0));
        final var source = new LongTermMemorySource(store, scorer, tokenCounter);

        final var candidates = source.fetch(context(null, List.of()), policy);
        assertEquals(1, candidates.size());
        final var candidate = candidates.get(0);
        assertEquals("fresh", candidate.getSourceId());
        assertEquals(CandidateOrigin.LONG_TERM_STORE, candidate.getOrigin());
        assertEquals("[semantic:project] java", candidate.getLabel());
        assertEquals(tokenCounter.count(candidate.getContent()), candidate.getTokenCount());
    }

    @Test
    void windowSourceSkipsSystemTurns() {
        final var turns = List.of(
                ConversationTurn.builder().messageId("s").role(TurnRole.SYSTEM).content("rules").tokenCount(2).build(),
                ConversationTurn.builder().messageId("u").role(TurnRole.USER).content("java streams").tokenCount(3)
                        .timestamp(NOW).build());
        final var candidates = new ShortTermWindowSource(scorer, tokenCounter).fetch(context(null, turns), policy);
        assertEquals(List.of("u"), candidates.stream().map(ScoredCandidate::getSourceId).toList());
        assertEquals(CandidateOrigin.SHORT_TERM_WINDOW, candidates.get(0).getOrigin());
        assertEquals(0.65, candidates.get(0).getScores().getTypePriority(), 1e-9);
    }

    @Test
    void semanticSourceDegradesWithoutIndexOrEmbedding() {
        final var store = new InMemoryMemoryStore();
        assertTrue(new SemanticIndexSource(null, store, scorer, tokenCounter)
                           .fetch(context(new float[]{1, 0}, List.of()), policy)
                           .isEmpty());
        final var index = mock(SemanticIndex.class);
        assertTrue(new SemanticIndexSource(index, store, scorer, tokenCounter)
                           .fetch(context(null, List.of()), policy)
                           .isEmpty());
        verifyNoInteractions(index);
    }

    @Test
    void semanticSourceScoresStoredRecordWithSimilarity() {
        final var store = new InMemoryMemoryStore(Clock.fixed(NOW, ZoneOffset.UTC));
        store.insertRecord(record("doc-1", 0.4, 0)
                                   .withScope(MemoryScope.GLOBAL)
                                   .withTags(List.of("code", "java"))
                                   .withContent("Java records are immutable"));
        final var index = new InMemorySemanticIndex();
        index.index("doc-1", "Java records are immutable", new float[]{1, 0}, Map.of());

        final var candidates = new SemanticIndexSource(index, store, scorer, tokenCounter)
                .fetch(context(new float[]{1, 0}, List.of()), policy);
        assertEquals(1, candidates.size());
        final var candidate = candidates.get(0);
        assertEquals(CandidateOrigin.SEMANTIC_INDEX, candidate.getOrigin());
        assertEquals("[semantic:global] code, java", candidate.getLabel());
        final var scores = candidate.getScores();
        assertEquals(WeightProfile.SEMANTIC, scores.getProfile());
        assertEquals(1.0, scores.getRelevance(), 1e-6);
        assertEquals(0.4, scores.getDecayPenalty(), 1e-9);
        assertEquals(1.0, scores.getScopeMatch(), 1e-9);
        assertEquals(0.5, scores.getSkillWeight(), 1e-9);
    }

    @Test
    void semanticSourceDropsStaleForeignAndUnknownMatches() {
        final var store = new InMemoryMemoryStore(Clock.fixed(NOW, ZoneOffset.UTC));
        store.insertRecord(record("fresh", 0.1, 0));
        store.insertRecord(record("stale", 0.9, 0));
        store.insertRecord(record("foreign", 0.1, 0).withUserId("u2"));
        store.insertRecord(record("other-project", 0.1, 0).withProjectId("p2"));
        final var index = new InMemorySemanticIndex();
        for (final var id : List.of("fresh", "stale", "foreign", "other-project", "unknown")) {
            index.index(id, "Project uses Java 17 with records", new float[]{1, 0}, Map.of());
        }

        final var candidates = new SemanticIndexSource(index, store, scorer, tokenCounter)
                .fetch(context(new float[]{1, 0}, List.of()), policy);
        assertEquals(List.of("fresh"), candidates.stream().map(ScoredCandidate::getSourceId).toList());
    }

    @Test
    void indexedMatchCarriesStoredDecay() {
        final var store = new InMemoryMemoryStore(Clock.fixed(NOW, ZoneOffset.UTC));
        store.insertRecord(record("aging", 0.7, 0));
        final var index = new InMemorySemanticIndex();
        index.index("aging", "Project uses Java 17 with records", new float[]{0.6f, 0.8f}, Map.of());
        final var context = context(new float[]{1, 0}, List.of());

        final var longTerm = new LongTermMemorySource(store, scorer, tokenCounter).fetch(context, policy).get(0);
        final var indexed = new SemanticIndexSource(index, store, scorer, tokenCounter).fetch(context, policy).get(0);
        assertEquals(0.7, indexed.getScores().getDecayPenalty(), 1e-9);
        assertEquals(longTerm.getScores().getDecayPenalty(), indexed.getScores().getDecayPenalty(), 1e-9);
    }

    private static RequestContext context(float[] embedding, List<ConversationTurn> turns) {
        return RequestContext.builder()
                .query("java streams")
                .userId("u1")
                .sessionId("s1")
                .projectId("p1")
                .activeSkillTags(Set.of("code"))
                .queryEmbedding(embedding)
                .shortTermTurns(turns)
                .now(NOW)
                .build();
    }

    private static MemoryRecord record(String id, double decay, int tokens) {
        return MemoryRecord.builder()
                .id(id)
                .kind(MemoryKind.SEMANTIC)
                .scope(MemoryScope.PROJECT)
                .content("Project uses Java 17 with records")
                .tags(List.of("java"))
                .decayScore(decay)
                .tokenCount(tokens)
                .userId("u1")
                .projectId("p1")
                .build();
    }
}
