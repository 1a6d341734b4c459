package com.mnemo.context.retrieval;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.CandidateScorer;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.TurnRole;
import com.mnemo.core.memory.MemoryKind;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.tokens.TokenCounter;
import lombok.NonNull;

import java.util.List;
import java.util.Locale;

/**
 * Offers turns of the current conversation window, scored as conversation scoped episodic memories.
 * System turns are never offered.
 */
public class ShortTermWindowSource implements CandidateSource {
    private final CandidateScorer scorer;
    private final TokenCounter tokenCounter;

    public ShortTermWindowSource(@NonNull CandidateScorer scorer, @NonNull TokenCounter tokenCounter) {
        this.scorer = scorer;
        this.tokenCounter = tokenCounter;
    }

    @Override
    public String name() {
        return "short-term-window";
    }

    @Override
    public List<ScoredCandidate> fetch(RequestContext context, ContextPolicy policy) {
        final var turns = context.getShortTermTurns();
        final var from = Math.max(0, turns.size() - CandidateSource.poolSize(policy));
        return turns.subList(from, turns.size())
                .stream()
                .filter(turn -> turn.getRole() != TurnRole.SYSTEM)
                .map(turn -> toCandidate(turn, context))
                .toList();
    }

    private ScoredCandidate toCandidate(ConversationTurn turn, RequestContext context) {
        final var asMemory = MemoryRecord.builder()
                .id(turn.getMessageId())
                .kind(MemoryKind.EPISODIC)
                .scope(MemoryScope.CONVERSATION)
                .content(turn.getContent())
                .lastAccessedAt(turn.getTimestamp())
                .build();
        return ScoredCandidate.builder()
                .sourceId(turn.getMessageId())
                .origin(CandidateOrigin.SHORT_TERM_WINDOW)
                .label("[turn:" + turn.getRole().name().toLowerCase(Locale.ROOT) + "]")
                .content(turn.getContent())
                .tokenCount(turn.getTokenCount() > 0 ? turn.getTokenCount() : tokenCounter.count(turn.getContent()))
                .scores(scorer.score(asMemory, context))
                .build();
    }
}
