package com.mnemo.context;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.ScoreVector;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.WeightProfile;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.TurnRole;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixtures shared by context tests
 */
@UtilityClass
public class TestCandidates {

    public static ScoredCandidate memory(String id, double finalScore, int tokens) {
        return memory(id, finalScore, tokens, "content of " + id);
    }

    public static ScoredCandidate memory(String id, double finalScore, int tokens, String content) {
        return ScoredCandidate.builder()
                .sourceId(id)
                .origin(CandidateOrigin.LONG_TERM_STORE)
                .label("[semantic:project] memory")
                .content(content)
                .tokenCount(tokens)
                .scores(ScoreVector.builder()
                                .relevance(finalScore)
                                .finalScore(finalScore)
                                .profile(WeightProfile.LEXICAL)
                                .build())
                .build();
    }

    public static ScoredCandidate skill(String id, int priority, int tokens) {
        return ScoredCandidate.builder()
                .sourceId("skill:" + id)
                .origin(CandidateOrigin.SKILL_FRAGMENT)
                .label("[skill:" + id + "]")
                .content("fragment " + id)
                .tokenCount(tokens)
                .scores(ScoreVector.SKILL)
                .priority(priority)
                .build();
    }

    public static List<ConversationTurn> turns(int count, int tokensEach) {
        final var turns = new ArrayList<ConversationTurn>();
        final var start = Instant.parse("2025-01-01T00:00:00Z");
        for (int i = 0; i < count; i++) {
            turns.add(ConversationTurn.builder()
                              .messageId("t" + i)
                              .role(i % 2 == 0 ? TurnRole.USER : TurnRole.ASSISTANT)
                              .content("turn number " + i)
                              .tokenCount(tokensEach)
                              .timestamp(start.plusSeconds(60L * i))
                              .build());
        }
        return List.copyOf(turns);
    }
}
