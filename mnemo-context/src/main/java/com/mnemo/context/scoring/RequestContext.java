package com.mnemo.context.scoring;

import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.memory.MemoryScope;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Everything about the current request that scoring and retrieval need
 */
@Value
@Builder
@With
public class RequestContext {
    @NonNull
    String query;

    @NonNull
    String userId;

    String sessionId;

    String projectId;

    @Builder.Default
    Set<MemoryScope> activeScopes = Set.of(MemoryScope.CONVERSATION);

    /**
     * Ids of the skills active for this request
     */
    @Builder.Default
    Set<String> activeSkillTags = Set.of();

    float[] queryEmbedding;

    /**
     * Window turns eligible to be surfaced as scored context
     */
    @Builder.Default
    List<ConversationTurn> shortTermTurns = List.of();

    @NonNull
    Instant now;

    public boolean hasQueryEmbedding() {
        return queryEmbedding != null && queryEmbedding.length > 0;
    }
}
