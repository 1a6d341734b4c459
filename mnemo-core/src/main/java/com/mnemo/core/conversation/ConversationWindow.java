package com.mnemo.core.conversation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Ordered recent turns of a conversation along with the number of compaction passes applied to it
 */
@Value
@Builder
@With
@Jacksonized
public class ConversationWindow {
    @NonNull
    String conversationId;

    @Builder.Default
    List<ConversationTurn> turns = List.of();

    int compactionPass;

    public int totalTokens() {
        return turns.stream()
                .mapToInt(ConversationTurn::getTokenCount)
                .sum();
    }

    public static ConversationWindow empty(String conversationId) {
        return ConversationWindow.builder()
                .conversationId(conversationId)
                .build();
    }
}
