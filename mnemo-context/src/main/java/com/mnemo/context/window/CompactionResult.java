package com.mnemo.context.window;

import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.ConversationWindow;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompactionResult {
    /**
     * Window after compaction. Same as the input when nothing was evicted.
     */
    @NonNull
    ConversationWindow window;

    @Builder.Default
    List<ConversationTurn> evicted = List.of();

    /**
     * Pressure reached the trigger ratio
     */
    boolean triggered;

    int targetTokens;

    public int evictedCount() {
        return evicted.size();
    }

    public int evictedTokens() {
        return evicted.stream()
                .mapToInt(ConversationTurn::getTokenCount)
                .sum();
    }
}
