package com.mnemo.core.conversation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single message in a conversation window
 */
@Value
@Builder
@Jacksonized
public class ConversationTurn {
    @NonNull
    String messageId;

    @NonNull
    TurnRole role;

    @NonNull
    String content;

    int tokenCount;

    Instant timestamp;
}
