package com.mnemo.context;

import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationWindow;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Set;

/**
 * One incoming user message together with its conversation state
 */
@Value
@Builder
public class ContextRequest {
    @NonNull
    String userId;

    /**
     * Conversation the message belongs to
     */
    @NonNull
    String sessionId;

    String projectId;

    @NonNull
    String message;

    /**
     * Recent turns, oldest first. Does not include {@link #message}.
     */
    ConversationWindow window;

    /**
     * Embedding of the message, if the caller already has one
     */
    float[] queryEmbedding;

    /**
     * Skill ids to force on
     */
    @Builder.Default
    Set<String> skillHints = Set.of();

    /**
     * Policy to apply. The assembler default is used when missing.
     */
    ContextPolicy policy;

    @Builder.Default
    String baseInstruction = "";

    boolean sessionEnd;

    boolean manualConsolidation;

    public ConversationWindow windowOrEmpty() {
        return window == null ? ConversationWindow.empty(sessionId) : window;
    }
}
