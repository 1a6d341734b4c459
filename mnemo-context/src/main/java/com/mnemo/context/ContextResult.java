package com.mnemo.context;

import com.mnemo.context.packing.AssembledPrompt;
import com.mnemo.context.packing.PackingResult;
import com.mnemo.context.routing.RoutingDecision;
import com.mnemo.context.trigger.TriggerDecision;
import com.mnemo.context.window.CompactionResult;
import com.mnemo.core.conversation.ConversationWindow;
import com.mnemo.core.privacy.MemoryPermissions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of assembling context for one message
 */
@Value
@Builder
public class ContextResult {
    @NonNull
    AssembledPrompt prompt;

    @NonNull
    PackingResult packing;

    @NonNull
    RoutingDecision routing;

    @NonNull
    MemoryPermissions permissions;

    /**
     * Callers should persist {@code compaction.window} as the new conversation window
     */
    @NonNull
    CompactionResult compaction;

    @NonNull
    TriggerDecision trigger;

    /**
     * Id of the consolidation job enqueued for this request, if any
     */
    String enqueuedJobId;

    public ConversationWindow window() {
        return compaction.getWindow();
    }
}
