package com.mnemo.context.packing;

import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationTurn;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PackingRequest {
    @Builder.Default
    String baseInstruction = "";

    @Builder.Default
    List<ScoredCandidate> skillCandidates = List.of();

    @Builder.Default
    List<ScoredCandidate> memoryCandidates = List.of();

    /**
     * Full conversation window, oldest first. Only the newest turns fitting the window budget are used.
     */
    @Builder.Default
    List<ConversationTurn> windowTurns = List.of();

    @NonNull
    String userMessage;

    @NonNull
    ContextPolicy policy;
}
