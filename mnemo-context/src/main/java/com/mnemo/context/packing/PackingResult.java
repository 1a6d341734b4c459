package com.mnemo.context.packing;

import com.mnemo.context.model.Citation;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.core.conversation.ConversationTurn;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PackingResult {
    @NonNull
    AssembledPrompt prompt;

    /**
     * Accepted skills first, then accepted memory, each in rank order
     */
    @Builder.Default
    List<ScoredCandidate> packed = List.of();

    /**
     * Everything left out, each with a drop reason
     */
    @Builder.Default
    List<ScoredCandidate> dropped = List.of();

    @Builder.Default
    List<ConversationTurn> historyTurns = List.of();

    @Builder.Default
    List<Citation> citations = List.of();

    /**
     * Total tokens used over the sum of window, long-term and skill budgets
     */
    double budgetPressure;
}
