package com.mnemo.context.packing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * What the language model gets to see. The new user message is always the last turn.
 */
@Value
@Builder
public class AssembledPrompt {
    @NonNull
    String system;

    @Builder.Default
    List<ContextBlock> contextBlocks = List.of();

    @Builder.Default
    List<PromptTurn> turns = List.of();

    @NonNull
    TokenBreakdown tokenBreakdown;
}
