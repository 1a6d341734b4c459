package com.mnemo.context.packing;

import com.mnemo.core.conversation.TurnRole;
import lombok.NonNull;
import lombok.Value;

@Value
public class PromptTurn {
    @NonNull
    TurnRole role;

    @NonNull
    String content;
}
