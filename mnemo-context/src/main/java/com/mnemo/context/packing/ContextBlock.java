package com.mnemo.context.packing;

import com.mnemo.context.model.CandidateOrigin;
import com.mnemo.context.model.Citation;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A labelled piece of retrieved memory placed in the prompt
 */
@Value
@Builder
public class ContextBlock {
    String label;

    @NonNull
    String content;

    int tokenCount;

    @NonNull
    CandidateOrigin origin;

    Citation citation;
}
