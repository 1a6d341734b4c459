package com.mnemo.context.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Where a packed context block came from
 */
@Value
@Builder
public class Citation {
    public static final int MAX_EXCERPT_CHARS = 120;

    @NonNull
    String sourceId;

    @NonNull
    String origin;

    double relevance;

    /**
     * At most {@link #MAX_EXCERPT_CHARS} characters
     */
    @NonNull
    String excerpt;
}
