package com.mnemo.core.memory;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A unit of long-term memory. Decay is only ever changed through
 * {@link MemoryStore#updateDecay(String, double)}, reads and touches leave it alone.
 */
@Value
@Builder
@With
@Jacksonized
public class MemoryRecord {
    @NonNull
    String id;

    @NonNull
    MemoryKind kind;

    @NonNull
    MemoryScope scope;

    @NonNull
    String content;

    /**
     * Optional dense vector for the content
     */
    float[] embedding;

    @Builder.Default
    List<String> tags = List.of();

    /**
     * In [0, 1]
     */
    double confidence;

    /**
     * In [0, 1]. Higher means staler.
     */
    double decayScore;

    int tokenCount;

    String userId;

    String sessionId;

    String projectId;

    @Builder.Default
    MemorySource source = MemorySource.CHAT;

    Instant createdAt;

    Instant lastAccessedAt;
}
