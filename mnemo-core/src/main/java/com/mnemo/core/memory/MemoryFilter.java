package com.mnemo.core.memory;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Set;

/**
 * Predicate set for {@link MemoryStore#queryRecords(MemoryFilter)}.
 * <p>
 * When both session and project are set, a record matches if it belongs to the session, or to the project, or is
 * global. With only a session, records of the session plus project and global ones are returned. Empty scope and
 * kind sets mean "any".
 */
@Value
@Builder
public class MemoryFilter {
    public static final double DEFAULT_DECAY_CEILING = 0.8;
    public static final int DEFAULT_LIMIT = 25;

    @NonNull
    String userId;

    String sessionId;

    String projectId;

    @Builder.Default
    Set<MemoryScope> scopes = Set.of();

    @Builder.Default
    Set<MemoryKind> kinds = Set.of();

    /**
     * Exclude records whose decay score is at or above {@link #decayCeiling}
     */
    boolean excludeStale;

    @Builder.Default
    double decayCeiling = DEFAULT_DECAY_CEILING;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    /**
     * Check a single record against every predicate except the limit
     */
    public boolean admits(@NonNull MemoryRecord memoryRecord) {
        if (!userId.equals(memoryRecord.getUserId()) || !ownedByRequest(memoryRecord)) {
            return false;
        }
        if (!scopes.isEmpty() && !scopes.contains(memoryRecord.getScope())) {
            return false;
        }
        if (!kinds.isEmpty() && !kinds.contains(memoryRecord.getKind())) {
            return false;
        }
        return !excludeStale || memoryRecord.getDecayScore() < decayCeiling;
    }

    private boolean ownedByRequest(MemoryRecord memoryRecord) {
        final var scope = memoryRecord.getScope();
        final var sameSession = sessionId != null && sessionId.equals(memoryRecord.getSessionId());
        final var sameProject = projectId != null && projectId.equals(memoryRecord.getProjectId());
        if (sessionId != null && projectId != null) {
            return sameSession || sameProject || scope == MemoryScope.GLOBAL;
        }
        if (sessionId != null) {
            return sameSession || scope == MemoryScope.PROJECT || scope == MemoryScope.GLOBAL;
        }
        if (projectId != null) {
            return sameProject || scope == MemoryScope.GLOBAL;
        }
        return true;
    }
}
