package com.mnemo.core.jobs;

import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.privacy.MemoryPermissions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request to consolidate a conversation transcript into long-term memory.
 * The transcript is a snapshot taken when the job was created.
 */
@Value
@Builder
@With
@Jacksonized
public class ConsolidationJob {
    @NonNull
    String jobId;

    @NonNull
    String conversationId;

    @NonNull
    String userId;

    String projectId;

    @NonNull
    TriggerReason reason;

    @Builder.Default
    List<ConversationTurn> transcript = List.of();

    @NonNull
    MemoryPermissions permissions;

    @Builder.Default
    JobStatus status = JobStatus.PENDING;

    Instant createdAt;

    MemoryDiff result;

    String error;

    /**
     * Create a pending job over an immutable copy of the given turns
     */
    public static ConsolidationJob pending(
            @NonNull String conversationId,
            @NonNull String userId,
            String projectId,
            @NonNull TriggerReason reason,
            @NonNull List<ConversationTurn> turns,
            @NonNull MemoryPermissions permissions,
            @NonNull Instant createdAt) {
        return ConsolidationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .conversationId(conversationId)
                .userId(userId)
                .projectId(projectId)
                .reason(reason)
                .transcript(List.copyOf(turns))
                .permissions(permissions)
                .status(JobStatus.PENDING)
                .createdAt(createdAt)
                .build();
    }
}
