package com.mnemo.core.privacy;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Which kinds of memory may be written for a message, along with the signals that decided it
 */
@Value
@Builder
@Jacksonized
public class MemoryPermissions {
    public static final MemoryPermissions ALLOW_ALL = MemoryPermissions.builder()
            .canWriteEpisodic(true)
            .canWriteSemantic(true)
            .canWriteSummary(true)
            .build();

    boolean canWriteEpisodic;
    boolean canWriteSemantic;
    boolean canWriteSummary;

    @Builder.Default
    SentimentResult sentiment = SentimentResult.NEUTRAL;

    @Builder.Default
    Set<SensitiveCategory> detectedCategories = Set.of();

    @Builder.Default
    PrivacyMode privacyMode = PrivacyMode.STANDARD;

    RetentionOverride retentionOverride;

    public boolean hasSensitiveContent() {
        return !detectedCategories.isEmpty();
    }
}
