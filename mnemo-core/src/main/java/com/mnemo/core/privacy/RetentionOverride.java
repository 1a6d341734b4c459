package com.mnemo.core.privacy;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Set when the user asked for the conversation not to be remembered
 */
@Value
@Builder
@Jacksonized
public class RetentionOverride {
    boolean forgetAfterSession;
    boolean forgetAfterProject;
    String matchedDirective;

    public static RetentionOverride forget(String matchedDirective) {
        return RetentionOverride.builder()
                .forgetAfterSession(true)
                .forgetAfterProject(true)
                .matchedDirective(matchedDirective)
                .build();
    }
}
