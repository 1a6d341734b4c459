package com.mnemo.core.config;

import com.mnemo.core.privacy.PrivacyMode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Project level adjustments on top of a named policy. Unset fields keep the base value.
 */
@Value
@Builder
@Jacksonized
public class PolicyOverrides {
    Double relevanceThreshold;
    PrivacyMode privacyMode;
    Integer topK;

    public ContextPolicy applyTo(@NonNull ContextPolicy base) {
        var policy = base;
        if (relevanceThreshold != null) {
            policy = policy.withRelevanceThreshold(relevanceThreshold);
        }
        if (privacyMode != null) {
            policy = policy.withPrivacyMode(privacyMode);
        }
        if (topK != null) {
            policy = policy.withTopK(topK);
        }
        return policy.validate();
    }
}
