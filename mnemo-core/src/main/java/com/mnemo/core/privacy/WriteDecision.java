package com.mnemo.core.privacy;

/**
 * Outcome of gating a single write
 */
public enum WriteDecision {
    STORE,
    REDACT_THEN_STORE,
    BLOCK,
}
