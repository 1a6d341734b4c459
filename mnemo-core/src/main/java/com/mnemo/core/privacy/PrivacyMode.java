package com.mnemo.core.privacy;

/**
 * How aggressively writes are gated
 */
public enum PrivacyMode {
    /**
     * Episodic writes are blocked when sensitive content is present
     */
    STANDARD,
    /**
     * As STANDARD, and also blocks episodic writes for volatile messages and sensitive facts
     */
    STRICT,
    /**
     * Sensitive content may be written after redaction
     */
    PERMISSIVE,
}
