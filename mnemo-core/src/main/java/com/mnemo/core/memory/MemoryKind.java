package com.mnemo.core.memory;

/**
 * Kind of a long-term memory record
 */
public enum MemoryKind {
    /**
     * Raw happenings from a conversation
     */
    EPISODIC,
    /**
     * Distilled durable facts
     */
    SEMANTIC,
    /**
     * Condensed summary of a conversation
     */
    SUMMARY,
}
