package com.mnemo.core.memory;

/**
 * Where a record came from
 */
public enum MemorySource {
    CHAT,
    DOCUMENT,
    CONSOLIDATION,
    MANUAL,
}
