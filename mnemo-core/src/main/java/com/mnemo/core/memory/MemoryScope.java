package com.mnemo.core.memory;

/**
 * Visibility of a memory record
 */
public enum MemoryScope {
    CONVERSATION,
    PROJECT,
    GLOBAL,
}
