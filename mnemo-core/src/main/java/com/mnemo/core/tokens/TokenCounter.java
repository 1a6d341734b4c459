package com.mnemo.core.tokens;

/**
 * Counts tokens in text
 */
@FunctionalInterface
public interface TokenCounter {
    int count(String text);
}
