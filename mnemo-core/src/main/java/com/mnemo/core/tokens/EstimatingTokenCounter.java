package com.mnemo.core.tokens;

import com.google.common.base.Strings;

/**
 * Cheap deterministic estimate of roughly four characters per token
 */
public class EstimatingTokenCounter implements TokenCounter {
    public static final int CHARS_PER_TOKEN = 4;

    @Override
    public int count(String text) {
        if (Strings.isNullOrEmpty(text)) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
