package com.mnemo.core.privacy;

public enum SentimentLabel {
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    VOLATILE,
}
