package com.mnemo.core.jobs;

public enum TriggerReason {
    TOKEN_PRESSURE,
    SESSION_END,
    MANUAL,
}
