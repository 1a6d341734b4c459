package com.mnemo.core.conversation;

public enum TurnRole {
    USER,
    ASSISTANT,
    SYSTEM,
}
