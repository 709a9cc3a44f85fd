package io.campus.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
