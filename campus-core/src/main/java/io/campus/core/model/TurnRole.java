package io.campus.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static TurnRole fromWire(String value) {
        for (TurnRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown turn role: " + value);
    }
}
