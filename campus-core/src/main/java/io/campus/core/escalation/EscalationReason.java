package io.campus.core.escalation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationReason {
    GENERATION_FAILURE("generation_failure"),
    LOW_CONFIDENCE("low_confidence"),
    EXPLICIT_REQUEST("explicit_request");

    private final String code;

    EscalationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static EscalationReason fromCode(String code) {
        for (EscalationReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown escalation reason: " + code);
    }
}
