package io.campus.core.escalation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EscalationStatus {
    PENDING,
    RESOLVED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EscalationStatus fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
