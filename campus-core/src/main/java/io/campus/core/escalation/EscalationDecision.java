package io.campus.core.escalation;

public record EscalationDecision(boolean escalate, EscalationReason reason) {
    private static final EscalationDecision NONE = new EscalationDecision(false, null);

    public EscalationDecision {
        if (escalate && reason == null) {
            throw new IllegalArgumentException("reason is required when escalating");
        }
        if (!escalate) {
            reason = null;
        }
    }

    public static EscalationDecision none() {
        return NONE;
    }

    public static EscalationDecision escalate(EscalationReason reason) {
        return new EscalationDecision(true, reason);
    }

    public String reasonCode() {
        return reason == null ? null : reason.code();
    }
}
