package io.campus.core.escalation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a turn goes to a human. Degraded generation wins over low confidence, which wins over an
 * explicit request.
 */
public final class EscalationPolicy {
    private final double confidenceThreshold;
    private final List<Pattern> patterns;

    public EscalationPolicy(double confidenceThreshold, List<String> escalationPatterns) {
        this.confidenceThreshold = confidenceThreshold;
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : escalationPatterns == null ? List.<String>of() : escalationPatterns) {
            if (pattern != null && !pattern.isBlank()) {
                compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    /**
     * @param messageTexts the student's text in every form available (original and pivot)
     */
    public EscalationDecision decide(double confidence, boolean generationDegraded, List<String> messageTexts) {
        if (generationDegraded) {
            return EscalationDecision.escalate(EscalationReason.GENERATION_FAILURE);
        }
        if (confidence < confidenceThreshold) {
            return EscalationDecision.escalate(EscalationReason.LOW_CONFIDENCE);
        }
        if (requestsHuman(messageTexts)) {
            return EscalationDecision.escalate(EscalationReason.EXPLICIT_REQUEST);
        }
        return EscalationDecision.none();
    }

    public boolean requestsHuman(List<String> messageTexts) {
        for (String text : messageTexts == null ? List.<String>of() : messageTexts) {
            if (text == null) {
                continue;
            }
            for (Pattern pattern : patterns) {
                if (pattern.matcher(text).find()) {
                    return true;
                }
            }
        }
        return false;
    }
}
