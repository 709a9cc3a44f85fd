package io.campus.core.escalation;

import io.campus.core.generation.GenerationOutcome;
import io.campus.core.retrieval.RetrievedChunk;
import java.util.List;

/**
 * Maps retrieval strength to a confidence in [0, 1]. Any non-empty retrieval scores above the empty floor,
 * and the result only grows with the top score.
 */
public final class ConfidenceScorer {
    static final double EMPTY_FLOOR = 0.2;
    static final double BASE = 0.3;
    static final double SPAN = 0.7;
    static final double DEGRADED_FACTOR = 0.5;

    public double score(List<RetrievedChunk> chunks, GenerationOutcome outcome) {
        double confidence;
        if (chunks == null || chunks.isEmpty()) {
            confidence = EMPTY_FLOOR;
        } else {
            double top = 0.0;
            for (RetrievedChunk chunk : chunks) {
                top = Math.max(top, chunk.score());
            }
            confidence = BASE + SPAN * clamp(top);
        }
        if (outcome != null && outcome.degraded()) {
            confidence *= DEGRADED_FACTOR;
        }
        return clamp(confidence);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
