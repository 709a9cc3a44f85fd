package io.campus.core.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tracks one message through the pipeline. Stages only move forward one step at a time.
 */
public final class PipelineRun {
    private final String sessionId;
    private final Clock clock;
    private final Instant startedAt;
    private final Map<PipelineStage, Duration> timings = new EnumMap<>(PipelineStage.class);
    private PipelineStage stage = PipelineStage.RECEIVED;
    private Instant stageStartedAt;

    public PipelineRun(String sessionId, Clock clock) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.stageStartedAt = startedAt;
    }

    public void advance(PipelineStage next) {
        if (next.ordinal() != stage.ordinal() + 1) {
            throw new IllegalStateException("Cannot move session " + sessionId + " from " + stage + " to " + next);
        }
        Instant now = clock.instant();
        timings.put(next, Duration.between(stageStartedAt, now));
        stage = next;
        stageStartedAt = now;
    }

    public PipelineStage stage() {
        return stage;
    }

    public boolean completed() {
        return stage == PipelineStage.COMPLETED;
    }

    public Map<PipelineStage, Duration> timings() {
        return Collections.unmodifiableMap(timings);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }
}
