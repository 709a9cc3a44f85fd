package io.campus.core.pipeline;

public enum PipelineStage {
    RECEIVED,
    LANGUAGE_RESOLVED,
    RETRIEVED,
    CONTEXT_BUILT,
    GENERATED,
    TRANSLATED,
    SCORED,
    PERSISTED,
    COMPLETED
}
