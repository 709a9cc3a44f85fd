package io.campus.core.generation;

import io.campus.core.context.Prompt;

public interface GenerationClient {
    /**
     * Never throws. Failures come back as a degraded outcome carrying the fallback text.
     */
    GenerationOutcome generate(Prompt prompt);
}
