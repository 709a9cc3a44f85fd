package io.campus.core.pipeline;

public final class StageException extends Exception {
    private final String stage;
    private final boolean timedOut;

    private StageException(String stage, String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.timedOut = timedOut;
    }

    public static StageException timeout(String stage, long timeoutMs) {
        return new StageException(stage, stage + " timed out after " + timeoutMs + "ms", true, null);
    }

    public static StageException failed(String stage, Throwable cause) {
        String detail = cause == null ? "unknown failure" : cause.getMessage();
        return new StageException(stage, stage + " failed: " + detail, false, cause);
    }

    public String stage() {
        return stage;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
