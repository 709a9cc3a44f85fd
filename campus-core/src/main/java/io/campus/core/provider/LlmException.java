package io.campus.core.provider;

/**
 * Failure of a language-model call. Transient failures (timeouts, rate limits, 5xx) may be retried;
 * anything else means the same request will keep failing.
 */
public final class LlmException extends Exception {
    private final boolean transientFailure;
    private final int statusCode;

    private LlmException(String message, boolean transientFailure, int statusCode, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public static LlmException transientFailure(String message, int statusCode, Throwable cause) {
        return new LlmException(message, true, statusCode, cause);
    }

    public static LlmException fatal(String message, int statusCode, Throwable cause) {
        return new LlmException(message, false, statusCode, cause);
    }

    public static LlmException forStatus(int statusCode, String body) {
        String message = "HTTP " + statusCode + (body == null || body.isBlank() ? "" : " " + truncate(body));
        return isRetryableStatus(statusCode)
            ? transientFailure(message, statusCode, null)
            : fatal(message, statusCode, null);
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public boolean transientFailure() {
        return transientFailure;
    }

    /**
     * HTTP status of the failed call, or {@code -1} when the failure happened before a response arrived.
     */
    public int statusCode() {
        return statusCode;
    }

    private static String truncate(String value) {
        return value.length() <= 300 ? value : value.substring(0, 300) + "...";
    }
}
