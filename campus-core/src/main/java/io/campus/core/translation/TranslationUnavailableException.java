package io.campus.core.translation;

public final class TranslationUnavailableException extends Exception {

    public TranslationUnavailableException(String message) {
        super(message);
    }

    public TranslationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
