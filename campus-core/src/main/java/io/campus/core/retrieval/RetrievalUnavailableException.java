package io.campus.core.retrieval;

public final class RetrievalUnavailableException extends Exception {

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
