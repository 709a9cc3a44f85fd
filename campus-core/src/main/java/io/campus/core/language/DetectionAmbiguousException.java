package io.campus.core.language;

public final class DetectionAmbiguousException extends Exception {

    public DetectionAmbiguousException(String message) {
        super(message);
    }
}
