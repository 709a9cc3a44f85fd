package io.campus.core.model;

public final class InvalidChatRequestException extends IllegalArgumentException {
    private final String field;

    public InvalidChatRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
