package io.tabletree.core;

public class UnserializationException extends TableTreeException {

    public UnserializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnserializationException(String message) {
        super(message);
    }
}
