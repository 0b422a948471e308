package io.tabletree.core;

public class TableTreeException extends RuntimeException {

    public TableTreeException(Throwable cause) {
        super(cause);
    }

    public TableTreeException(String message, Throwable cause) {
        super(message, cause);
    }

    public TableTreeException(String message) {
        super(message);
    }

}
