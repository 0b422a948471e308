package io.tabletree.core;

/**
 * Thrown when a "simple" array cannot be mapped to rows without losing information.
 */
public class ConversionException extends TableTreeException {

    public ConversionException(String message) {
        super(message);
    }
}
