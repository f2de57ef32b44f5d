package com.a2dd.core.conversion;

/**
 * Thrown for known gaps in module translation (e.g. {@code force: false} on copy).
 */
public class NotImplementedYetException extends ConversionException {

    public NotImplementedYetException(String message) {
        super(message);
    }
}
