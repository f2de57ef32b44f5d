package com.a2dd.core.conversion;

/**
 * Thrown for source constructs the converter rejects outright, such as roles inside a play
 * or a copy with inline content.
 */
public class UnsupportedConstructException extends ConversionException {

    public UnsupportedConstructException(String message) {
        super(message);
    }

    public UnsupportedConstructException(String message, Throwable cause) {
        super(message, cause);
    }
}
