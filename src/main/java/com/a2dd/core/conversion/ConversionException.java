package com.a2dd.core.conversion;

/**
 * Base type for errors that abort a conversion. No output is produced once one is thrown.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
