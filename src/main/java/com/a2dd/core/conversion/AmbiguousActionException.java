package com.a2dd.core.conversion;

/**
 * Thrown when a task carries more than one candidate module key.
 */
public class AmbiguousActionException extends ConversionException {

    public AmbiguousActionException(String message) {
        super(message);
    }
}
