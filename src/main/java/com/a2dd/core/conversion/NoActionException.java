package com.a2dd.core.conversion;

/**
 * Thrown when a task has no key that could name its module.
 */
public class NoActionException extends ConversionException {

    public NoActionException(String message) {
        super(message);
    }
}
