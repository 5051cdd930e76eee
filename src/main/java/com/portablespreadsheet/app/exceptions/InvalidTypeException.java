package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when the values of the operands cannot take part in an operation
 * (e.g., multiplying a string, or taking the minimum of an empty range).
 */
public class InvalidTypeException extends RuntimeException {
    public InvalidTypeException(String message) {
        super(message);
    }
}
