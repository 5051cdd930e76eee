package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when an expression request names an unknown operation
 * or has the wrong arguments for its operation.
 */
public class InvalidExpressionException extends RuntimeException {
    public InvalidExpressionException(String message) {
        super(message);
    }
}
