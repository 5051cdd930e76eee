package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when a grammar table is malformed, or when a notation name
 * is registered twice or removed without being registered.
 */
public class GrammarException extends RuntimeException {
    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
