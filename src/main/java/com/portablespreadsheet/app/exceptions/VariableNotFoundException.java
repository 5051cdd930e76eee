package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when a sheet is asked for a variable name it doesn't define.
 */
public class VariableNotFoundException extends RuntimeException {
    public VariableNotFoundException(String message) {
        super(message);
    }
}
