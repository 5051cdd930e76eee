package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when a cell's style or description is assigned an invalid value,
 * or when a non-variable cell is used as a variable.
 */
public class InvalidCellAttributeException extends RuntimeException {
    public InvalidCellAttributeException(String message) {
        super(message);
    }
}
