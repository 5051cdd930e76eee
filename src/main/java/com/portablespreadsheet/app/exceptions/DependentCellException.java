package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when a row or column cannot be deleted because other cells
 * were computed from it. The sheet is left unchanged.
 */
public class DependentCellException extends RuntimeException {
    public DependentCellException(String message) {
        super(message);
    }
}
