package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when coordinates fall outside the grid of a sheet.
 * For example, "Cell (12, 3) is outside of a 10x5 sheet".
 */
public class CellNotFoundException extends RuntimeException {
    public CellNotFoundException(String message) {
        super(message);
    }
}
