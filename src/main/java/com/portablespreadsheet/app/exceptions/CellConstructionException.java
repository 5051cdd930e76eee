package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when a cell is given a row without a column or vice versa,
 * or when coordinates are negative.
 */
public class CellConstructionException extends RuntimeException {
    public CellConstructionException(String message) {
        super(message);
    }
}
