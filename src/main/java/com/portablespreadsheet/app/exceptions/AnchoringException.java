package com.portablespreadsheet.app.exceptions;

/**
 * Thrown when an operation needs a cell bound to a grid position
 * (reference, offset, aggregate range endpoints) but receives a cell
 * that is not anchored.
 */
public class AnchoringException extends RuntimeException {
    public AnchoringException(String message) {
        super(message);
    }
}
