package com.portablespreadsheet.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches custom exceptions from anywhere in the controllers or services,
 * returning user-friendly error JSON with an HTTP 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CellConstructionException.class)
    public ResponseEntity<ErrorResponse> handleCellConstruction(CellConstructionException ex) {
        return error("CELL_CONSTRUCTION", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(AnchoringException.class)
    public ResponseEntity<ErrorResponse> handleAnchoring(AnchoringException ex) {
        return error("NOT_ANCHORED", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(GrammarException.class)
    public ResponseEntity<ErrorResponse> handleGrammar(GrammarException ex) {
        return error("INVALID_GRAMMAR", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidCellAttributeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAttribute(InvalidCellAttributeException ex) {
        return error("INVALID_ATTRIBUTE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidExpressionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidExpression(InvalidExpressionException ex) {
        return error("INVALID_EXPRESSION", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidTypeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidType(InvalidTypeException ex) {
        return error("INVALID_TYPE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(VariableNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleVariableNotFound(VariableNotFoundException ex) {
        return error("VARIABLE_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CellNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCellNotFound(CellNotFoundException ex) {
        return error("CELL_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return error("SHEET_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(DependentCellException.class)
    public ResponseEntity<ErrorResponse> handleDependentCells(DependentCellException ex) {
        return error("DEPENDENT_CELLS", ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions you haven't explicitly handled
        log.error("Unhandled exception", ex);
        ErrorResponse error = ErrorResponse.of("SERVER_ERROR", ex);
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> error(String code, RuntimeException ex, HttpStatus status) {
        log.debug("{}: {}", code, ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of(code, ex), status);
    }
}
