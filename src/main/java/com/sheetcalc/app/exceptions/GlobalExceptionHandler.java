package com.sheetcalc.app.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns exceptions from the controllers, services and formula engine into
 * error JSON with a 4xx code where the caller is at fault.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FormulaParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(FormulaParseException ex) {
        ErrorResponse error = new ErrorResponse("PARSE_ERROR", ex.getMessage(), String.valueOf(ex.getPosition()));
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex) {
        ErrorResponse error = new ErrorResponse("CIRCULAR_REFERENCE", ex.getMessage(), ex.getCell().toString());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RecursionLimitException.class)
    public ResponseEntity<ErrorResponse> handleRecursionLimit(RecursionLimitException ex) {
        return new ResponseEntity<>(new ErrorResponse("RECURSION_LIMIT", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(UnknownFunctionException.class)
    public ResponseEntity<ErrorResponse> handleUnknownFunction(UnknownFunctionException ex) {
        ErrorResponse error = new ErrorResponse("UNKNOWN_FUNCTION", ex.getMessage(), ex.getFunctionName());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({InvalidCellReferenceException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException ex) {
        String code = ex instanceof InvalidCellReferenceException ? "INVALID_CELL_REFERENCE" : "BAD_REQUEST";
        return new ResponseEntity<>(new ErrorResponse(code, ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex) {
        return new ResponseEntity<>(new ErrorResponse("WORKBOOK_NOT_FOUND", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return new ResponseEntity<>(new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for anything not handled above
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
