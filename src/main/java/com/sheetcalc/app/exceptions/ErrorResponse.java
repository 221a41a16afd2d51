package com.sheetcalc.app.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "PARSE_ERROR",
 *   "message": "Unterminated string at position 4",
 *   "detail": "4"
 * }
 * The detail field (parse position, offending cell) is omitted when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String detail;

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public ErrorResponse(String code, String message, String detail) {
        this.code = code;
        this.message = message;
        this.detail = detail;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
