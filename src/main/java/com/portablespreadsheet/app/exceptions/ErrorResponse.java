package com.portablespreadsheet.app.exceptions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every error reply, e.g.
 * { "code": "NOT_ANCHORED", "message": "Operation reference needs an anchored cell" }
 */
public final class ErrorResponse {
    private final String code;
    private final String message;

    @JsonCreator
    public ErrorResponse(@JsonProperty("code") String code, @JsonProperty("message") String message) {
        this.code = code;
        this.message = message;
    }

    static ErrorResponse of(String code, RuntimeException ex) {
        return new ErrorResponse(code, ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
