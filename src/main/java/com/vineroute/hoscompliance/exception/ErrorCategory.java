package com.vineroute.hoscompliance.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy of the compliance core.
 * Each category maps to exactly one HTTP status in GlobalExceptionHandler.
 */
public enum ErrorCategory {

    /** User-correctable state conflict (already clocked in, vehicle in use, ...) */
    CONFLICT(HttpStatus.CONFLICT),

    /** Request rejected as invalid, no state was applied */
    VALIDATION(HttpStatus.BAD_REQUEST),

    /** Referenced driver, vehicle or time card does not exist */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Storage layer failed (connectivity, unexpected constraint) */
    STORAGE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorCategory(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
