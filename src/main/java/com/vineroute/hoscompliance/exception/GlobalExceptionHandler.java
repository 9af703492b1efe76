package com.vineroute.hoscompliance.exception;

import com.vineroute.hoscompliance.dto.ApiResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps the compliance error taxonomy onto HTTP responses.
 *
 *   CONFLICT   → 409   (AlreadyClockedIn, VehicleInUse, NoOpenTimeCard, ...)
 *   VALIDATION → 400   (InvalidCoordinate, ClockOutBeforeClockIn, ...)
 *   NOT_FOUND  → 404
 *   STORAGE    → 503   (internal cause is logged, never returned)
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ComplianceException.class)
    public ResponseEntity<ApiResponse> handleComplianceException(ComplianceException ex) {
        ErrorCategory category = ex.getCategory();
        if (category == ErrorCategory.STORAGE) {
            log.error("{}: {}", ex.getErrorCode(), ex.getMessage(), ex.getCause());
        } else {
            log.warn("{} ({}): {}", ex.getErrorCode(), category, ex.getMessage());
        }
        return ResponseEntity.status(category.getHttpStatus())
                .body(ApiResponse.error(ex.getErrorCode(), ex.getMessage()));
    }

    /**
     * Handle validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        log.warn("Request validation failed: {} field error(s)", ex.getBindingResult().getErrorCount());

        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ApiResponse response = ApiResponse.builder()
                .success(false)
                .errorCode("ValidationFailed")
                .message("Validation failed")
                .data(errors)
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Element-level failures inside a validated collection body, e.g. one
     * waypoint of a batch without a timestamp. Keys look like "requests[1].timestamp".
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse> handleConstraintViolations(ConstraintViolationException ex) {
        log.warn("Request validation failed: {} constraint violation(s)", ex.getConstraintViolations().size());

        Map<String, String> errors = new TreeMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            errors.put(parameterPath(violation.getPropertyPath().toString()), violation.getMessage());
        }
        return validationFailed(errors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        log.warn("Request validation failed: {} error(s)", ex.getAllErrors().size());

        Map<String, String> errors = new TreeMap<>();
        ex.getAllValidationResults().forEach(result -> result.getResolvableErrors().forEach(error -> {
            String parameter = result.getMethodParameter().getParameterName();
            String key = error instanceof FieldError
                    ? parameter + "[" + result.getContainerIndex() + "]." + ((FieldError) error).getField()
                    : parameter;
            errors.put(key, error.getDefaultMessage());
        }));
        return validationFailed(errors);
    }

    private static ResponseEntity<ApiResponse> validationFailed(Map<String, String> errors) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.builder()
                .success(false)
                .errorCode("ValidationFailed")
                .message("Validation failed")
                .data(errors)
                .build());
    }

    /** Drops the leading method name from a method-validation path */
    private static String parameterPath(String path) {
        int dot = path.indexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse> handleUnreadableRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.error("MalformedRequest", "Malformed request"));
    }

    /**
     * Storage failures that escaped a service boundary. The exception text may
     * contain SQL or table names, so only a generic message is returned.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse> handleDataAccessException(DataAccessException ex) {
        log.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error("StorageUnavailable", "Storage unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("InternalError", "An unexpected error occurred"));
    }

}
