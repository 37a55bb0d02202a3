package com.wheelskills.progress.api;

import com.wheelskills.progress.api.ApiModels.ApiError;
import com.wheelskills.progress.error.InvalidStateException;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps failures to {@code {error, message, timestamp}} bodies. Internal failures are
 * logged and answered without details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> notFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiError> invalidState(InvalidStateException ex) {
        return body(HttpStatus.CONFLICT, "invalid_state", ex.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> validation(ValidationException ex) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> malformed(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception ex) {
        if (ex instanceof ErrorResponse response && response.getStatusCode().is4xxClientError()) {
            // unknown route, unsupported method or media type
            return body(response.getStatusCode(), "request_error", ex.getMessage());
        }
        log.error("Unhandled failure", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static ResponseEntity<ApiError> body(HttpStatusCode status, String error, String message) {
        return ResponseEntity.status(status).body(new ApiError(error, message, Instant.now()));
    }
}
