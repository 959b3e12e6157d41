package com.concierge.app.rest;

import com.concierge.core.exception.ConciergeException;
import com.concierge.core.exception.DuplicateScheduleException;
import com.concierge.core.exception.InvalidCronExpressionException;
import com.concierge.core.exception.InvalidStateTransitionException;
import com.concierge.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps core exceptions to HTTP responses carrying the error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DuplicateScheduleException.class, InvalidStateTransitionException.class})
    public ResponseEntity<ErrorResponse> conflict(ConciergeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(InvalidCronExpressionException.class)
    public ResponseEntity<ErrorResponse> invalidCron(InvalidCronExpressionException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(ConciergeException.class)
    public ResponseEntity<ErrorResponse> other(ConciergeException e) {
        log.error("Unhandled {}: {}", e.getErrorCode(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ConciergeException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
