package com.astradesk.helpdesk.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.astradesk.helpdesk.error.HelpdeskException;
import com.astradesk.helpdesk.web.dto.ErrorResponse;

/**
 * Translates failures into {@code {"error": ..., "status": ...}} bodies. Domain
 * exceptions carry their own status and reason; storage failures never leak
 * their message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HelpdeskException.class)
    public ResponseEntity<ErrorResponse> handleHelpdesk(HelpdeskException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        }
        return respond(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException ex) {
        FieldError fieldError = ex.getFieldError();
        String reason = fieldError == null
            ? "invalid request"
            : fieldError.getField() + " " + fieldError.getDefaultMessage();
        return respond(HttpStatus.BAD_REQUEST, reason);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid request");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Database access failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String reason) {
        return ResponseEntity.status(status).body(new ErrorResponse(reason, status.value()));
    }
}
