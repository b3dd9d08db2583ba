package com.visaflow.api.rest;

import com.visaflow.core.exception.CollaboratorUnavailableException;
import com.visaflow.core.exception.DefinitionInvalidException;
import com.visaflow.core.exception.NotFoundException;
import com.visaflow.core.exception.OptimisticLockException;
import com.visaflow.core.exception.VisaflowException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps engine exceptions to HTTP responses with a {@code {errorCode, message, timestamp}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String BAD_REQUEST = "BAD_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request);
    }

    @ExceptionHandler(DefinitionInvalidException.class)
    public ResponseEntity<ErrorResponse> handleDefinitionInvalid(DefinitionInvalidException e, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, request);
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(CollaboratorUnavailableException e, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, request);
    }

    @ExceptionHandler(OptimisticLockException.class)
    public ResponseEntity<ErrorResponse> handleConflict(OptimisticLockException e, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, e, request);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        log.warn("HTTP 400 {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(BAD_REQUEST, e.getMessage(), Instant.now()));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, VisaflowException e, HttpServletRequest request) {
        log.warn("HTTP {} {} {}: [{}] {}", status.value(), request.getMethod(), request.getRequestURI(),
            e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Instant.now()));
    }

    public record ErrorResponse(
        String errorCode,
        String message,
        Instant timestamp
    ) {}
}
