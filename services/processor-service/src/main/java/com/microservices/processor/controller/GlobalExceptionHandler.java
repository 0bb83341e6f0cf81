package com.microservices.processor.controller;

import com.microservices.processor.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(
            ResponseStatusException ex, HttpServletRequest request) {
        int statusCode = ex.getStatusCode().value();
        HttpStatus resolved = HttpStatus.resolve(statusCode);
        String error = resolved != null ? resolved.getReasonPhrase() : "Error";
        var body = new ErrorResponse(statusCode, error, ex.getReason(), request.getRequestURI(), Instant.now());
        return ResponseEntity.status(ex.getStatusCode()).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return badRequest("malformed JSON body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return badRequest("invalid value for parameter " + ex.getName(), request);
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleFrameworkException(
            Exception ex, HttpServletRequest request) {
        // all of these carry their own status
        var framework = (org.springframework.web.ErrorResponse) ex;
        int statusCode = framework.getStatusCode().value();
        HttpStatus resolved = HttpStatus.resolve(statusCode);
        String error = resolved != null ? resolved.getReasonPhrase() : "Error";
        String detail = framework.getBody().getDetail();
        var body = new ErrorResponse(statusCode, error, detail != null ? detail : ex.getMessage(),
                request.getRequestURI(), Instant.now());
        return ResponseEntity.status(framework.getStatusCode()).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(
            Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        var body = new ErrorResponse(
                500, "Internal Server Error", "An unexpected error occurred",
                request.getRequestURI(), Instant.now());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, HttpServletRequest request) {
        var body = new ErrorResponse(400, HttpStatus.BAD_REQUEST.getReasonPhrase(), message,
                request.getRequestURI(), Instant.now());
        return ResponseEntity.badRequest().body(body);
    }
}
