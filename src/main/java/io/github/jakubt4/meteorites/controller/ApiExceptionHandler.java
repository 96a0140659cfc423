package io.github.jakubt4.meteorites.controller;

import io.github.jakubt4.meteorites.dto.ErrorResponse;
import io.github.jakubt4.meteorites.exception.DatasetUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps read-side failures to HTTP statuses for every controller.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DatasetUnavailableException.class)
    public ResponseEntity<ErrorResponse> datasetUnavailable(final DatasetUnavailableException e) {
        log.debug("Rejected read: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(final IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("REJECTED", e.getMessage()));
    }
}
