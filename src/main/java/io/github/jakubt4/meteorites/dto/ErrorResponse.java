package io.github.jakubt4.meteorites.dto;

/**
 * Body returned when a request cannot be served.
 *
 * @param status  short machine-readable outcome, e.g. {@code "UNAVAILABLE"} or {@code "REJECTED"}
 * @param message human-readable detail
 */
public record ErrorResponse(String status, String message) {
}
