package io.github.jakubt4.meteorites.service;

/**
 * Offset/limit window over a filtered result.
 *
 * @param offset first row to return, zero-based, {@code >= 0}
 * @param limit  maximum rows to return, {@code > 0}
 */
public record PageRequest(int offset, int limit) {

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got " + limit);
        }
    }

    public static PageRequest of(final int offset, final int limit) {
        return new PageRequest(offset, limit);
    }
}
