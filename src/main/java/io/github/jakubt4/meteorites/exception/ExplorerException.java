package io.github.jakubt4.meteorites.exception;

/**
 * Base type for failures of the ingestion and query pipeline.
 */
public abstract class ExplorerException extends RuntimeException {

    protected ExplorerException(final String message) {
        super(message);
    }

    protected ExplorerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
