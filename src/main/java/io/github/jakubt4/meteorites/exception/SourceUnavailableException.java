package io.github.jakubt4.meteorites.exception;

/**
 * The remote dataset could not be read: timeout, transport error, non-2xx status or
 * an unreadable body. No partial data accompanies this failure.
 */
public class SourceUnavailableException extends ExplorerException {

    public SourceUnavailableException(final String message) {
        super(message);
    }

    public SourceUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
