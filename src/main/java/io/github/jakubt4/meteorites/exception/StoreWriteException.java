package io.github.jakubt4.meteorites.exception;

/**
 * Persisting the dataset to the local cache failed. The previous cache file is left untouched.
 */
public class StoreWriteException extends ExplorerException {

    public StoreWriteException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
