package io.github.jakubt4.meteorites.exception;

/**
 * Raised to readers when no dataset has ever been loaded.
 */
public class DatasetUnavailableException extends ExplorerException {

    public DatasetUnavailableException() {
        super("Meteorite dataset is not available yet");
    }
}
