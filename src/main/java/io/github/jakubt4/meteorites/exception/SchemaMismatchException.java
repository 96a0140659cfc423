package io.github.jakubt4.meteorites.exception;

import java.util.Set;

/**
 * The upstream response lacks fields the normalizer depends on, or carries no rows at all.
 * Fatal to the refresh attempt that received it.
 */
public class SchemaMismatchException extends ExplorerException {

    private final Set<String> missingFields;

    public SchemaMismatchException(final String message, final Set<String> missingFields) {
        super(message);
        this.missingFields = Set.copyOf(missingFields);
    }

    public Set<String> getMissingFields() {
        return missingFields;
    }
}
