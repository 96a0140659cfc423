package io.github.jakubt4.meteorites.client;

/**
 * Wire format of the remote dataset endpoint.
 */
public enum SourceFormat {
    /** Socrata JSON: an array of objects, null fields omitted. */
    JSON,
    /** Header row followed by comma-separated rows. */
    CSV
}
