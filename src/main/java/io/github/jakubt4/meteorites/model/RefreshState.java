package io.github.jakubt4.meteorites.model;

/**
 * Lifecycle of the in-memory dataset as seen by
 * {@link io.github.jakubt4.meteorites.service.DatasetRefreshService}.
 */
public enum RefreshState {
    /** No dataset available; reads are rejected. */
    COLD,
    /** Dataset present and considered current. */
    WARM,
    /** Dataset present but the upstream row count no longer matches it. */
    STALE
}
