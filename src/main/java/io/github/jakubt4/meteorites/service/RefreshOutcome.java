package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.RefreshState;

/**
 * Result of a staleness check or refresh.
 *
 * @param state    dataset state after the attempt
 * @param status   what the attempt did
 * @param rowCount records in the snapshot published after the attempt, {@code 0} when none
 * @param message  human-readable detail
 */
public record RefreshOutcome(RefreshState state, Status status, int rowCount, String message) {

    public enum Status {
        /** A new dataset was fetched, cached and published. */
        REFRESHED,
        /** A new dataset was published but could not be written to the local cache. */
        REFRESHED_NOT_CACHED,
        /** The current dataset was kept; nothing was fetched. */
        UNCHANGED,
        /** Fetching or validating a replacement failed; any existing dataset was kept. */
        FAILED
    }

    public boolean failed() {
        return status == Status.FAILED;
    }
}
