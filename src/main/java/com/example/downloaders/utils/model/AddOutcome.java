package com.example.downloaders.utils.model;

/**
 * What an add call actually achieved. Fallback stops on every outcome but {@link #FAILED}.
 */
public enum AddOutcome {
    /** Accepted and identified by the client. */
    ADDED,
    /** The client already had it; nothing new was queued, which still counts as success. */
    ALREADY_EXISTS,
    /** Accepted, but no usable id could be obtained. */
    ADDED_UNVERIFIED,
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
