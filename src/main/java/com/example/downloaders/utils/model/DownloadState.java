package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed status vocabulary every adapter maps its native state machine onto.
 */
public enum DownloadState {
    DOWNLOADING,
    SEEDING,
    COMPLETED,
    PAUSED,
    ERROR,
    REPAIRING,
    UNPACKING;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
