package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Par2 verification/repair state of a usenet download. */
public enum RepairStatus {
    GOOD, REPAIRING, FAILED;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
