package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UnpackStatus {
    UNPACKING, COMPLETED, FAILED;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
