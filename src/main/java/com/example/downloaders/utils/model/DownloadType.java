package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transport family of a release. Only used to pick compatible downloaders during fallback.
 */
public enum DownloadType {
    TORRENT("torrent"),
    USENET("usenet");

    private final String id;

    DownloadType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static DownloadType fromId(String id) {
        for (DownloadType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown download type: " + id);
    }
}
