package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DownloaderType {
    TRANSMISSION("transmission", DownloadType.TORRENT, false),
    RTORRENT("rtorrent", DownloadType.TORRENT, true),
    QBITTORRENT("qbittorrent", DownloadType.TORRENT, true),
    SABNZBD("sabnzbd", DownloadType.USENET, true),
    NZBGET("nzbget", DownloadType.USENET, true);

    private final String id;
    private final DownloadType downloadType;
    private final boolean nativeCategories;

    DownloaderType(String id, DownloadType downloadType, boolean nativeCategories) {
        this.id = id;
        this.downloadType = downloadType;
        this.nativeCategories = nativeCategories;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public DownloadType getDownloadType() {
        return downloadType;
    }

    /**
     * Whether every item listed by this client can carry its own category.
     * Transmission only has labels set by whoever added the torrent, so an
     * unlabeled item there is not necessarily foreign.
     */
    public boolean hasNativeCategories() {
        return nativeCategories;
    }

    public boolean supports(DownloadType type) {
        return type == null || downloadType == type;
    }

    @JsonCreator
    public static DownloaderType fromId(String id) {
        for (DownloaderType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported downloader type: " + id);
    }
}
