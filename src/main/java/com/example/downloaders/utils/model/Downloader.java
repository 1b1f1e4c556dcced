package com.example.downloaders.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A configured download client endpoint. Owned and persisted by the host
 * application; treated as read-only for the duration of one operation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Downloader {
    private String id;
    private String name;
    private DownloaderType type;

    /** Host, optionally with scheme and path. */
    private String url;
    private Integer port;
    private boolean useSsl;
    private String urlPath;

    private String username;
    @ToString.Exclude
    private String password;

    @Builder.Default
    private boolean enabled = true;
    /** Lower is tried first. */
    @Builder.Default
    private int priority = 1;

    private String downloadPath;
    private String category;
    private boolean addStopped;
    private boolean removeCompleted;
    private String postImportCategory;

    /** Client-specific JSON, e.g. {@code {"initialState":"force-started"}}. */
    private String settings;

    public boolean hasCredentials() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }
}
