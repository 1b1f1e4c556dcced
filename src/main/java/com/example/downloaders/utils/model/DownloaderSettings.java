package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Typed view of {@link Downloader#getSettings()}. Unknown keys are ignored. */
@Slf4j
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DownloaderSettings {
    public static final String STATE_STOPPED = "stopped";
    public static final String STATE_FORCE_STARTED = "force-started";

    /** "stopped", "force-started" or "default". */
    private String initialState;

    public static DownloaderSettings of(Downloader downloader, ObjectMapper objectMapper) {
        String json = downloader.getSettings();
        if (json == null || json.isBlank()) {
            return new DownloaderSettings();
        }
        try {
            DownloaderSettings settings = objectMapper.readValue(json, DownloaderSettings.class);
            return settings == null ? new DownloaderSettings() : settings;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable settings of downloader '{}': {}", downloader.getName(), e.getOriginalMessage());
            return new DownloaderSettings();
        }
    }

    public boolean isForceStarted() {
        return STATE_FORCE_STARTED.equalsIgnoreCase(initialState);
    }

    /** Whether new downloads should be added without starting. */
    public boolean addsStopped(Downloader downloader) {
        return downloader.isAddStopped() || STATE_STOPPED.equalsIgnoreCase(initialState);
    }
}
