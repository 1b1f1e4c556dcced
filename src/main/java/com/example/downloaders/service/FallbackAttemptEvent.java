package com.example.downloaders.service;

import com.example.downloaders.utils.model.AddOutcome;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published once per downloader tried by {@link DownloaderManager#addDownloadWithFallback}. */
@Getter
public class FallbackAttemptEvent extends ApplicationEvent {
    private final String downloaderId;
    private final String downloaderName;
    private final String title;
    private final AddOutcome outcome;
    private final String message;

    public FallbackAttemptEvent(Object source, String downloaderId, String downloaderName, String title,
                                AddOutcome outcome, String message) {
        super(source);
        this.downloaderId = downloaderId;
        this.downloaderName = downloaderName;
        this.title = title;
        this.outcome = outcome;
        this.message = message;
    }
}
