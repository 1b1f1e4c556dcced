package com.example.downloaders.service;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadDetails;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadStatus;
import com.example.downloaders.utils.model.Downloader;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single entry point over every configured download client. Nothing thrown by
 * an adapter escapes: failures come back as results, empty values or zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloaderManager {

    private final DownloaderClientFactory clientFactory;
    private final Validator validator;
    private final ApplicationEventPublisher eventPublisher;

    public ActionResult testDownloader(Downloader downloader) {
        try {
            return clientFactory.create(downloader).testConnection();
        } catch (RuntimeException e) {
            log.error("Connection test of '{}' failed", downloader.getName(), e);
            return ActionResult.failed(describe(e));
        }
    }

    public AddResult addDownload(Downloader downloader, DownloadRequest request) {
        String invalid = validate(request);
        if (invalid != null) {
            return AddResult.failed(invalid);
        }
        try {
            return clientFactory.create(downloader).addDownload(request);
        } catch (DownloaderException | RuntimeException e) {
            log.error("Adding '{}' to '{}' failed: {}", request.getTitle(), downloader.getName(), describe(e));
            return AddResult.failed(describe(e));
        }
    }

    public Optional<DownloadStatus> getDownloadStatus(Downloader downloader, String id) {
        try {
            return clientFactory.create(downloader).getDownloadStatus(id);
        } catch (DownloaderException | RuntimeException e) {
            log.error("Status of {} on '{}' unavailable: {}", id, downloader.getName(), describe(e));
            return Optional.empty();
        }
    }

    public Optional<DownloadDetails> getDownloadDetails(Downloader downloader, String id) {
        try {
            return clientFactory.create(downloader).getDownloadDetails(id);
        } catch (DownloaderException | RuntimeException e) {
            log.error("Details of {} on '{}' unavailable: {}", id, downloader.getName(), describe(e));
            return Optional.empty();
        }
    }

    /**
     * Lists everything on the client, narrowed to the downloader's category when
     * one is configured.
     */
    public List<DownloadStatus> getAllDownloads(Downloader downloader) {
        List<DownloadStatus> all;
        try {
            all = clientFactory.create(downloader).getAllDownloads();
        } catch (DownloaderException | RuntimeException e) {
            log.error("Listing downloads of '{}' failed: {}", downloader.getName(), describe(e));
            return List.of();
        }

        String category = downloader.getCategory();
        if (category == null || category.isBlank()) {
            return all;
        }
        boolean keepUncategorized = !downloader.getType().hasNativeCategories();
        return all.stream()
                .filter(item -> item.getCategory() == null
                        ? keepUncategorized
                        : item.getCategory().equalsIgnoreCase(category))
                .collect(Collectors.toList());
    }

    public ActionResult pauseDownload(Downloader downloader, String id) {
        try {
            return clientFactory.create(downloader).pauseDownload(id);
        } catch (DownloaderException | RuntimeException e) {
            log.error("Pausing {} on '{}' failed: {}", id, downloader.getName(), describe(e));
            return ActionResult.failed(describe(e));
        }
    }

    public ActionResult resumeDownload(Downloader downloader, String id) {
        try {
            return clientFactory.create(downloader).resumeDownload(id);
        } catch (DownloaderException | RuntimeException e) {
            log.error("Resuming {} on '{}' failed: {}", id, downloader.getName(), describe(e));
            return ActionResult.failed(describe(e));
        }
    }

    public ActionResult removeDownload(Downloader downloader, String id, boolean deleteFiles) {
        try {
            return clientFactory.create(downloader).removeDownload(id, deleteFiles);
        } catch (DownloaderException | RuntimeException e) {
            log.error("Removing {} from '{}' failed: {}", id, downloader.getName(), describe(e));
            return ActionResult.failed(describe(e));
        }
    }

    public long getFreeSpace(Downloader downloader) {
        try {
            return clientFactory.create(downloader).getFreeSpace();
        } catch (DownloaderException | RuntimeException e) {
            log.error("Free space of '{}' unavailable: {}", downloader.getName(), describe(e));
            return 0;
        }
    }

    /**
     * Tries each compatible downloader in list order and stops at the first
     * success, an already-present download included. Callers sort by priority;
     * {@link #byPriority()} is there for that.
     */
    public AddResult addDownloadWithFallback(List<Downloader> downloaders, DownloadRequest request) {
        List<String> attempted = new ArrayList<>();
        if (downloaders == null || downloaders.isEmpty()) {
            return AddResult.failed("No downloaders available").toBuilder()
                    .attemptedDownloaders(attempted)
                    .build();
        }
        String invalid = validate(request);
        if (invalid != null) {
            return AddResult.failed(invalid).toBuilder().attemptedDownloaders(attempted).build();
        }

        List<Downloader> compatible = downloaders.stream()
                .filter(d -> d.getType() != null && d.getType().supports(request.getDownloadType()))
                .collect(Collectors.toList());
        if (compatible.isEmpty()) {
            String type = request.getDownloadType() != null ? request.getDownloadType().getId() : "unknown";
            return AddResult.failed("No downloaders available for download type: " + type)
                    .toBuilder()
                    .attemptedDownloaders(attempted)
                    .build();
        }

        List<String> errors = new ArrayList<>();
        for (Downloader downloader : compatible) {
            attempted.add(downloader.getName());
            AddResult result = addDownload(downloader, request);
            eventPublisher.publishEvent(new FallbackAttemptEvent(this, downloader.getId(), downloader.getName(),
                    request.getTitle(), result.getOutcome(), result.getMessage()));

            if (result.isSuccess()) {
                log.info("'{}' handled by '{}' after {} attempt(s): {}",
                        request.getTitle(), downloader.getName(), attempted.size(), result.getOutcome());
                return result.toBuilder()
                        .downloaderId(downloader.getId())
                        .downloaderName(downloader.getName())
                        .attemptedDownloaders(attempted)
                        .build();
            }
            log.warn("'{}' rejected '{}': {}", downloader.getName(), request.getTitle(), result.getMessage());
            errors.add(downloader.getName() + ": " + result.getMessage());
        }

        return AddResult.failed("All downloaders failed. Errors: " + String.join("; ", errors))
                .toBuilder()
                .attemptedDownloaders(attempted)
                .build();
    }

    /** Enabled downloaders first, then ascending priority. */
    public static Comparator<Downloader> byPriority() {
        return Comparator.comparing((Downloader d) -> !d.isEnabled())
                .thenComparingInt(Downloader::getPriority);
    }

    private String validate(DownloadRequest request) {
        if (request == null) {
            return "Download request is required";
        }
        Set<ConstraintViolation<DownloadRequest>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.joining(", "));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : "Unknown error";
    }
}
