package com.example.downloaders.service;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.service.client.DownloaderClient;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddOutcome;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadState;
import com.example.downloaders.utils.model.DownloadStatus;
import com.example.downloaders.utils.model.DownloadType;
import com.example.downloaders.utils.model.Downloader;
import com.example.downloaders.utils.model.DownloaderType;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloaderManagerTest {

    private static ValidatorFactory validatorFactory;

    @Mock
    private DownloaderClientFactory clientFactory;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private DownloaderClient first;
    @Mock
    private DownloaderClient second;
    @Mock
    private DownloaderClient third;

    private DownloaderManager manager;

    @BeforeAll
    static void buildValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        Validator validator = validatorFactory.getValidator();
        manager = new DownloaderManager(clientFactory, validator, eventPublisher);
    }

    private static Downloader downloader(String id, DownloaderType type, int priority) {
        return Downloader.builder().id(id).name(id + "-name").type(type).priority(priority)
                .url("http://localhost").build();
    }

    private static DownloadRequest request(DownloadType type) {
        return DownloadRequest.builder().url("magnet:?xt=urn:btih:abc").title("Some Game").downloadType(type).build();
    }

    @Test
    void fallsThroughToFirstSuccess() throws Exception {
        Downloader a = downloader("a", DownloaderType.TRANSMISSION, 1);
        Downloader b = downloader("b", DownloaderType.QBITTORRENT, 2);
        Downloader c = downloader("c", DownloaderType.RTORRENT, 3);
        when(clientFactory.create(a)).thenReturn(first);
        when(clientFactory.create(b)).thenReturn(second);
        when(clientFactory.create(c)).thenReturn(third);
        when(first.addDownload(any())).thenThrow(DownloaderException.transport("Connection refused", null));
        when(second.addDownload(any())).thenReturn(AddResult.failed("Disk full"));
        when(third.addDownload(any())).thenReturn(AddResult.added("HASH", "Torrent added successfully"));

        AddResult result = manager.addDownloadWithFallback(List.of(a, b, c), request(DownloadType.TORRENT));

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.ADDED);
        assertThat(result.getId()).isEqualTo("HASH");
        assertThat(result.getDownloaderId()).isEqualTo("c");
        assertThat(result.getDownloaderName()).isEqualTo("c-name");
        assertThat(result.getAttemptedDownloaders()).containsExactly("a-name", "b-name", "c-name");
        verify(eventPublisher, times(3)).publishEvent(any(FallbackAttemptEvent.class));
    }

    @Test
    void alreadyPresentStopsTheLoop() throws Exception {
        Downloader a = downloader("a", DownloaderType.SABNZBD, 1);
        Downloader b = downloader("b", DownloaderType.NZBGET, 2);
        when(clientFactory.create(a)).thenReturn(first);
        when(first.addDownload(any())).thenReturn(AddResult.alreadyExists(null, "NZB already exists"));

        AddResult result = manager.addDownloadWithFallback(List.of(a, b), request(DownloadType.USENET));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(AddOutcome.ALREADY_EXISTS);
        assertThat(result.getAttemptedDownloaders()).containsExactly("a-name");
        verify(clientFactory, never()).create(b);
    }

    @Test
    void allFailedListsEveryError() throws Exception {
        Downloader a = downloader("a", DownloaderType.SABNZBD, 1);
        Downloader b = downloader("b", DownloaderType.NZBGET, 2);
        when(clientFactory.create(a)).thenReturn(first);
        when(clientFactory.create(b)).thenReturn(second);
        when(first.addDownload(any())).thenReturn(AddResult.failed("Failed to add NZB: bad category"));
        when(second.addDownload(any())).thenThrow(DownloaderException.authentication("Authentication failed"));

        AddResult result = manager.addDownloadWithFallback(List.of(a, b), request(DownloadType.USENET));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo(
                "All downloaders failed. Errors: a-name: Failed to add NZB: bad category; b-name: Authentication failed");
        assertThat(result.getAttemptedDownloaders()).containsExactly("a-name", "b-name");
    }

    @Test
    void incompatibleTypeFailsWithoutAttempts() {
        List<Downloader> torrentOnly = List.of(
                downloader("a", DownloaderType.TRANSMISSION, 1),
                downloader("b", DownloaderType.QBITTORRENT, 2));

        AddResult result = manager.addDownloadWithFallback(torrentOnly, request(DownloadType.USENET));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("No downloaders available for download type: usenet");
        assertThat(result.getAttemptedDownloaders()).isEmpty();
        verifyNoInteractions(clientFactory, eventPublisher);
    }

    @Test
    void untypedRequestFitsEveryDownloader() throws Exception {
        Downloader nzb = downloader("n", DownloaderType.NZBGET, 1);
        when(clientFactory.create(nzb)).thenReturn(first);
        when(first.addDownload(any())).thenReturn(AddResult.added("5", "NZB added successfully"));

        AddResult result = manager.addDownloadWithFallback(List.of(nzb), request(null));

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void emptyListFails() {
        AddResult result = manager.addDownloadWithFallback(List.of(), request(DownloadType.TORRENT));

        assertThat(result.getMessage()).isEqualTo("No downloaders available");
        assertThat(result.getAttemptedDownloaders()).isEmpty();
    }

    @Test
    void invalidRequestIsRejectedBeforeAnyClient() {
        DownloadRequest blank = DownloadRequest.builder().url("").title("").build();

        AddResult result = manager.addDownload(downloader("a", DownloaderType.TRANSMISSION, 1), blank);

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.FAILED);
        assertThat(result.getMessage()).isEqualTo("Title is required, URL is required");
        verifyNoInteractions(clientFactory);
    }

    @Test
    void attemptEventsCarryOutcome() throws Exception {
        Downloader a = downloader("a", DownloaderType.TRANSMISSION, 1);
        when(clientFactory.create(a)).thenReturn(first);
        when(first.addDownload(any())).thenReturn(AddResult.unverified("Torrent added but could not be verified"));

        manager.addDownloadWithFallback(List.of(a), request(DownloadType.TORRENT));

        ArgumentCaptor<FallbackAttemptEvent> event = ArgumentCaptor.forClass(FallbackAttemptEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getDownloaderId()).isEqualTo("a");
        assertThat(event.getValue().getTitle()).isEqualTo("Some Game");
        assertThat(event.getValue().getOutcome()).isEqualTo(AddOutcome.ADDED_UNVERIFIED);
    }

    @Test
    void categoryFilterDropsForeignItems() throws Exception {
        Downloader qbit = downloader("q", DownloaderType.QBITTORRENT, 1).toBuilder().category("games").build();
        when(clientFactory.create(qbit)).thenReturn(first);
        when(first.getAllDownloads()).thenReturn(List.of(item("1", "games"), item("2", "movies"), item("3", null),
                item("4", "GAMES")));

        List<DownloadStatus> listed = manager.getAllDownloads(qbit);

        assertThat(listed).extracting(DownloadStatus::getId).containsExactly("1", "4");
    }

    @Test
    void transmissionKeepsUnlabeledItems() throws Exception {
        Downloader transmission = downloader("t", DownloaderType.TRANSMISSION, 1).toBuilder().category("games").build();
        when(clientFactory.create(transmission)).thenReturn(first);
        when(first.getAllDownloads()).thenReturn(List.of(item("1", "games"), item("2", "movies"), item("3", null)));

        List<DownloadStatus> listed = manager.getAllDownloads(transmission);

        assertThat(listed).extracting(DownloadStatus::getId).containsExactly("1", "3");
    }

    @Test
    void noCategoryListsEverything() throws Exception {
        Downloader sab = downloader("s", DownloaderType.SABNZBD, 1);
        when(clientFactory.create(sab)).thenReturn(first);
        when(first.getAllDownloads()).thenReturn(List.of(item("1", "games"), item("2", null)));

        assertThat(manager.getAllDownloads(sab)).hasSize(2);
    }

    @Test
    void adapterErrorsBecomeResults() throws Exception {
        Downloader a = downloader("a", DownloaderType.RTORRENT, 1);
        when(clientFactory.create(a)).thenReturn(first);
        when(first.pauseDownload("x")).thenThrow(DownloaderException.httpStatus(500));
        when(first.getAllDownloads()).thenThrow(new IllegalStateException("boom"));
        when(first.getDownloadStatus("x")).thenThrow(DownloaderException.protocol("garbage"));
        when(first.getFreeSpace()).thenThrow(DownloaderException.transport("timeout", null));

        ActionResult paused = manager.pauseDownload(a, "x");

        assertThat(paused.isSuccess()).isFalse();
        assertThat(paused.getMessage()).isEqualTo("HTTP 500: Internal Server Error");
        assertThat(manager.getAllDownloads(a)).isEmpty();
        assertThat(manager.getDownloadStatus(a, "x")).isEmpty();
        assertThat(manager.getFreeSpace(a)).isZero();
    }

    @Test
    void connectionTestSurvivesFactoryFailure() {
        Downloader untyped = Downloader.builder().name("broken").build();
        when(clientFactory.create(untyped)).thenThrow(new IllegalArgumentException("Downloader 'broken' has no type"));

        ActionResult result = manager.testDownloader(untyped);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Downloader 'broken' has no type");
    }

    @Test
    void priorityOrderPutsDisabledLast() {
        List<Downloader> downloaders = new ArrayList<>(List.of(
                downloader("low", DownloaderType.SABNZBD, 5),
                downloader("off", DownloaderType.SABNZBD, 0).toBuilder().enabled(false).build(),
                downloader("high", DownloaderType.NZBGET, 1)));

        downloaders.sort(DownloaderManager.byPriority());

        assertThat(downloaders).extracting(Downloader::getId).containsExactly("high", "low", "off");
    }

    private static DownloadStatus item(String id, String category) {
        return DownloadStatus.builder().id(id).name(id).status(DownloadState.DOWNLOADING).category(category).build();
    }
}
