package com.example.downloaders.service;

import com.example.downloaders.config.ApplicationConfig;
import com.example.downloaders.service.client.DownloaderClient;
import com.example.downloaders.service.client.NzbgetClient;
import com.example.downloaders.service.client.QBittorrentClient;
import com.example.downloaders.service.client.RTorrentClient;
import com.example.downloaders.service.client.SabnzbdClient;
import com.example.downloaders.service.client.TransmissionClient;
import com.example.downloaders.utils.http.DownloaderHttp;
import com.example.downloaders.utils.http.RemoteFileFetcher;
import com.example.downloaders.utils.model.Downloader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

/**
 * Builds a fresh adapter per operation. Adapters hold session state (tokens,
 * cookies, Digest challenges) and are not shared between operations.
 */
@Component
@RequiredArgsConstructor
public class DownloaderClientFactory {

    private final ApplicationConfig config;
    private final HttpClient downloaderHttpClient;
    private final ThreadPoolTaskExecutor downloaderTaskExecutor;
    private final ObjectMapper objectMapper;

    public DownloaderClient create(Downloader downloader) {
        if (downloader.getType() == null) {
            throw new IllegalArgumentException("Downloader '" + downloader.getName() + "' has no type");
        }
        DownloaderHttp http = new DownloaderHttp(downloaderHttpClient, config.getRequestTimeout(), config.getUserAgent());
        RemoteFileFetcher fetcher = new RemoteFileFetcher(http, config.getMaxRedirects());

        switch (downloader.getType()) {
            case TRANSMISSION:
                return new TransmissionClient(downloader, http, fetcher, objectMapper);
            case RTORRENT:
                return new RTorrentClient(downloader, http, fetcher, objectMapper, downloaderTaskExecutor);
            case QBITTORRENT:
                return new QBittorrentClient(downloader, http, fetcher, objectMapper,
                        config.getVerifyDelay(), config.getRecentAddWindow());
            case SABNZBD:
                return new SabnzbdClient(downloader, http, objectMapper);
            case NZBGET:
                return new NzbgetClient(downloader, http, fetcher, objectMapper);
            default:
                throw new IllegalArgumentException("Unsupported downloader type: " + downloader.getType());
        }
    }
}
