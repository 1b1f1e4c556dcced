package com.example.downloaders.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Connectivity settings shared by every download client adapter.
 * <p>
 * Bound from {@code app.downloader.*}; the defaults match what the supported
 * download clients tolerate out of the box.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "app.downloader")
public class ApplicationConfig {
    /** Per-request timeout applied to every round-trip. */
    private Duration requestTimeout = Duration.ofSeconds(30);
    private String userAgent = "Questarr/1.0";
    /** Pause before qBittorrent is asked whether a URL-based add produced a torrent. */
    private Duration verifyDelay = Duration.ofSeconds(2);
    /** How recent a torrent's added_on must be to count as "just added". */
    private Duration recentAddWindow = Duration.ofSeconds(5);
    private int maxRedirects = 5;
    private ExecutorSettings executor = new ExecutorSettings();

    @Data
    public static class ExecutorSettings {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
    }

    @Bean
    public HttpClient downloaderHttpClient() {
        // Redirects are followed by RemoteFileFetcher so a hop to magnet: can be detected
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor downloaderTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(this.executor.getCorePoolSize());
        executor.setMaxPoolSize(this.executor.getMaxPoolSize());
        executor.setQueueCapacity(this.executor.getQueueCapacity());
        executor.setThreadNamePrefix("Downloader-");
        executor.initialize();
        log.info("Downloader executor ready (core={}, max={})",
                this.executor.getCorePoolSize(), this.executor.getMaxPoolSize());
        return executor;
    }
}
