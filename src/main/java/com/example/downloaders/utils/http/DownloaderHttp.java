package com.example.downloaders.utils.http;

import com.example.downloaders.exception.DownloaderException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin wrapper over the shared {@link HttpClient}: stamps every request with the
 * configured timeout and User-Agent and turns I/O failures into
 * {@link DownloaderException}s.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class DownloaderHttp {
    private final HttpClient httpClient;
    private final Duration timeout;
    private final String userAgent;

    public HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", userAgent)
                .timeout(timeout);
    }

    public HttpRequest.Builder request(String url) throws DownloaderException {
        return request(toUri(url));
    }

    public HttpResponse<String> send(HttpRequest request) throws DownloaderException {
        return execute(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    public HttpResponse<byte[]> sendForBytes(HttpRequest request) throws DownloaderException {
        return execute(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    private <T> HttpResponse<T> execute(HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws DownloaderException {
        log.debug("{} {}", request.method(), request.uri());
        try {
            HttpResponse<T> response = httpClient.send(request, handler);
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (HttpTimeoutException e) {
            throw DownloaderException.transport("Request timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw DownloaderException.transport("Connection failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DownloaderException.transport("Request interrupted", e);
        }
    }

    public static boolean isSuccess(HttpResponse<?> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    public static URI toUri(String url) throws DownloaderException {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw DownloaderException.protocol("Invalid URL: " + url, e);
        }
    }

    public static String basicAuth(String username, String password) {
        String token = (username == null ? "" : username) + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    public static String formEncode(Map<String, String> fields) {
        StringJoiner joiner = new StringJoiner("&");
        fields.forEach((key, value) -> joiner.add(encode(key) + "=" + encode(value)));
        return joiner.toString();
    }

    public static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
