package com.example.downloaders.utils.http;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.torrent.MagnetLinks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Downloads .torrent and .nzb files on this host rather than letting the
 * download client do it, since the client often cannot reach the indexer.
 * Redirects are followed here so that a hop to {@code magnet:} can be reported
 * instead of failing.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteFileFetcher {
    private final DownloaderHttp http;
    private final int maxRedirects;

    public RemoteSource fetch(String url) throws DownloaderException {
        URI current = DownloaderHttp.toUri(url);
        for (int hop = 0; hop <= maxRedirects; hop++) {
            HttpRequest request = http.request(current).GET().build();
            HttpResponse<byte[]> response = http.sendForBytes(request);
            int status = response.statusCode();

            if (status >= 300 && status < 400) {
                String location = response.headers().firstValue("Location").orElse(null);
                if (location == null || location.isBlank()) {
                    throw DownloaderException.protocol("Redirect without Location header from " + current);
                }
                if (MagnetLinks.isMagnet(location)) {
                    log.info("Link {} redirected to a magnet URI", url);
                    return RemoteSource.magnet(location);
                }
                current = current.resolve(DownloaderHttp.toUri(location));
                continue;
            }
            if (!DownloaderHttp.isSuccess(response)) {
                throw DownloaderException.httpStatus(status);
            }
            byte[] body = response.body();
            if (body == null || body.length == 0) {
                throw DownloaderException.protocol("Empty response from " + current);
            }
            log.debug("Fetched {} bytes from {}", body.length, current);
            return RemoteSource.file(body, current.toString());
        }
        throw DownloaderException.protocol("Too many redirects fetching " + url);
    }
}
