package com.example.downloaders.utils.http;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.constants.RegexPatterns;
import com.example.downloaders.utils.model.Downloader;

import java.net.URI;

/**
 * Turns the loosely specified address of a {@link Downloader} into the base URL
 * a client posts to.
 */
public final class EndpointResolver {

    private EndpointResolver() {}

    /**
     * @param defaultPath path used when neither the url nor {@code urlPath} carries one,
     *                    e.g. {@code /RPC2}; may be empty
     * @return the endpoint, without a trailing slash unless the path is exactly "/"
     */
    public static String resolve(Downloader downloader, String defaultPath) throws DownloaderException {
        String raw = downloader.getUrl() == null ? "" : downloader.getUrl().trim();
        if (raw.isEmpty()) {
            throw DownloaderException.protocol("Downloader '" + downloader.getName() + "' has no URL");
        }
        if (!RegexPatterns.SCHEME.matcher(raw).find()) {
            raw = (downloader.isUseSsl() ? "https://" : "http://") + raw;
        }

        URI uri = DownloaderHttp.toUri(raw);
        if (uri.getHost() == null) {
            throw DownloaderException.protocol("Invalid URL: " + downloader.getUrl());
        }

        int port = uri.getPort();
        if (port < 0 && downloader.getPort() != null && downloader.getPort() > 0) {
            port = downloader.getPort();
        }

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String extra = downloader.getUrlPath();
        if (extra != null && !extra.isBlank()) {
            path = path + "/" + extra.trim();
        }
        path = collapseSlashes(path);
        if (path.isEmpty() || "/".equals(path)) {
            path = defaultPath == null ? "" : defaultPath;
        } else if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getHost());
        if (port > 0) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    static String collapseSlashes(String path) {
        String collapsed = path.replaceAll("/{2,}", "/");
        if (!collapsed.isEmpty() && !collapsed.startsWith("/")) {
            collapsed = "/" + collapsed;
        }
        return collapsed;
    }
}
