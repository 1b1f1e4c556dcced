package com.example.downloaders.utils.http;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** What an indexer link resolved to: file bytes, or a redirect to a magnet URI. */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RemoteSource {
    private final byte[] content;
    private final String magnetUri;
    private final String finalUrl;

    public static RemoteSource file(byte[] content, String finalUrl) {
        return new RemoteSource(content, null, finalUrl);
    }

    public static RemoteSource magnet(String magnetUri) {
        return new RemoteSource(null, magnetUri, magnetUri);
    }

    public boolean isMagnet() {
        return magnetUri != null;
    }
}
