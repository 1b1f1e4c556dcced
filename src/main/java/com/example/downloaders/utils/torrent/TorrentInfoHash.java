package com.example.downloaders.utils.torrent;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the BitTorrent v1 info-hash: SHA-1 over the exact bytes of the
 * {@code info} dictionary, lower-case hex.
 */
public final class TorrentInfoHash {

    private TorrentInfoHash() {}

    public static String compute(byte[] torrent) throws BencodeException {
        BencodeParser parser = new BencodeParser(torrent);
        Object root = parser.parse();
        if (!(root instanceof Map<?, ?>)) {
            throw new BencodeException("Root element is not a dictionary");
        }
        byte[] info = parser.infoBytes();
        if (info == null || !(((Map<?, ?>) root).get("info") instanceof Map<?, ?>)) {
            throw new BencodeException("Missing or invalid 'info' dictionary");
        }
        return sha1Hex(info);
    }

    /** Like {@link #compute} but empty for anything that is not a parsable torrent. */
    public static Optional<String> tryCompute(byte[] torrent) {
        try {
            return Optional.of(compute(torrent));
        } catch (BencodeException e) {
            return Optional.empty();
        }
    }

    static String sha1Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
