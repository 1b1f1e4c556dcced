package com.example.downloaders.utils.auth;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP Digest access authentication (RFC 2617), client side.
 * <p>
 * Only the MD5 family is supported; that is all rTorrent front ends
 * (nginx, lighttpd, ruTorrent behind Apache) offer in practice.
 */
public final class DigestAuth {

    /** A single challenge is answered exactly once, so the nonce count never advances. */
    static final String NONCE_COUNT = "00000001";

    private static final SecureRandom RANDOM = new SecureRandom();

    private DigestAuth() {}

    @Value
    @Builder
    public static class Challenge {
        String realm;
        String nonce;
        String opaque;
        /** MD5 or MD5-sess; null means MD5. */
        String algorithm;
        /** Comma separated qop options offered by the server, null for RFC 2069 servers. */
        String qop;

        /** Prefers {@code auth} over {@code auth-int} when both are offered. */
        public String selectedQop() {
            if (qop == null || qop.isBlank()) {
                return null;
            }
            String selected = null;
            for (String option : qop.split(",")) {
                String trimmed = option.trim().toLowerCase(Locale.ROOT);
                if ("auth".equals(trimmed)) {
                    return "auth";
                }
                if ("auth-int".equals(trimmed)) {
                    selected = "auth-int";
                }
            }
            return selected;
        }

        boolean isSessionAlgorithm() {
            return algorithm != null && algorithm.equalsIgnoreCase("MD5-sess");
        }
    }

    /**
     * Parses a {@code WWW-Authenticate} header value.
     *
     * @return empty unless the header is a Digest challenge carrying a nonce
     */
    public static Optional<Challenge> parseChallenge(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        if (!trimmed.regionMatches(true, 0, "Digest", 0, 6)) {
            return Optional.empty();
        }
        Map<String, String> params = parseParameters(trimmed.substring(6));
        String nonce = params.get("nonce");
        if (nonce == null || nonce.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Challenge.builder()
                .realm(params.getOrDefault("realm", ""))
                .nonce(nonce)
                .opaque(params.get("opaque"))
                .algorithm(params.get("algorithm"))
                .qop(params.get("qop"))
                .build());
    }

    public static String newCnonce() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Builds the {@code Authorization} header value answering {@code challenge}.
     *
     * @param body request entity, only used for {@code qop=auth-int}
     */
    public static String authorization(Challenge challenge, String username, String password,
                                       String method, String uri, byte[] body, String cnonce) {
        String qop = challenge.selectedQop();
        String response = response(challenge, username, password, method, uri, body, cnonce);

        StringBuilder sb = new StringBuilder("Digest ");
        sb.append("username=\"").append(quote(username)).append('"');
        sb.append(", realm=\"").append(quote(challenge.getRealm())).append('"');
        sb.append(", nonce=\"").append(quote(challenge.getNonce())).append('"');
        sb.append(", uri=\"").append(quote(uri)).append('"');
        if (challenge.getAlgorithm() != null) {
            sb.append(", algorithm=").append(challenge.getAlgorithm());
        }
        sb.append(", response=\"").append(response).append('"');
        if (challenge.getOpaque() != null) {
            sb.append(", opaque=\"").append(quote(challenge.getOpaque())).append('"');
        }
        if (qop != null) {
            sb.append(", qop=").append(qop);
            sb.append(", nc=").append(NONCE_COUNT);
            sb.append(", cnonce=\"").append(quote(cnonce)).append('"');
        }
        return sb.toString();
    }

    /** The {@code response} digest alone. */
    static String response(Challenge challenge, String username, String password,
                           String method, String uri, byte[] body, String cnonce) {
        String qop = challenge.selectedQop();

        String ha1 = md5Hex(username + ":" + challenge.getRealm() + ":" + password);
        if (challenge.isSessionAlgorithm()) {
            ha1 = md5Hex(ha1 + ":" + challenge.getNonce() + ":" + cnonce);
        }

        String ha2;
        if ("auth-int".equals(qop)) {
            ha2 = md5Hex(method + ":" + uri + ":" + md5Hex(body == null ? new byte[0] : body));
        } else {
            ha2 = md5Hex(method + ":" + uri);
        }

        if (qop == null) {
            return md5Hex(ha1 + ":" + challenge.getNonce() + ":" + ha2);
        }
        return md5Hex(ha1 + ":" + challenge.getNonce() + ":" + NONCE_COUNT + ":" + cnonce + ":" + qop + ":" + ha2);
    }

    static Map<String, String> parseParameters(String text) {
        Map<String, String> params = new LinkedHashMap<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            while (i < n && (text.charAt(i) == ',' || Character.isWhitespace(text.charAt(i)))) {
                i++;
            }
            int keyStart = i;
            while (i < n && text.charAt(i) != '=' && text.charAt(i) != ',') {
                i++;
            }
            String key = text.substring(keyStart, i).trim().toLowerCase(Locale.ROOT);
            if (i >= n || text.charAt(i) != '=') {
                continue;
            }
            i++;
            StringBuilder value = new StringBuilder();
            if (i < n && text.charAt(i) == '"') {
                i++;
                while (i < n && text.charAt(i) != '"') {
                    if (text.charAt(i) == '\\' && i + 1 < n) {
                        i++;
                    }
                    value.append(text.charAt(i++));
                }
                i++;
            } else {
                while (i < n && text.charAt(i) != ',') {
                    value.append(text.charAt(i++));
                }
            }
            if (!key.isEmpty()) {
                params.put(key, value.toString().trim());
            }
        }
        return params;
    }

    private static String quote(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String md5Hex(String text) {
        return md5Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    static String md5Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
