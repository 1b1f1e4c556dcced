package com.example.downloaders.utils.torrent;

import com.example.downloaders.utils.constants.RegexPatterns;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

public final class MagnetLinks {

    private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private MagnetLinks() {}

    public static boolean isMagnet(String url) {
        return url != null && url.regionMatches(true, 0, "magnet:", 0, 7);
    }

    /**
     * Info-hash carried by a magnet URI ({@code xt=urn:btih:}) as 40 lower-case hex
     * characters. The 32-character base32 form is decoded, since clients index by hex.
     */
    public static Optional<String> extractHash(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = RegexPatterns.MAGNET_INFO_HASH.matcher(url);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String hash = matcher.group(1);
        return Optional.of(hash.length() == 32 ? base32ToHex(hash) : hash.toLowerCase(Locale.ROOT));
    }

    static String base32ToHex(String base32) {
        byte[] bytes = new byte[base32.length() * 5 / 8];
        int buffer = 0;
        int bits = 0;
        int index = 0;
        for (char c : base32.toUpperCase(Locale.ROOT).toCharArray()) {
            buffer = (buffer << 5) | BASE32_ALPHABET.indexOf(c);
            bits += 5;
            if (bits >= 8) {
                bits -= 8;
                bytes[index++] = (byte) (buffer >> bits);
                buffer &= (1 << bits) - 1;
            }
        }
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
        }
        return sb.toString();
    }
}
