package com.example.downloaders.utils.torrent;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bencode reader for .torrent payloads fetched from indexers.
 * <p>
 * Besides the decoded value it remembers the byte range of the root
 * dictionary's {@code info} entry, which is what the info-hash is computed over.
 * One instance per payload.
 */
public class BencodeParser {

    static final int MAX_DEPTH = 64;
    static final int MAX_ENTRIES = 100_000;
    static final int MAX_STRING_BYTES = 16 * 1024 * 1024;

    private final byte[] data;
    private int pos;
    private int depth;
    private int totalEntries;

    private int infoStart = -1;
    private int infoEnd = -1;

    public BencodeParser(byte[] data) {
        this.data = data;
    }

    /**
     * @return {@link Long}, {@code byte[]}, {@link List} or {@link Map}
     */
    public Object parse() throws BencodeException {
        Object value = parseValue();
        if (pos != data.length) {
            throw new BencodeException("Trailing data at position " + pos);
        }
        return value;
    }

    /** Raw bytes of the root {@code info} dictionary, or null when there is none. */
    public byte[] infoBytes() {
        return infoStart < 0 ? null : Arrays.copyOfRange(data, infoStart, infoEnd);
    }

    private Object parseValue() throws BencodeException {
        if (pos >= data.length) {
            throw new BencodeException("Unexpected end of data at position " + pos);
        }
        if (++depth > MAX_DEPTH) {
            throw new BencodeException("Max nesting depth " + MAX_DEPTH + " exceeded");
        }
        try {
            byte b = data[pos];
            if (b == 'i') {
                return parseInteger();
            }
            if (b == 'l') {
                return parseList();
            }
            if (b == 'd') {
                return parseDict(depth == 1);
            }
            if (b >= '0' && b <= '9') {
                return parseByteString();
            }
            throw new BencodeException("Invalid bencode token 0x" + Integer.toHexString(b & 0xFF)
                    + " at position " + pos);
        } finally {
            depth--;
        }
    }

    private Long parseInteger() throws BencodeException {
        int start = ++pos;
        while (pos < data.length && data[pos] != 'e') {
            pos++;
        }
        if (pos >= data.length) {
            throw new BencodeException("Unterminated integer starting at " + start);
        }
        String digits = new String(data, start, pos - start, StandardCharsets.US_ASCII);
        pos++;
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new BencodeException("Invalid integer: " + digits);
        }
    }

    private byte[] parseByteString() throws BencodeException {
        int lenStart = pos;
        while (pos < data.length && data[pos] != ':') {
            pos++;
        }
        if (pos >= data.length) {
            throw new BencodeException("Missing ':' in byte string at " + lenStart);
        }
        String lenText = new String(data, lenStart, pos - lenStart, StandardCharsets.US_ASCII);
        int len;
        try {
            len = Integer.parseInt(lenText);
        } catch (NumberFormatException e) {
            throw new BencodeException("Invalid string length: " + lenText);
        }
        if (len < 0 || len > MAX_STRING_BYTES) {
            throw new BencodeException("String length out of bounds: " + len);
        }
        pos++;
        if (pos + len > data.length) {
            throw new BencodeException("String data truncated at position " + pos);
        }
        byte[] bytes = Arrays.copyOfRange(data, pos, pos + len);
        pos += len;
        return bytes;
    }

    private List<Object> parseList() throws BencodeException {
        pos++;
        List<Object> list = new ArrayList<>();
        while (pos < data.length && data[pos] != 'e') {
            countEntry();
            list.add(parseValue());
        }
        if (pos >= data.length) {
            throw new BencodeException("Unterminated list");
        }
        pos++;
        return list;
    }

    private Map<String, Object> parseDict(boolean root) throws BencodeException {
        pos++;
        Map<String, Object> map = new LinkedHashMap<>();
        while (pos < data.length && data[pos] != 'e') {
            countEntry();
            String key = new String(parseByteString(), StandardCharsets.UTF_8);
            int valueStart = pos;
            Object value = parseValue();
            if (root && "info".equals(key)) {
                infoStart = valueStart;
                infoEnd = pos;
            }
            map.put(key, value);
        }
        if (pos >= data.length) {
            throw new BencodeException("Unterminated dictionary");
        }
        pos++;
        return map;
    }

    private void countEntry() throws BencodeException {
        if (++totalEntries > MAX_ENTRIES) {
            throw new BencodeException("Max entry count " + MAX_ENTRIES + " exceeded");
        }
    }
}
