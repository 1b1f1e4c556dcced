package com.example.downloaders.utils.torrent;

/** Malformed or oversized bencode input. */
public class BencodeException extends Exception {
    public BencodeException(String message) {
        super(message);
    }
}
