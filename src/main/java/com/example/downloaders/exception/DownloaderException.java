package com.example.downloaders.exception;

import lombok.Getter;

/**
 * Failure talking to a download client. The {@link Kind} tells callers whether
 * the problem is the network, the credentials, or the remote protocol, so they
 * can present an actionable message.
 */
@Getter
public class DownloaderException extends Exception {

    public enum Kind {
        /** Timeout, refused connection, unexpected HTTP status. */
        TRANSPORT,
        /** Rejected credentials, session or API key. */
        AUTHENTICATION,
        /** The client answered, but with a fault or an unusable body. */
        PROTOCOL
    }

    private final Kind kind;
    /** HTTP status that caused the failure, or -1. */
    private final int statusCode;

    public DownloaderException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    public DownloaderException(Kind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public DownloaderException(Kind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static DownloaderException transport(String message, Throwable cause) {
        return new DownloaderException(Kind.TRANSPORT, message, cause);
    }

    public static DownloaderException httpStatus(int statusCode) {
        return new DownloaderException(Kind.TRANSPORT, "HTTP " + statusCode + ": " + reasonPhrase(statusCode),
                statusCode, null);
    }

    public static DownloaderException authentication(String message) {
        return new DownloaderException(Kind.AUTHENTICATION, message, 401, null);
    }

    public static DownloaderException protocol(String message) {
        return new DownloaderException(Kind.PROTOCOL, message);
    }

    public static DownloaderException protocol(String message, Throwable cause) {
        return new DownloaderException(Kind.PROTOCOL, message, cause);
    }

    public boolean isAuthentication() {
        return kind == Kind.AUTHENTICATION;
    }

    static String reasonPhrase(int statusCode) {
        switch (statusCode) {
            case 400: return "Bad Request";
            case 401: return "Unauthorized";
            case 403: return "Forbidden";
            case 404: return "Not Found";
            case 409: return "Conflict";
            case 500: return "Internal Server Error";
            case 502: return "Bad Gateway";
            case 503: return "Service Unavailable";
            default: return "Unexpected status";
        }
    }
}
