package com.fintech.metals.ingestion;

/**
 * Thrown when an upstream feed could not be read within its timeout.
 */
public class FetchException extends Exception {

    public enum Kind {
        /** The feed did not answer before the configured timeout. */
        TIMEOUT,
        /** Connection refused, non-2xx status, or the stream closed without data. */
        TRANSPORT
    }

    private final Kind kind;
    private final String feed;

    public FetchException(Kind kind, String feed, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.feed = feed;
    }

    public static FetchException timeout(String feed, Throwable cause) {
        return new FetchException(Kind.TIMEOUT, feed, "Timed out reading feed " + feed, cause);
    }

    public static FetchException transport(String feed, String detail, Throwable cause) {
        return new FetchException(Kind.TRANSPORT, feed, "Failed to read feed " + feed + ": " + detail, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getFeed() {
        return feed;
    }
}
