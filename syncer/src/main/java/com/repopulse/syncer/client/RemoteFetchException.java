package com.repopulse.syncer.client;

import java.io.IOException;

/**
 * Failure to obtain usable data from the GitHub API.
 *
 * <p>{@link Kind#TRANSPORT} covers network errors and non-success statuses,
 * {@link Kind#VALIDATION} covers bodies that parse but do not have the expected
 * shape. Callers treat both the same way; the kind only feeds the logs.</p>
 */
public class RemoteFetchException extends IOException {

    public enum Kind { TRANSPORT, VALIDATION }

    private final Kind kind;
    private final int statusCode;

    public RemoteFetchException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    public RemoteFetchException(Kind kind, String message, int statusCode) {
        this(kind, message, statusCode, null);
    }

    public RemoteFetchException(Kind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static RemoteFetchException transport(String message, Throwable cause) {
        return new RemoteFetchException(Kind.TRANSPORT, message, -1, cause);
    }

    public static RemoteFetchException validation(String message) {
        return new RemoteFetchException(Kind.VALIDATION, message);
    }

    public static RemoteFetchException validation(String message, Throwable cause) {
        return new RemoteFetchException(Kind.VALIDATION, message, -1, cause);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the HTTP status that caused the failure, or -1 if none was received
     */
    public int statusCode() {
        return statusCode;
    }
}
