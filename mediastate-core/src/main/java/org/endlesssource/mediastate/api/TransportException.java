package org.endlesssource.mediastate.api;

import java.util.Objects;

/**
 * Failure talking to the media server.
 */
public class TransportException extends Exception {

    public enum Kind {
        TIMEOUT,
        UNAUTHORIZED,
        UNREACHABLE,
        MALFORMED
    }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Timeouts and unreachable servers are retried on the next cycle.
     */
    public boolean isTransient() {
        return kind == Kind.TIMEOUT || kind == Kind.UNREACHABLE;
    }

    public boolean isUnauthorized() {
        return kind == Kind.UNAUTHORIZED;
    }
}
