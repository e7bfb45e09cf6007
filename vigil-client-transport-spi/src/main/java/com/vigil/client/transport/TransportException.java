package com.vigil.client.transport;

/** A remote call failed before a usable payload was obtained. */
public class TransportException extends RuntimeException {
    private final RequestKind kind;

    public TransportException(RequestKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportException(RequestKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RequestKind kind() {
        return kind;
    }
}
