package com.vigil.client.transport;

/** The backend answered, but the payload does not match the expected shape. */
public class PayloadValidationException extends TransportException {

    public PayloadValidationException(RequestKind kind, String message) {
        super(kind, message);
    }

    public PayloadValidationException(RequestKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
