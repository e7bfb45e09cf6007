package com.vigil.client.transport;

import java.io.Closeable;

/**
 * Transport SPI: performs a backend request and returns its validated payload.
 *
 * <p>Implementations throw {@link TransportException} when the call fails and {@link
 * PayloadValidationException} when the answer does not parse into {@link BackendRequest#responseType()}.
 */
public interface BackendTransport extends Closeable {
    String DEFAULT_ENDPOINT = "http://localhost:5000/api/ws";
    String PROP_ENDPOINT = "vigil.backend.url";
    String ENV_ENDPOINT = "VIGIL_BACKEND_URL";

    <T> T request(BackendRequest<T> request);

    default String endpoint() {
        String sys = System.getProperty(PROP_ENDPOINT);
        if (sys != null && !sys.isBlank()) return sys;
        String env = System.getenv(ENV_ENDPOINT);
        if (env != null && !env.isBlank()) return env;
        return DEFAULT_ENDPOINT;
    }

    @Override
    default void close() {
        /* no-op */
    }
}
