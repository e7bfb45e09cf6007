package com.vigil.client.transport.okhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vigil.client.transport.BackendRequest;
import com.vigil.client.transport.BackendTransport;
import com.vigil.client.transport.PayloadValidationException;
import com.vigil.client.transport.TransportException;
import java.io.IOException;
import java.net.Inet4Address;
import java.util.ArrayList;
import okhttp3.Dns;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based transport. Posts {@code {"type": ..., params}} JSON and validates the JSON answer. */
public class OkHttpBackendTransport implements BackendTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpBackendTransport.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String endpoint;

    public OkHttpBackendTransport() {
        this(null);
    }

    public OkHttpBackendTransport(String endpoint) {
        this(endpoint, defaultMapper());
    }

    public OkHttpBackendTransport(String endpoint, ObjectMapper mapper) {
        this.client = new OkHttpClient.Builder().dns(PREFER_IPV4_DNS).build();
        this.mapper = mapper;
        this.endpoint = endpoint;
    }

    @Override
    public String endpoint() {
        return endpoint != null && !endpoint.isBlank() ? endpoint : BackendTransport.super.endpoint();
    }

    @Override
    public <T> T request(BackendRequest<T> request) {
        String url = endpoint();
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(request.toMessage());
        } catch (JsonProcessingException e) {
            throw new TransportException(request.kind(), "Unable to encode " + request.kind() + " request", e);
        }
        Request req = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .build();
        log.debug("Sending backend request {} to {} with parameters {}", request.kind(), url, request.parameters());

        String responseBody;
        try (Response r = client.newCall(req).execute()) {
            responseBody = r.body() != null ? r.body().string() : "";
            if (!r.isSuccessful()) {
                log.warn(
                        "Backend request {} {} failed with status {} and body: {}",
                        request.kind(),
                        url,
                        r.code(),
                        responseBody);
                throw new TransportException(request.kind(), "HTTP " + r.code() + " - " + responseBody);
            }
        } catch (IOException e) {
            throw new TransportException(request.kind(), "Backend request " + request.kind() + " failed", e);
        }
        return decode(request, responseBody);
    }

    private <T> T decode(BackendRequest<T> request, String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new PayloadValidationException(request.kind(), "Empty payload for " + request.kind());
        }
        T payload;
        try {
            payload = mapper.readValue(responseBody, request.responseType());
        } catch (JsonProcessingException e) {
            throw new PayloadValidationException(
                    request.kind(), "Invalid payload for " + request.kind() + ": " + e.getOriginalMessage(), e);
        }
        if (payload == null) {
            throw new PayloadValidationException(request.kind(), "Null payload for " + request.kind());
        }
        return payload;
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
