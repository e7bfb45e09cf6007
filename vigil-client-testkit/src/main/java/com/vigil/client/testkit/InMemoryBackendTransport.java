package com.vigil.client.testkit;

import com.vigil.client.transport.BackendRequest;
import com.vigil.client.transport.BackendTransport;
import com.vigil.client.transport.RequestKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Test double that answers requests from per-kind handlers and records every request it receives. Safe to
 * call from several threads.
 */
public class InMemoryBackendTransport implements BackendTransport {
    private final Map<RequestKind, Function<Map<String, Object>, Object>> handlers = new EnumMap<>(RequestKind.class);
    private final List<BackendRequest<?>> requests = new ArrayList<>();

    /** Answers every request of {@code kind} with whatever {@code handler} returns for its parameters. */
    public synchronized InMemoryBackendTransport on(RequestKind kind, Function<Map<String, Object>, Object> handler) {
        handlers.put(kind, handler);
        return this;
    }

    public InMemoryBackendTransport respond(RequestKind kind, Object payload) {
        return on(kind, params -> payload);
    }

    public InMemoryBackendTransport fail(RequestKind kind, RuntimeException failure) {
        return on(kind, params -> {
            throw failure;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T request(BackendRequest<T> request) {
        Function<Map<String, Object>, Object> handler;
        synchronized (this) {
            requests.add(request);
            handler = handlers.get(request.kind());
        }
        if (handler == null) {
            throw new IllegalStateException("No response scripted for " + request.kind());
        }
        return (T) handler.apply(request.parameters());
    }

    public synchronized List<BackendRequest<?>> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public synchronized List<BackendRequest<?>> requests(RequestKind kind) {
        return requests.stream().filter(r -> r.kind() == kind).toList();
    }

    public synchronized void clear() {
        requests.clear();
    }
}
