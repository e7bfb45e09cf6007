package com.vigil.client.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One remote call: what to ask, with which parameters, and the payload shape the answer must validate
 * against.
 */
public record BackendRequest<T>(RequestKind kind, Map<String, Object> parameters, TypeReference<T> responseType) {

    public BackendRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(responseType, "responseType");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /** Wire message: the parameters with the message type first. */
    public Map<String, Object> toMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", kind.wireType());
        message.putAll(parameters);
        return message;
    }
}
