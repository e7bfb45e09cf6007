package com.vigil.service.core.engine;

import com.vigil.backend.model.RetainResult;
import java.util.Map;

/** The backend answered a retain request but reported that it did not apply it. */
public class RetainFailedException extends RuntimeException {
    private final transient Map<String, Object> request;
    private final transient RetainResult response;

    public RetainFailedException(Map<String, Object> request, RetainResult response) {
        super("Backend refused retain request " + request
                + (response == null || response.message() == null ? "" : ": " + response.message()));
        this.request = Map.copyOf(request);
        this.response = response;
    }

    public Map<String, Object> getRequest() {
        return request;
    }

    public RetainResult getResponse() {
        return response;
    }
}
