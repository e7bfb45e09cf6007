package com.vigil.controller.rest;

import com.vigil.api.dto.RetainRequest;
import com.vigil.service.core.engine.FederationEngine;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/cameras", produces = MediaType.APPLICATION_JSON_VALUE)
public class CameraEventController {

    private final FederationEngine engine;

    public CameraEventController(FederationEngine engine) {
        this.engine = engine;
    }

    /** 204 once the backend has applied the change, 404 when the camera is not configured. */
    @PostMapping(path = "/{cameraId}/events/{eventId}/retain", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> retain(
            @PathVariable("cameraId") String cameraId,
            @PathVariable("eventId") String eventId,
            @RequestBody RetainRequest request) {
        if (!engine.retain(cameraId, eventId, request.retain())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
