package com.vigil.controller.rest;

import com.vigil.api.dto.EventQueryRequest;
import com.vigil.api.dto.MediaMetadataQueryRequest;
import com.vigil.api.dto.QueryResponse;
import com.vigil.api.dto.RecordingQueryRequest;
import com.vigil.api.dto.RecordingSegmentsQueryRequest;
import com.vigil.api.dto.SeekTimeRequest;
import com.vigil.api.dto.SeekTimeResponse;
import com.vigil.api.dto.SubQueryResult;
import com.vigil.service.core.engine.FederationEngine;
import com.vigil.service.core.model.ViewMedia;
import com.vigil.service.core.query.EventQuery;
import com.vigil.service.core.query.MediaMetadataQuery;
import com.vigil.service.core.query.RecordingQuery;
import com.vigil.service.core.query.RecordingSegmentsQuery;
import com.vigil.service.core.results.EventQueryResults;
import com.vigil.service.core.results.MediaMetadataQueryResults;
import com.vigil.service.core.results.RecordingQueryResults;
import com.vigil.service.core.results.RecordingSegmentsQueryResults;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Query endpoints for the media browser. A query that could not be split into any backend sub-query answers
 * 204 No Content.
 */
@RestController
@RequestMapping(path = "/api/query", produces = MediaType.APPLICATION_JSON_VALUE)
public class MediaQueryController {

    private final FederationEngine engine;

    public MediaQueryController(FederationEngine engine) {
        this.engine = engine;
    }

    @PostMapping(path = "/events", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryResponse<EventQuery, EventQueryResults>> events(@RequestBody EventQueryRequest request) {
        Map<EventQuery, EventQueryResults> results = engine.getEvents(request.toQuery(), request.options());
        if (results == null || results.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        List<ViewMedia> media = new ArrayList<>();
        results.forEach((query, result) -> {
            List<ViewMedia> projected = engine.generateMediaFromEvents(query, result);
            if (projected != null) {
                media.addAll(projected);
            }
        });
        return ResponseEntity.ok(new QueryResponse<>(SubQueryResult.fromMap(results), media));
    }

    @PostMapping(path = "/recordings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryResponse<RecordingQuery, RecordingQueryResults>> recordings(
            @RequestBody RecordingQueryRequest request) {
        Map<RecordingQuery, RecordingQueryResults> results =
                engine.getRecordings(request.toQuery(), request.options());
        if (results == null || results.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        List<ViewMedia> media = new ArrayList<>();
        results.forEach((query, result) -> {
            List<ViewMedia> projected = engine.generateMediaFromRecordings(query, result);
            if (projected != null) {
                media.addAll(projected);
            }
        });
        return ResponseEntity.ok(new QueryResponse<>(SubQueryResult.fromMap(results), media));
    }

    @PostMapping(path = "/recording-segments", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryResponse<RecordingSegmentsQuery, RecordingSegmentsQueryResults>> recordingSegments(
            @RequestBody RecordingSegmentsQueryRequest request) {
        Map<RecordingSegmentsQuery, RecordingSegmentsQueryResults> results =
                engine.getRecordingSegments(request.toQuery(), request.options());
        if (results == null || results.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(new QueryResponse<>(SubQueryResult.fromMap(results), null));
    }

    @PostMapping(path = "/media-metadata", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryResponse<MediaMetadataQuery, MediaMetadataQueryResults>> mediaMetadata(
            @RequestBody MediaMetadataQueryRequest request) {
        Map<MediaMetadataQuery, MediaMetadataQueryResults> results =
                engine.getMediaMetadata(request.toQuery(), request.options());
        if (results == null || results.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(new QueryResponse<>(SubQueryResult.fromMap(results), null));
    }

    @PostMapping(path = "/seek-time", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SeekTimeResponse> seekTime(@RequestBody SeekTimeRequest request) {
        return engine.getMediaSeekTime(request.toMedia(), request.target(), request.options())
                .map(seconds -> ResponseEntity.ok(new SeekTimeResponse(seconds)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
