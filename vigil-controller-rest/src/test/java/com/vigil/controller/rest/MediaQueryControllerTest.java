package com.vigil.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vigil.backend.model.BackendEvent;
import com.vigil.backend.model.RetainResult;
import com.vigil.client.transport.RequestKind;
import com.vigil.client.transport.TransportException;
import com.vigil.service.core.engine.FederationEngine;
import com.vigil.service.core.engine.RetainFailedException;
import com.vigil.service.core.model.MediaType;
import com.vigil.service.core.model.ViewMedia;
import com.vigil.service.core.query.EngineOptions;
import com.vigil.service.core.query.EventQuery;
import com.vigil.service.core.query.RecordingSegmentsQuery;
import com.vigil.service.core.results.EventQueryResults;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class MediaQueryControllerTest {

    private static final Instant T0 = Instant.parse("2024-03-10T10:00:00Z");

    @Mock
    private FederationEngine engine;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new MediaQueryController(engine), new CameraEventController(engine))
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void eventsReturnResultsAndProjectedMedia() throws Exception {
        EventQuery query = EventQuery.builder().cameraIds(Set.of("garage")).build();
        BackendEvent event =
                new BackendEvent("e1", "garage", "car", null, List.of(), T0, null, 0.9, true, true, false);
        EventQueryResults results = new EventQueryResults("beta", List.of(event), T0.plusSeconds(60), false);
        ViewMedia media = ViewMedia.builder()
                .mediaType(MediaType.CLIP)
                .cameraId("garage")
                .id("e1")
                .startTime(T0)
                .inProgress(true)
                .build();
        Mockito.when(engine.getEvents(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenReturn(Map.of(query, results));
        Mockito.when(engine.generateMediaFromEvents(query, results)).thenReturn(List.of(media));

        mockMvc.perform(post("/api/query/events")
                        .contentType("application/json")
                        .content("{\"cameraIds\":[\"garage\"],\"useCache\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].query.cameraIds[0]").value("garage"))
                .andExpect(jsonPath("$.results[0].results.instanceId").value("beta"))
                .andExpect(jsonPath("$.results[0].results.events[0].id").value("e1"))
                .andExpect(jsonPath("$.results[0].results.events[0].has_clip").value(true))
                .andExpect(jsonPath("$.media[0].mediaType").value("CLIP"))
                .andExpect(jsonPath("$.media[0].inProgress").value(true));

        ArgumentCaptor<EngineOptions> options = ArgumentCaptor.forClass(EngineOptions.class);
        Mockito.verify(engine).getEvents(ArgumentMatchers.eq(query), options.capture());
        assertThat(options.getValue().useCache()).isFalse();
    }

    @Test
    void queryWithNoSubQueriesAnswersNoContent() throws Exception {
        Mockito.when(engine.getRecordingSegments(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenReturn(null);

        mockMvc.perform(post("/api/query/recording-segments")
                        .contentType("application/json")
                        .content("{\"cameraIds\":[\"front\"],\"start\":\"2024-03-10T10:00:00Z\"}"))
                .andExpect(status().isNoContent());

        Mockito.verify(engine)
                .getRecordingSegments(
                        new RecordingSegmentsQuery(Set.of("front"), T0, null), EngineOptions.DEFAULT);
    }

    @Test
    void emptyResultMapAnswersNoContent() throws Exception {
        Mockito.when(engine.getMediaMetadata(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenReturn(Map.of());

        mockMvc.perform(post("/api/query/media-metadata")
                        .contentType("application/json")
                        .content("{\"cameraIds\":[\"front\"]}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void nullCameraIdIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/query/events")
                        .contentType("application/json")
                        .content("{\"cameraIds\":[\"front\",null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("cameraIds must not contain null"));

        Mockito.verifyNoInteractions(engine);
    }

    @Test
    void missingCamerasIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/query/media-metadata").contentType("application/json").content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("cameraIds is required"))
                .andExpect(jsonPath("$.path").value("/api/query/media-metadata"));
    }

    @Test
    void transportFailureIsABadGateway() throws Exception {
        Mockito.when(engine.getRecordings(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenThrow(new TransportException(RequestKind.RECORDINGS_SUMMARY, "HTTP 503 - unavailable"));

        mockMvc.perform(post("/api/query/recordings")
                        .contentType("application/json")
                        .content("{\"cameraIds\":[\"front\"],\"limit\":2}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("HTTP 503 - unavailable"));
    }

    @Test
    void seekTimeReturnsSeconds() throws Exception {
        Mockito.when(engine.getMediaSeekTime(
                        ArgumentMatchers.any(), ArgumentMatchers.eq(T0.plusSeconds(2300)), ArgumentMatchers.any()))
                .thenReturn(Optional.of(1500.0));

        mockMvc.perform(post("/api/query/seek-time")
                        .contentType("application/json")
                        .content("{\"cameraId\":\"front\",\"mediaStart\":\"2024-03-10T10:00:00Z\","
                                + "\"mediaEnd\":\"2024-03-10T11:00:00Z\",\"target\":\"2024-03-10T10:38:20Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seconds").value(1500.0));
    }

    @Test
    void retainMapsOutcomesToStatuses() throws Exception {
        Mockito.when(engine.retain("garage", "e1", true)).thenReturn(true);
        Mockito.when(engine.retain("nope", "e1", true)).thenReturn(false);
        Mockito.when(engine.retain("garage", "e2", true))
                .thenThrow(new RetainFailedException(Map.of("event_id", "e2"), new RetainResult(false, "denied")));

        mockMvc.perform(post("/api/cameras/garage/events/e1/retain")
                        .contentType("application/json")
                        .content("{\"retain\":true}"))
                .andExpect(status().isNoContent());
        mockMvc.perform(post("/api/cameras/nope/events/e1/retain")
                        .contentType("application/json")
                        .content("{\"retain\":true}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/cameras/garage/events/e2/retain")
                        .contentType("application/json")
                        .content("{\"retain\":true}"))
                .andExpect(status().isConflict());
    }
}
