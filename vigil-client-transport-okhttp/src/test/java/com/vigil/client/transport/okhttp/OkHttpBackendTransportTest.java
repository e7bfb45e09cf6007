package com.vigil.client.transport.okhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.backend.model.BackendEvent;
import com.vigil.backend.model.RecordingSegment;
import com.vigil.backend.model.RecordingSummaryDay;
import com.vigil.client.transport.BackendRequests;
import com.vigil.client.transport.NativeEventQuery;
import com.vigil.client.transport.NativeRecordingSegmentsQuery;
import com.vigil.client.transport.PayloadValidationException;
import com.vigil.client.transport.RequestKind;
import com.vigil.client.transport.TransportException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpBackendTransportTest {

    private MockWebServer server;
    private OkHttpBackendTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        transport = new OkHttpBackendTransport(server.url("/api/ws").toString());
    }

    @AfterEach
    void tearDown() throws Exception {
        transport.close();
        server.shutdown();
    }

    @Test
    void postsTypedMessageAndDecodesEvents() throws Exception {
        server.enqueue(new MockResponse()
                .setBody("[{\"id\":\"1700000000.1-abc\",\"camera\":\"front\",\"label\":\"person\","
                        + "\"sub_label\":\"alice, bob\",\"zones\":[\"porch\"],\"start_time\":1700000000.5,"
                        + "\"end_time\":1700000030,\"has_clip\":true,\"has_snapshot\":false,\"extra\":1}]"));

        List<BackendEvent> events = transport.request(BackendRequests.events(new NativeEventQuery(
                "frigate-1", List.of("front"), List.of("person"), null, null, 1699990000L, null, 50, null, null, null)));

        assertThat(events).hasSize(1);
        BackendEvent event = events.get(0);
        assertThat(event.startTime()).isEqualTo(Instant.ofEpochSecond(1700000000L, 500_000_000L));
        assertThat(event.endTime()).isEqualTo(Instant.ofEpochSecond(1700000030L));
        assertThat(event.subLabels()).containsExactly("alice", "bob");
        assertThat(event.hasClip()).isTrue();

        RecordedRequest recorded = server.takeRequest();
        JsonNode body = new ObjectMapper().readTree(recorded.getBody().readUtf8());
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(body.path("type").asText()).isEqualTo("frigate/events/get");
        assertThat(body.path("instance_id").asText()).isEqualTo("frigate-1");
        assertThat(body.path("after").asLong()).isEqualTo(1699990000L);
        assertThat(body.path("limit").asInt()).isEqualTo(50);
        assertThat(body.has("before")).isFalse();
        assertThat(body.has("zones")).isFalse();
    }

    @Test
    void decodesRecordingSummaryWithStringHours() throws Exception {
        server.enqueue(new MockResponse()
                .setBody("[{\"day\":\"2024-03-10\",\"events\":3,\"hours\":[{\"hour\":\"13\",\"events\":2,\"duration\":3600}]}]"));

        List<RecordingSummaryDay> summary =
                transport.request(BackendRequests.recordingsSummary("frigate-1", "front", ZoneId.of("Europe/London")));

        assertThat(summary).singleElement().satisfies(day -> {
            assertThat(day.day()).isEqualTo(LocalDate.of(2024, 3, 10));
            assertThat(day.hours()).singleElement().extracting(RecordingSummaryDay.Hour::hour).isEqualTo(13);
        });
        JsonNode body = new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("timezone").asText()).isEqualTo("Europe/London");
    }

    @Test
    void rejectsPayloadMissingRequiredFields() {
        server.enqueue(new MockResponse().setBody("[{\"id\":\"seg-1\",\"start_time\":1700000000}]"));

        assertThatThrownBy(() -> transport.request(
                        BackendRequests.recordingSegments(new NativeRecordingSegmentsQuery("frigate-1", "front", 0, 10))))
                .isInstanceOf(PayloadValidationException.class)
                .extracting(e -> ((TransportException) e).kind())
                .isEqualTo(RequestKind.RECORDING_SEGMENTS);
    }

    @Test
    void rejectsEmptyPayload() {
        server.enqueue(new MockResponse().setBody(""));

        assertThatThrownBy(() -> transport.request(BackendRequests.retainEvent("frigate-1", "evt", true)))
                .isInstanceOf(PayloadValidationException.class);
    }

    @Test
    void surfacesHttpFailuresAsTransportErrors() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> transport.request(
                        BackendRequests.recordingSegments(new NativeRecordingSegmentsQuery("frigate-1", "front", 0, 10))))
                .isInstanceOf(TransportException.class)
                .isNotInstanceOf(PayloadValidationException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void decodesSegments() {
        server.enqueue(new MockResponse()
                .setBody("[{\"id\":\"seg-1\",\"start_time\":1700000000,\"end_time\":1700000010}]"));

        List<RecordingSegment> segments = transport.request(
                BackendRequests.recordingSegments(new NativeRecordingSegmentsQuery("frigate-1", "front", 0, 10)));

        assertThat(segments).singleElement().satisfies(segment -> assertThat(segment.endTime())
                .isEqualTo(Instant.ofEpochSecond(1700000010L)));
    }
}
