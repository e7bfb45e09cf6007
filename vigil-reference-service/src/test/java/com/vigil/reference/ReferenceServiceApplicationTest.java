package com.vigil.reference;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.client.testkit.InMemoryBackendTransport;
import com.vigil.client.transport.BackendTransport;
import com.vigil.client.transport.okhttp.OkHttpBackendTransport;
import com.vigil.service.core.config.CameraConfigStore;
import com.vigil.service.core.config.FederationProperties;
import com.vigil.service.core.engine.FederationEngine;
import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReferenceServiceApplicationTest {

    @TestConfiguration
    static class TransportOverride {
        @Bean
        BackendTransport inMemoryBackendTransport() {
            return new InMemoryBackendTransport();
        }
    }

    @Autowired
    private FederationProperties properties;

    @Autowired
    private CameraConfigStore cameraStore;

    @Autowired
    private BackendTransport transport;

    @Autowired
    private FederationEngine engine;

    @Test
    void wiresConfiguredCamerasAndTransport() {
        assertThat(engine).isNotNull();
        assertThat(properties.zoneId()).isEqualTo(ZoneId.of("Europe/London"));
        assertThat(properties.getSegments().getGcCooldown()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.getCache().getEventMaxAge()).isEqualTo(Duration.ofSeconds(60));
        assertThat(cameraStore.getCameraConfigEntries()).containsOnlyKeys("porch");
        assertThat(cameraStore.getCameraConfig("porch")).hasValueSatisfying(config -> {
            assertThat(config.instanceId()).isEqualTo("alpha");
            assertThat(config.zones()).containsExactly("steps");
        });
        assertThat(transport).isInstanceOf(InMemoryBackendTransport.class).isNotInstanceOf(OkHttpBackendTransport.class);
    }
}
