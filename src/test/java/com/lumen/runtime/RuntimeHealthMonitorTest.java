package com.lumen.runtime;

import com.lumen.config.LumenProperties;
import com.lumen.exception.RuntimeFaultException;
import com.lumen.model.HealthStatus;
import com.lumen.model.RuntimeHealth;
import com.lumen.model.RuntimeModel;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.service.telemetry.TelemetryRecorder;
import com.lumen.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RuntimeHealthMonitor.
 */
class RuntimeHealthMonitorTest {

    private MutableClock clock;
    private InferenceRuntimeClient client;
    private TelemetryRecorder telemetry;
    private RuntimeHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        client = mock(InferenceRuntimeClient.class);
        telemetry = mock(TelemetryRecorder.class);

        LumenProperties properties = new LumenProperties();
        properties.getRuntime().setFailureThreshold(3);
        properties.getRuntime().setHealthCacheTtl(Duration.ofSeconds(30));
        monitor = new RuntimeHealthMonitor(client, telemetry, properties, clock);
    }

    private static Mono<RuntimeHealth> healthy() {
        return Mono.just(RuntimeHealth.builder()
                .status(HealthStatus.HEALTHY)
                .models(List.of(RuntimeModel.builder().name("llama3:8b").build()))
                .build());
    }

    @Test
    void testStartsUnhealthyAndDisconnected() {
        assertEquals(HealthStatus.UNHEALTHY, monitor.snapshot().getStatus());
        assertFalse(monitor.isConnected());
    }

    @Test
    void testThresholdFailuresThenRecovery() {
        when(client.probe()).thenReturn(healthy());
        monitor.probe().block();
        assertEquals(HealthStatus.HEALTHY, monitor.snapshot().getStatus());

        when(client.probe()).thenReturn(Mono.error(new RuntimeFaultException("connection refused")));
        monitor.probe().block();
        monitor.probe().block();
        assertEquals(HealthStatus.HEALTHY, monitor.snapshot().getStatus());
        assertEquals(2, monitor.snapshot().getConsecutiveFailures());

        RuntimeHealth third = monitor.probe().block();
        assertNotNull(third);
        assertEquals(HealthStatus.UNHEALTHY, third.getStatus());
        assertEquals("connection refused", third.getLastError());
        assertFalse(monitor.isConnected());

        when(client.probe()).thenReturn(healthy());
        RuntimeHealth recovered = monitor.probe().block();
        assertNotNull(recovered);
        assertEquals(HealthStatus.HEALTHY, recovered.getStatus());
        assertEquals(0, recovered.getConsecutiveFailures());
        assertNull(recovered.getLastError());
        assertTrue(monitor.isConnected());

        verify(telemetry, times(5)).record(eq(TelemetryEventType.HEALTH_PROBE), any(), any());
    }

    @Test
    void testEnsureHealthyReusesFreshResult() {
        when(client.probe()).thenReturn(healthy());

        StepVerifier.create(monitor.ensureHealthy()).verifyComplete();
        StepVerifier.create(monitor.ensureHealthy()).verifyComplete();
        verify(client, times(1)).probe();

        clock.advance(Duration.ofSeconds(31));
        StepVerifier.create(monitor.ensureHealthy()).verifyComplete();
        verify(client, times(2)).probe();
    }

    @Test
    void testEnsureHealthyFailsWhenRuntimeDown() {
        when(client.probe()).thenReturn(Mono.error(new RuntimeFaultException("connection refused")));

        StepVerifier.create(monitor.ensureHealthy())
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RuntimeFaultException.class, error);
                    assertTrue(error.getMessage().contains("connection refused"));
                })
                .verify();
    }

    @Test
    void testHealthProbesWhenNeverConnected() {
        when(client.probe()).thenReturn(healthy());

        RuntimeHealth health = monitor.health().block();

        assertNotNull(health);
        assertEquals(1, health.getModels().size());
        assertEquals(clock.instant(), health.getLastCheck());
        monitor.health().block();
        verify(client, times(1)).probe();
    }
}
