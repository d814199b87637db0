package com.lumen.runtime;

import com.lumen.config.LumenProperties;
import com.lumen.exception.RuntimeFaultException;
import com.lumen.model.HealthStatus;
import com.lumen.model.RuntimeHealth;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.service.telemetry.TelemetryRecorder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether the inference runtime is reachable.
 * <p>
 * Starts UNHEALTHY and never connected. One successful probe makes it HEALTHY;
 * {@code failureThreshold} consecutive failed probes (timeouts included) make it
 * UNHEALTHY again. Probe results are reused for {@code healthCacheTtl}.
 */
@Slf4j
@Component
public class RuntimeHealthMonitor {

    private static final String SOURCE = "runtime-health";

    private final InferenceRuntimeClient client;
    private final TelemetryRecorder telemetry;
    private final LumenProperties.RuntimeConfig config;
    private final Clock clock;
    private final AtomicBoolean periodicProbeRunning = new AtomicBoolean(false);

    // Guarded by this
    private RuntimeHealth snapshot = RuntimeHealth.initial();
    private boolean connected;
    private Instant lastSuccessAt;

    private ScheduledExecutorService scheduler;

    public RuntimeHealthMonitor(
            InferenceRuntimeClient client,
            TelemetryRecorder telemetry,
            LumenProperties properties,
            Clock clock) {
        this.client = client;
        this.telemetry = telemetry;
        this.config = properties.getRuntime();
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!config.isMonitoringEnabled()) {
            log.info("Runtime health monitoring disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "runtime-health");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = config.getHealthCheckInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::periodicProbe, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Runtime health monitor started for {} (every {}ms)", config.getBaseUrl(), intervalMs);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void periodicProbe() {
        if (!periodicProbeRunning.compareAndSet(false, true)) {
            return;
        }
        probe()
                .doFinally(signal -> periodicProbeRunning.set(false))
                .subscribe();
    }

    /**
     * Probe the runtime now and fold the outcome into the health state.
     * Never errors; a failed probe yields the updated snapshot.
     */
    public Mono<RuntimeHealth> probe() {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return client.probe()
                    .map(result -> onSuccess(result, elapsedMs(start)))
                    .onErrorResume(error -> Mono.just(onFailure(error, elapsedMs(start))));
        });
    }

    /**
     * Cached snapshot while it is fresh, otherwise a new probe.
     */
    public Mono<RuntimeHealth> health() {
        synchronized (this) {
            if (connected && isFresh()) {
                return Mono.just(snapshot);
            }
        }
        return probe();
    }

    /**
     * Probe only when never connected, not healthy, or the cached result is stale.
     *
     * @return error {@link RuntimeFaultException} when the runtime is still unhealthy
     */
    public Mono<Void> ensureHealthy() {
        synchronized (this) {
            if (connected && snapshot.getStatus() == HealthStatus.HEALTHY && isFresh()) {
                return Mono.empty();
            }
        }
        return probe().flatMap(result -> result.getStatus() == HealthStatus.HEALTHY
                ? Mono.<Void>empty()
                : Mono.error(new RuntimeFaultException("Inference runtime is unavailable"
                        + (result.getLastError() != null ? ": " + result.getLastError() : ""))));
    }

    public synchronized RuntimeHealth snapshot() {
        return snapshot;
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    private boolean isFresh() {
        return lastSuccessAt != null
                && Duration.between(lastSuccessAt, clock.instant()).compareTo(config.getHealthCacheTtl()) < 0;
    }

    private RuntimeHealth onSuccess(RuntimeHealth result, long durationMs) {
        RuntimeHealth updated;
        boolean recovered;
        synchronized (this) {
            recovered = snapshot.getStatus() != HealthStatus.HEALTHY;
            Instant now = clock.instant();
            updated = result.toBuilder()
                    .status(HealthStatus.HEALTHY)
                    .consecutiveFailures(0)
                    .lastCheck(now)
                    .lastError(null)
                    .build();
            snapshot = updated;
            connected = true;
            lastSuccessAt = now;
        }
        if (recovered) {
            log.info("Inference runtime is healthy ({} models)", updated.getModels().size());
        }
        recordProbe(updated, durationMs, null);
        return updated;
    }

    private RuntimeHealth onFailure(Throwable error, long durationMs) {
        RuntimeHealth updated;
        synchronized (this) {
            int failures = snapshot.getConsecutiveFailures() + 1;
            HealthStatus status = failures >= config.getFailureThreshold()
                    ? HealthStatus.UNHEALTHY
                    : snapshot.getStatus();
            updated = snapshot.toBuilder()
                    .status(status)
                    .consecutiveFailures(failures)
                    .lastCheck(clock.instant())
                    .lastError(error.getMessage())
                    .build();
            snapshot = updated;
            if (status == HealthStatus.UNHEALTHY) {
                connected = false;
                lastSuccessAt = null;
            }
        }
        log.warn("Runtime health probe failed ({} consecutive, status {}): {}",
                updated.getConsecutiveFailures(), updated.getStatus(), error.getMessage());
        recordProbe(updated, durationMs, error.getMessage());
        return updated;
    }

    private void recordProbe(RuntimeHealth health, long durationMs, String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", health.getStatus().name());
        result.put("consecutiveFailures", health.getConsecutiveFailures());
        result.put("models", health.getModels() != null ? health.getModels().size() : 0);
        telemetry.record(TelemetryEventType.HEALTH_PROBE, SOURCE, TelemetryData.builder()
                .operation("health_probe")
                .result(result)
                .error(error)
                .durationMs(durationMs)
                .build());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
