package com.lumen.service.telemetry;

import com.lumen.model.telemetry.ResourceUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;

/**
 * Resource figures from the JVM's management beans, resampled at most once per second.
 */
@Slf4j
@Component
public class JvmResourceUsageProvider implements ResourceUsageProvider {

    private static final long SAMPLE_INTERVAL_MS = 1000;
    private static final double MB = 1024.0 * 1024.0;

    private final Clock clock;
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    private volatile ResourceUsage lastSample = ResourceUsage.empty();
    private volatile long lastSampleAt = Long.MIN_VALUE;

    public JvmResourceUsageProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ResourceUsage current() {
        long now = clock.millis();
        if (lastSampleAt != Long.MIN_VALUE && now - lastSampleAt < SAMPLE_INTERVAL_MS) {
            return lastSample;
        }
        ResourceUsage sample = sample();
        lastSample = sample;
        lastSampleAt = now;
        return sample;
    }

    private ResourceUsage sample() {
        Runtime runtime = Runtime.getRuntime();
        double usedMemoryMb = (runtime.totalMemory() - runtime.freeMemory()) / MB;

        File root = new File("/");
        double usedDiskMb = (root.getTotalSpace() - root.getUsableSpace()) / MB;

        return ResourceUsage.builder()
                .cpu(cpuPercent())
                .memoryMb(usedMemoryMb)
                .diskMb(Math.max(0.0, usedDiskMb))
                .build();
    }

    private double cpuPercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) osBean).getProcessCpuLoad();
            if (load >= 0) {
                return load * 100.0;
            }
        }
        // Fall back to load average per core when process load is unavailable
        double loadAverage = osBean.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0.0;
        }
        return Math.min(100.0, loadAverage / osBean.getAvailableProcessors() * 100.0);
    }
}
