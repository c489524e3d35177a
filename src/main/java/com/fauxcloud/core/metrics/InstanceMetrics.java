package com.fauxcloud.core.metrics;

import com.fauxcloud.core.model.InstanceStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for instance lifecycle operations.
 */
@Service
public class InstanceMetrics {

    private final MeterRegistry registry;

    public InstanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, boolean success, Duration duration) {
        Timer.builder("fauxcloud.operation.duration")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(duration);
    }

    public void recordTransition(InstanceStatus status) {
        Counter.builder("fauxcloud.instance.transitions")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    /**
     * Records one completed expiry sweep and how many instances it destroyed or failed to destroy.
     */
    public void recordSweep(int destroyed, int failed) {
        Counter.builder("fauxcloud.sweep.runs")
                .register(registry)
                .increment();
        Counter.builder("fauxcloud.sweep.destroyed")
                .description("Expired instances destroyed by the sweeper")
                .register(registry)
                .increment(destroyed);
        Counter.builder("fauxcloud.sweep.failures")
                .description("Expired instances the sweeper failed to destroy")
                .register(registry)
                .increment(failed);
    }

    public void registerActiveInstances(Supplier<Number> count) {
        Gauge.builder("fauxcloud.instances.active", count)
                .description("Instances held in the registry")
                .register(registry);
    }
}
