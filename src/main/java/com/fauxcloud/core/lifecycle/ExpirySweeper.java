package com.fauxcloud.core.lifecycle;

import com.fauxcloud.core.error.InstanceNotFoundException;
import com.fauxcloud.core.metrics.InstanceMetrics;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that destroys instances whose TTL has passed.
 *
 * <p>Runs on a single thread at a fixed delay, so sweeps never overlap. A failure to destroy one
 * instance is logged and the sweep moves on. Shutdown waits for an in-flight sweep to finish.
 */
@Component
public class ExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final InstanceManager instanceManager;
    private final InstanceMetrics metrics;
    private final LifecycleProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "expiry-sweeper");
        t.setDaemon(true);
        return t;
    });

    public ExpirySweeper(InstanceManager instanceManager, InstanceMetrics metrics,
                         LifecycleProperties properties, Clock clock) {
        this.instanceManager = instanceManager;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        if (!properties.isSweepEnabled()) {
            log.info("Expiry sweeper disabled");
            return;
        }
        long intervalMs = properties.getSweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Expiry sweeper started (interval {})", properties.getSweepInterval());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(properties.getSweepShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Expiry sweep still running after {}; interrupting", properties.getSweepShutdownTimeout());
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Expiry sweeper stopped");
    }

    /**
     * Destroys every expired, non-terminated instance once.
     *
     * @return ids of the instances destroyed by this sweep
     */
    public List<String> sweepOnce() {
        Instant now = clock.instant();
        List<Instance> expired = instanceManager.list(null, null).stream()
                .filter(i -> i.getStatus() != InstanceStatus.TERMINATED && i.isExpired(now))
                .toList();
        if (expired.isEmpty()) {
            metrics.recordSweep(0, 0);
            return List.of();
        }

        log.info("Sweeping {} expired instance(s)", expired.size());
        var destroyed = new ArrayList<String>();
        int failed = 0;
        for (Instance instance : expired) {
            try {
                instanceManager.destroy(instance.getId());
                destroyed.add(instance.getId());
                log.info("Destroyed expired instance {} (expired at {})", instance.getId(), instance.getExpiresAt());
            } catch (InstanceNotFoundException e) {
                log.debug("Expired instance {} already removed", instance.getId());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to destroy expired instance {}: {}", instance.getId(), e.getMessage(), e);
            }
        }
        metrics.recordSweep(destroyed.size(), failed);
        return List.copyOf(destroyed);
    }

    private void sweepSafely() {
        try {
            sweepOnce();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            log.error("Expiry sweep failed", e);
        }
    }
}
