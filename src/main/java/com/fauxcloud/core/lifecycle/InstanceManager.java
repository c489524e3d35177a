package com.fauxcloud.core.lifecycle;

import com.fauxcloud.core.error.InstanceException;
import com.fauxcloud.core.error.InstanceFailedException;
import com.fauxcloud.core.error.InstanceNotFoundException;
import com.fauxcloud.core.error.InvalidStateException;
import com.fauxcloud.core.error.ReadyTimeoutException;
import com.fauxcloud.core.events.EventBus;
import com.fauxcloud.core.events.InstanceEvent;
import com.fauxcloud.core.logging.MdcContext;
import com.fauxcloud.core.metrics.InstanceMetrics;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceCreateRequest;
import com.fauxcloud.core.model.InstanceCredentials;
import com.fauxcloud.core.model.InstanceStatus;
import com.fauxcloud.core.persistence.InstanceStore;
import com.fauxcloud.core.persistence.StoreLock;
import com.fauxcloud.core.security.AccessTokenIssuer;
import com.fauxcloud.orchestration.DestroyReport;
import com.fauxcloud.orchestration.OrchestrationBackend;
import com.fauxcloud.orchestration.ProvisionResult;
import com.fauxcloud.orchestration.allocation.PortAllocator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the registry of live instances and drives them through their lifecycle.
 *
 * <p>Mutating calls on one instance are serialised by a per-instance lock; calls on different
 * instances proceed in parallel. Every transition is written through to the {@link InstanceStore}
 * before the registry entry is replaced, and callers only ever receive copies.
 */
@Service
public class InstanceManager {

    private static final Logger log = LoggerFactory.getLogger(InstanceManager.class);

    private static final Set<InstanceStatus> NOT_STARTED = EnumSet.of(
            InstanceStatus.PENDING, InstanceStatus.PROVISIONING, InstanceStatus.STOPPED);

    private final ConcurrentHashMap<String, Instance> registry = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final OrchestrationBackend backend;
    private final InstanceStore store;
    private final PortAllocator portAllocator;
    private final AccessTokenIssuer tokenIssuer;
    private final CredentialGenerator credentialGenerator;
    private final RequestValidator validator;
    private final EventBus eventBus;
    private final InstanceMetrics metrics;
    private final LifecycleProperties properties;
    private final Clock clock;

    private volatile StoreLock storeLock;

    private final ExecutorService readyWaiters = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "instance-ready-wait");
        t.setDaemon(true);
        return t;
    });

    public InstanceManager(OrchestrationBackend backend, InstanceStore store, PortAllocator portAllocator,
                           AccessTokenIssuer tokenIssuer, CredentialGenerator credentialGenerator,
                           RequestValidator validator, EventBus eventBus, InstanceMetrics metrics,
                           LifecycleProperties properties, Clock clock) {
        this.backend = backend;
        this.store = store;
        this.portAllocator = portAllocator;
        this.tokenIssuer = tokenIssuer;
        this.credentialGenerator = credentialGenerator;
        this.validator = validator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Claims the store, then loads persisted instances and re-reserves their host ports.
     *
     * @throws com.fauxcloud.core.persistence.StoreLockedException if another manager owns the store
     */
    @PostConstruct
    public void load() {
        storeLock = store.claim();
        for (Instance instance : store.list()) {
            if (instance.getStatus().isTerminal()) {
                store.delete(instance.getId());
                continue;
            }
            registry.put(instance.getId(), instance);
            portAllocator.reserve(instance.getAllocatedPorts());
        }
        metrics.registerActiveInstances(registry::size);
        log.info("Loaded {} instance(s) from store", registry.size());
    }

    @PreDestroy
    void shutdown() {
        readyWaiters.shutdownNow();
        StoreLock lock = storeLock;
        if (lock != null) {
            storeLock = null;
            lock.close();
        }
    }

    public Instance create(InstanceCreateRequest request) {
        validator.validate(request);

        String id = credentialGenerator.instanceId();
        return timed(id, "create", () -> {
            Instant now = clock.instant();
            var instance = new Instance(id, request.name(), request.config(), now,
                    now.plus(Duration.ofHours(request.ttlHours())), request.labels());

            var credentials = new InstanceCredentials(
                    InstanceCredentials.ADMIN_USERNAME,
                    credentialGenerator.adminPassword(),
                    tokenIssuer.issue(id),
                    request.config().ingestionEnabled() ? credentialGenerator.ingestionToken() : null);
            instance.setCredentials(credentials);

            return withLock(id, () -> {
                ProvisionResult result = backend.provision(instance, credentials);
                Instance provisioned = result.instance();
                try {
                    store.put(provisioned);
                } catch (RuntimeException e) {
                    DestroyReport report = backend.destroy(provisioned);
                    log.error("Failed to persist {}; rolled back (released ports {})", id, report.releasedPorts(), e);
                    throw new InstanceFailedException(id, "Failed to persist instance: " + e.getMessage(), e);
                }
                registry.put(id, provisioned);
                metrics.recordTransition(provisioned.getStatus());
                publish("instance.created", provisioned, Map.of("topology", provisioned.getConfig().topology().name()));
                log.info("Created instance {} ({}) expiring at {}", id, request.name(), provisioned.getExpiresAt());
                return provisioned.copy();
            });
        });
    }

    public Instance get(String id) {
        return require(id).copy();
    }

    /**
     * Instances ordered by creation time, optionally filtered by status and by labels that must all match.
     */
    public List<Instance> list(InstanceStatus status, Map<String, String> labels) {
        Map<String, String> required = labels != null ? labels : Map.of();
        return registry.values().stream()
                .filter(i -> status == null || i.getStatus() == status)
                .filter(i -> i.hasLabels(required))
                .sorted(Comparator.comparing(Instance::getCreatedAt).thenComparing(Instance::getId))
                .map(Instance::copy)
                .toList();
    }

    public Instance start(String id) {
        return timed(id, "start", () -> withLock(id, () -> {
            Instance current = require(id);
            if (!current.getStatus().canStart()) {
                throw new InvalidStateException(id, "start", current.getStatus());
            }
            var starting = current.copy();
            starting.transitionTo(InstanceStatus.STARTING);
            starting.setStartedAt(clock.instant());
            commit(starting, "instance.starting");

            Instance started;
            try {
                started = backend.start(starting);
            } catch (RuntimeException e) {
                log.error("Start of {} failed", id, e);
                started = starting.copy();
                started.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            if (started.getStatus() == InstanceStatus.ERROR) {
                log.warn("Instance {} failed to start: {}", id, started.getErrorMessage());
                commit(started, "instance.failed");
            } else {
                commit(started, "instance.started");
            }
            return started.copy();
        }));
    }

    public Instance stop(String id) {
        return timed(id, "stop", () -> withLock(id, () -> {
            Instance current = require(id);
            if (current.getStatus().isTerminal()) {
                throw new InvalidStateException(id, "stop", current.getStatus());
            }
            var stopping = current.copy();
            stopping.transitionTo(InstanceStatus.STOPPING);
            commit(stopping, "instance.stopping");

            Instance stopped;
            try {
                stopped = backend.stop(stopping);
            } catch (RuntimeException e) {
                var failed = stopping.copy();
                failed.fail("Stop failed: " + e.getMessage());
                commit(failed, "instance.failed");
                throw new InstanceFailedException(id, failed.getErrorMessage(), e);
            }
            commit(stopped, "instance.stopped");
            log.info("Stopped instance {}", id);
            return stopped.copy();
        }));
    }

    /**
     * Tears the instance down. Cleanup is best effort: as long as one step succeeded the instance is
     * removed from the registry and the store; if none did it is left in {@code ERROR}.
     *
     * @return the final {@code TERMINATED} snapshot
     */
    public Instance destroy(String id) {
        return timed(id, "destroy", () -> withLock(id, () -> {
            Instance current = require(id);
            if (current.getStatus().isTerminal()) {
                throw new InvalidStateException(id, "destroy", current.getStatus());
            }

            DestroyReport report;
            try {
                report = backend.destroy(current.copy());
            } catch (RuntimeException e) {
                log.error("Destroy of {} failed", id, e);
                report = new DestroyReport(false, false, List.of(), List.of(String.valueOf(e.getMessage())));
            }

            if (!report.anyRemoved()) {
                var failed = current.copy();
                failed.fail("Destroy failed: " + String.join("; ", report.failures()));
                commit(failed, "instance.failed");
                throw new InstanceFailedException(id, failed.getErrorMessage());
            }
            if (!report.complete()) {
                log.warn("Partial cleanup of {}: {}", id, report.failures());
            }

            try {
                store.delete(id);
            } catch (RuntimeException e) {
                log.warn("Failed to delete persisted record of {}", id, e);
            }
            registry.remove(id);

            var terminated = current.copy();
            terminated.transitionTo(InstanceStatus.TERMINATED);
            metrics.recordTransition(InstanceStatus.TERMINATED);
            publish("instance.destroyed", terminated, Map.of("released_ports", report.releasedPorts()));
            log.info("Destroyed instance {} (released ports {})", id, report.releasedPorts());
            return terminated;
        }));
    }

    /**
     * Asks the backend for a verdict and records it when the status changed. {@code STOPPING} is never
     * overridden, and instances without containers that have not been started keep their status.
     */
    public InstanceStatus getHealth(String id) {
        return withLock(id, () -> {
            Instance current = require(id);
            InstanceStatus status = current.getStatus();
            if (status == InstanceStatus.STOPPING || status.isTerminal()) {
                return status;
            }
            if (current.getContainerIds().isEmpty() && NOT_STARTED.contains(status)) {
                return status;
            }

            InstanceStatus verdict = backend.health(current.copy());
            if (verdict != status) {
                var updated = current.copy();
                if (verdict == InstanceStatus.ERROR) {
                    updated.fail("Container inspection failed");
                } else {
                    updated.transitionTo(verdict);
                }
                commit(updated, "instance.health_changed");
                log.info("Instance {} health changed {} -> {}", id, status, verdict);
            }
            return verdict;
        });
    }

    /**
     * Polls {@link #getHealth} until the instance is {@code RUNNING}.
     *
     * @throws InstanceFailedException if the instance enters {@code ERROR}
     * @throws ReadyTimeoutException   if the timeout elapses first
     * @throws InterruptedException    if the waiting thread is interrupted
     */
    public Instance waitForReady(String id, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollNanos = properties.getReadyPollInterval().toNanos();
        while (true) {
            InstanceStatus status = getHealth(id);
            if (status == InstanceStatus.RUNNING) {
                return get(id);
            }
            if (status == InstanceStatus.ERROR) {
                throw new InstanceFailedException(id, "Instance entered ERROR: " + require(id).getErrorMessage());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new ReadyTimeoutException(id, timeout);
            }
            Thread.sleep(Duration.ofNanos(Math.min(pollNanos, remaining)).toMillis());
        }
    }

    /**
     * Runs {@link #waitForReady} on a background thread. Cancelling the returned future interrupts the wait.
     */
    public CompletableFuture<Instance> waitForReadyAsync(String id, Duration timeout) {
        var future = new CompletableFuture<Instance>();
        Future<?> task = readyWaiters.submit(() -> {
            try {
                future.complete(waitForReady(id, timeout));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(false);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                task.cancel(true);
            }
        });
        return future;
    }

    /**
     * Pushes the expiry out by {@code hours}, capped at now plus the maximum TTL.
     */
    public Instance extendTtl(String id, int hours) {
        validator.validateExtension(hours);
        return timed(id, "extend", () -> withLock(id, () -> {
            Instance current = require(id);
            if (current.getStatus().isTerminal()) {
                throw new InvalidStateException(id, "extend", current.getStatus());
            }
            Instant requested = current.getExpiresAt().plus(Duration.ofHours(hours));
            Instant cap = clock.instant().plus(Duration.ofHours(properties.getMaxTtlHours()));
            var extended = current.copy();
            extended.setExpiresAt(requested.isAfter(cap) ? cap : requested);
            commit(extended, "instance.extended");
            log.info("Extended {} to {}", id, extended.getExpiresAt());
            return extended.copy();
        }));
    }

    public String getLogs(String id, String component, int tail) {
        Instance current = require(id);
        return backend.logs(current.copy(), component, tail > 0 ? tail : 100);
    }

    private Instance require(String id) {
        Instance instance = registry.get(id);
        if (instance == null) {
            throw new InstanceNotFoundException(id);
        }
        return instance;
    }

    private void commit(Instance updated, String eventType) {
        Instance previous = registry.get(updated.getId());
        try {
            store.put(updated);
        } catch (RuntimeException e) {
            throw new InstanceFailedException(updated.getId(), "Failed to persist instance: " + e.getMessage(), e);
        }
        registry.put(updated.getId(), updated);
        if (previous == null || previous.getStatus() != updated.getStatus()) {
            metrics.recordTransition(updated.getStatus());
        }
        publish(eventType, updated, Map.of());
    }

    private void publish(String eventType, Instance instance, Map<String, Object> payload) {
        eventBus.publish(new InstanceEvent(eventType, instance.getId(), instance.getStatus(), payload, clock.instant()));
    }

    private <T> T withLock(String id, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            if (!registry.containsKey(id)) {
                locks.remove(id, lock);
            }
        }
    }

    private <T> T timed(String id, String operation, Supplier<T> action) {
        MdcContext.setOperation(id, operation);
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } catch (InstanceException e) {
            log.debug("{} {} rejected: {}", operation, id, e.getMessage());
            throw e;
        } finally {
            metrics.recordOperation(operation, success, Duration.ofNanos(System.nanoTime() - start));
            MdcContext.clear();
        }
    }
}
