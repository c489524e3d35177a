package com.fauxcloud.core.lifecycle;

import com.fauxcloud.core.error.InstanceFailedException;
import com.fauxcloud.core.error.InstanceNotFoundException;
import com.fauxcloud.core.error.InvalidStateException;
import com.fauxcloud.core.error.ReadyTimeoutException;
import com.fauxcloud.core.error.ResourceExhaustedException;
import com.fauxcloud.core.error.ValidationException;
import com.fauxcloud.core.events.EventBus;
import com.fauxcloud.core.events.InstanceEvent;
import com.fauxcloud.core.metrics.InstanceMetrics;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.InstanceCreateRequest;
import com.fauxcloud.core.model.InstanceStatus;
import com.fauxcloud.core.model.Topology;
import com.fauxcloud.core.persistence.FileInstanceStore;
import com.fauxcloud.core.persistence.StoreLockedException;
import com.fauxcloud.orchestration.allocation.PortAllocator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InstanceManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private PortAllocator allocator;
    private FakeOrchestrationBackend backend;
    private FileInstanceStore store;
    private EventBus eventBus;
    private LifecycleProperties properties;
    private SimpleMeterRegistry registry;
    private InstanceManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        allocator = new PortAllocator(port -> true);
        backend = new FakeOrchestrationBackend(allocator);
        store = new FileInstanceStore(tempDir.resolve("state"));
        eventBus = new EventBus();
        properties = new LifecycleProperties();
        properties.getReady().setPollInterval(Duration.ofMillis(10));
        registry = new SimpleMeterRegistry();
        manager = newManager();
        manager.load();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private InstanceManager newManager() {
        return new InstanceManager(backend, store, allocator, id -> "token-" + id, new CredentialGenerator(),
                new RequestValidator(properties), eventBus, new InstanceMetrics(registry), properties, clock);
    }

    private void restartManager() {
        manager.shutdown();
        manager = newManager();
        manager.load();
    }

    private Instance createDefault(String name) {
        return manager.create(InstanceCreateRequest.of(name, 24));
    }

    // ── create ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("returns a provisioned instance with generated identity and credentials")
        void createsProvisionedInstance() {
            Instance instance = manager.create(InstanceCreateRequest.of("demo", 4));

            assertTrue(instance.getId().matches("fsc-[0-9a-f]{16}"), instance.getId());
            assertEquals("demo", instance.getName());
            assertEquals(InstanceStatus.PROVISIONING, instance.getStatus());
            assertEquals(T0, instance.getCreatedAt());
            assertEquals(T0.plus(Duration.ofHours(4)), instance.getExpiresAt());
            assertNull(instance.getStartedAt());
            assertEquals("admin", instance.getCredentials().adminUsername());
            assertFalse(instance.getCredentials().adminPassword().isBlank());
            assertEquals("token-" + instance.getId(), instance.getCredentials().accessToken());
            assertTrue(instance.getCredentials().ingestionToken().matches("[0-9a-f]{64}"));
        }

        @Test
        @DisplayName("persists the instance and reserves its ports")
        void persistsAndReserves() {
            Instance instance = createDefault("demo");

            assertTrue(store.get(instance.getId()).isPresent());
            assertEquals(4, instance.getAllocatedPorts().size());
            instance.getAllocatedPorts().forEach(p -> assertTrue(allocator.isReserved(p)));
        }

        @Test
        @DisplayName("omits the ingestion token when ingestion is disabled")
        void noIngestionToken() {
            var config = InstanceConfig.builder().ingestionEnabled(false).build();
            Instance instance = manager.create(new InstanceCreateRequest("quiet", config, 1, Map.of()));

            assertNull(instance.getCredentials().ingestionToken());
        }

        @Test
        @DisplayName("rejects an invalid request before touching any resource")
        void rejectsInvalidRequest() {
            var request = new InstanceCreateRequest("Bad_Name", InstanceConfig.defaults(), 0, Map.of());

            var e = assertThrows(ValidationException.class, () -> manager.create(request));

            assertEquals(2, e.violations().size());
            assertTrue(manager.list(null, null).isEmpty());
            assertTrue(allocator.reservedPorts().isEmpty());
            assertTrue(backend.calls.isEmpty());
        }

        @Test
        @DisplayName("rejects a TTL above the maximum")
        void rejectsLongTtl() {
            assertThrows(ValidationException.class, () -> manager.create(InstanceCreateRequest.of("demo", 169)));
        }

        @Test
        @DisplayName("leaves no registry entry or reservation when ports run out")
        void portExhaustionRollsBack() {
            allocator = new PortAllocator(port -> false);
            backend = new FakeOrchestrationBackend(allocator);
            restartManager();

            assertThrows(ResourceExhaustedException.class, () -> createDefault("demo"));

            assertTrue(manager.list(null, null).isEmpty());
            assertTrue(allocator.reservedPorts().isEmpty());
            assertTrue(store.list().isEmpty());
        }

        @Test
        @DisplayName("publishes instance.created")
        void publishesCreated() {
            List<InstanceEvent> events = new ArrayList<>();
            eventBus.subscribeAll(events::add);

            Instance instance = createDefault("demo");

            assertEquals(1, events.size());
            assertEquals("instance.created", events.get(0).eventType());
            assertEquals(instance.getId(), events.get(0).instanceId());
        }
    }

    // ── start / stop ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("start and stop")
    class StartStopTests {

        @Test
        @DisplayName("start moves a provisioned instance to STARTING and records startedAt")
        void startProvisioned() {
            Instance created = createDefault("demo");
            clock.advance(Duration.ofMinutes(1));

            Instance started = manager.start(created.getId());

            assertEquals(InstanceStatus.STARTING, started.getStatus());
            assertEquals(T0.plus(Duration.ofMinutes(1)), started.getStartedAt());
            assertEquals(List.of(created.getId() + "-c1"), started.getContainerIds());
            assertEquals(InstanceStatus.STARTING, store.get(created.getId()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("start of a running instance fails naming the current status")
        void startRunningIsInvalid() {
            Instance created = createDefault("demo");
            manager.start(created.getId());
            assertEquals(InstanceStatus.RUNNING, manager.getHealth(created.getId()));

            var e = assertThrows(InvalidStateException.class, () -> manager.start(created.getId()));

            assertEquals(InstanceStatus.RUNNING, e.currentStatus());
            assertTrue(e.getMessage().contains("RUNNING"));
        }

        @Test
        @DisplayName("runtime start failure is captured as ERROR, not thrown")
        void startFailureCaptured() {
            Instance created = createDefault("demo");
            backend.startFailure = "Bind for 0.0.0.0:18000 failed: port is already allocated";

            Instance result = manager.start(created.getId());

            assertEquals(InstanceStatus.ERROR, result.getStatus());
            assertTrue(result.getErrorMessage().contains("port is already allocated"));
            assertEquals(InstanceStatus.ERROR, manager.get(created.getId()).getStatus());
        }

        @Test
        @DisplayName("stop persists STOPPING before STOPPED")
        void stopTransitions() {
            Instance created = createDefault("demo");
            manager.start(created.getId());
            List<InstanceStatus> seen = new CopyOnWriteArrayList<>();
            eventBus.subscribe(created.getId(), e -> seen.add(e.status()));

            Instance stopped = manager.stop(created.getId());

            assertEquals(InstanceStatus.STOPPED, stopped.getStatus());
            assertEquals(List.of(InstanceStatus.STOPPING, InstanceStatus.STOPPED), seen);
            assertEquals(InstanceStatus.STOPPED, store.get(created.getId()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("start, stop, start keeps exactly the original port reservation")
        void restartDoesNotLeakPorts() {
            Instance created = createDefault("demo");
            Set<Integer> before = allocator.reservedPorts();

            manager.start(created.getId());
            manager.stop(created.getId());
            Instance restarted = manager.start(created.getId());

            assertEquals(InstanceStatus.STARTING, restarted.getStatus());
            assertEquals(before, allocator.reservedPorts());
            assertEquals(Set.copyOf(created.getAllocatedPorts()), allocator.reservedPorts());
        }

        @Test
        @DisplayName("operations on unknown ids raise NotFound")
        void unknownId() {
            assertThrows(InstanceNotFoundException.class, () -> manager.start("fsc-0000000000000000"));
            assertThrows(InstanceNotFoundException.class, () -> manager.stop("fsc-0000000000000000"));
            assertThrows(InstanceNotFoundException.class, () -> manager.get("fsc-0000000000000000"));
        }
    }

    // ── destroy ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("destroy")
    class DestroyTests {

        @Test
        @DisplayName("removes the instance, its record and its ports")
        void destroyRemovesEverything() {
            Instance created = createDefault("demo");
            manager.start(created.getId());

            Instance destroyed = manager.destroy(created.getId());

            assertEquals(InstanceStatus.TERMINATED, destroyed.getStatus());
            assertThrows(InstanceNotFoundException.class, () -> manager.get(created.getId()));
            assertTrue(store.get(created.getId()).isEmpty());
            assertTrue(allocator.reservedPorts().isEmpty());
        }

        @Test
        @DisplayName("a second destroy raises NotFound")
        void destroyTwice() {
            Instance created = createDefault("demo");
            manager.destroy(created.getId());

            assertThrows(InstanceNotFoundException.class, () -> manager.destroy(created.getId()));
        }

        @Test
        @DisplayName("marks ERROR and raises when no cleanup step succeeds")
        void destroyFailure() {
            Instance created = createDefault("demo");
            backend.destroyFailures.add(created.getId());

            assertThrows(InstanceFailedException.class, () -> manager.destroy(created.getId()));

            Instance after = manager.get(created.getId());
            assertEquals(InstanceStatus.ERROR, after.getStatus());
            assertTrue(after.getErrorMessage().contains("daemon unreachable"));
            assertFalse(allocator.reservedPorts().isEmpty());
        }

        @Test
        @DisplayName("an ERROR instance can still be destroyed")
        void destroyFromError() {
            Instance created = createDefault("demo");
            backend.startFailure = "boom";
            manager.start(created.getId());

            assertEquals(InstanceStatus.TERMINATED, manager.destroy(created.getId()).getStatus());
        }
    }

    // ── health and readiness ───────────────────────────────────────────────

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("an instance that was never started keeps its status")
        void notStartedKeepsStatus() {
            Instance created = createDefault("demo");

            assertEquals(InstanceStatus.PROVISIONING, manager.getHealth(created.getId()));
            assertFalse(backend.calls.contains("health:" + created.getId()));
        }

        @Test
        @DisplayName("records a changed verdict")
        void recordsVerdict() {
            Instance created = createDefault("demo");
            manager.start(created.getId());

            assertEquals(InstanceStatus.RUNNING, manager.getHealth(created.getId()));
            assertEquals(InstanceStatus.RUNNING, manager.get(created.getId()).getStatus());
            assertEquals(InstanceStatus.RUNNING, store.get(created.getId()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("never overrides STOPPING")
        void stoppingIsNotOverridden() {
            Instance created = createDefault("demo");
            manager.start(created.getId());
            Instance stopping = store.get(created.getId()).orElseThrow();
            stopping.transitionTo(InstanceStatus.STOPPING);
            store.put(stopping);
            restartManager();

            assertEquals(InstanceStatus.STOPPING, manager.getHealth(created.getId()));
            assertFalse(backend.calls.contains("health:" + created.getId()));
        }

        @Test
        @DisplayName("waitForReady returns once RUNNING")
        void waitForReadyReturns() throws Exception {
            Instance created = createDefault("demo");
            manager.start(created.getId());

            Instance ready = manager.waitForReady(created.getId(), Duration.ofSeconds(5));

            assertEquals(InstanceStatus.RUNNING, ready.getStatus());
        }

        @Test
        @DisplayName("waitForReady times out while still STARTING")
        void waitForReadyTimesOut() {
            Instance created = createDefault("demo");
            backend.healthVerdicts.put(created.getId(), InstanceStatus.STARTING);
            manager.start(created.getId());

            assertThrows(ReadyTimeoutException.class,
                    () -> manager.waitForReady(created.getId(), Duration.ofMillis(50)));
        }

        @Test
        @DisplayName("waitForReady fails fast when the instance enters ERROR")
        void waitForReadyFailsOnError() {
            Instance created = createDefault("demo");
            backend.healthVerdicts.put(created.getId(), InstanceStatus.ERROR);
            manager.start(created.getId());

            assertThrows(InstanceFailedException.class,
                    () -> manager.waitForReady(created.getId(), Duration.ofSeconds(5)));
        }

        @Test
        @DisplayName("cancelling the asynchronous wait stops polling")
        void asyncWaitCancels() throws Exception {
            Instance created = createDefault("demo");
            backend.healthVerdicts.put(created.getId(), InstanceStatus.STARTING);
            manager.start(created.getId());

            var future = manager.waitForReadyAsync(created.getId(), Duration.ofMinutes(5));
            Thread.sleep(30);
            assertTrue(future.cancel(true));

            assertThrows(CancellationException.class, future::join);
        }

        @Test
        @DisplayName("asynchronous wait completes with the running instance")
        void asyncWaitCompletes() throws Exception {
            Instance created = createDefault("demo");
            manager.start(created.getId());

            Instance ready = manager.waitForReadyAsync(created.getId(), Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

            assertEquals(InstanceStatus.RUNNING, ready.getStatus());
        }
    }

    // ── TTL, listing, logs ─────────────────────────────────────────────────

    @Nested
    @DisplayName("extendTtl")
    class ExtendTests {

        @Test
        @DisplayName("adds hours to the current expiry")
        void extendsExpiry() {
            Instance created = manager.create(InstanceCreateRequest.of("demo", 2));

            Instance extended = manager.extendTtl(created.getId(), 3);

            assertEquals(T0.plus(Duration.ofHours(5)), extended.getExpiresAt());
        }

        @Test
        @DisplayName("caps the expiry at now plus the maximum TTL")
        void capsAtMaximum() {
            Instance created = manager.create(InstanceCreateRequest.of("demo", 168));
            clock.advance(Duration.ofHours(1));

            Instance extended = manager.extendTtl(created.getId(), 48);

            assertEquals(T0.plus(Duration.ofHours(169)), extended.getExpiresAt());
        }

        @Test
        @DisplayName("rejects fewer than one hour")
        void rejectsZero() {
            Instance created = createDefault("demo");

            assertThrows(ValidationException.class, () -> manager.extendTtl(created.getId(), 0));
        }
    }

    @Nested
    @DisplayName("list and logs")
    class ListTests {

        @Test
        @DisplayName("filters by status and labels")
        void filters() {
            Instance a = manager.create(new InstanceCreateRequest("a", null, 1, Map.of("team", "red")));
            clock.advance(Duration.ofSeconds(1));
            Instance b = manager.create(new InstanceCreateRequest("b", null, 1, Map.of("team", "blue")));
            manager.start(b.getId());

            assertEquals(List.of(a.getId(), b.getId()), manager.list(null, null).stream().map(Instance::getId).toList());
            assertEquals(List.of(a.getId()), manager.list(null, Map.of("team", "red")).stream().map(Instance::getId).toList());
            assertEquals(List.of(b.getId()), manager.list(InstanceStatus.STARTING, null).stream().map(Instance::getId).toList());
            assertTrue(manager.list(InstanceStatus.STARTING, Map.of("team", "red")).isEmpty());
        }

        @Test
        @DisplayName("returns copies that do not affect the registry")
        void returnsCopies() {
            Instance created = createDefault("demo");
            created.getLabels().put("mutated", "yes");
            created.setStatus(InstanceStatus.RUNNING);

            Instance fresh = manager.get(created.getId());
            assertEquals(InstanceStatus.PROVISIONING, fresh.getStatus());
            assertFalse(fresh.getLabels().containsKey("mutated"));
        }

        @Test
        @DisplayName("delegates logs to the backend")
        void logs() {
            Instance created = createDefault("demo");

            String logs = manager.getLogs(created.getId(), null, 50);

            assertTrue(logs.startsWith("=== " + created.getId()));
            assertTrue(logs.contains("tail 50"));
        }
    }

    // ── registry reload and concurrency ────────────────────────────────────

    @Nested
    @DisplayName("registry")
    class RegistryTests {

        @Test
        @DisplayName("reload restores instances and re-reserves their ports")
        void reloadReReservesPorts() {
            Instance created = createDefault("demo");
            allocator = new PortAllocator(port -> true);
            backend = new FakeOrchestrationBackend(allocator);

            restartManager();

            assertEquals(created.getId(), manager.get(created.getId()).getId());
            assertEquals(Set.copyOf(created.getAllocatedPorts()), allocator.reservedPorts());
        }

        @Test
        @DisplayName("a second manager on the same state is refused and hands out no ports")
        void secondManagerOnSameStoreIsRefused() {
            var otherAllocator = new PortAllocator(port -> true);
            var other = new InstanceManager(new FakeOrchestrationBackend(otherAllocator),
                    new FileInstanceStore(tempDir.resolve("state")), otherAllocator, id -> "token-" + id, new CredentialGenerator(), new RequestValidator(properties),
                    new EventBus(), new InstanceMetrics(new SimpleMeterRegistry()), properties, clock);

            assertThrows(StoreLockedException.class, other::load);
            assertTrue(otherAllocator.reservedPorts().isEmpty());

            Instance created = createDefault("demo");
            manager.shutdown();
            other.load();
            try {
                assertEquals(created.getId(), other.get(created.getId()).getId());
                assertEquals(Set.copyOf(created.getAllocatedPorts()), otherAllocator.reservedPorts());
                Instance next = other.create(InstanceCreateRequest.of("next", 4));
                assertTrue(next.getAllocatedPorts().stream().noneMatch(created.getAllocatedPorts()::contains));
            } finally {
                other.shutdown();
            }
        }

        @Test
        @DisplayName("concurrent creations never share a port")
        void concurrentCreatesAreDisjoint() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Instance>> futures = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    String name = "inst-" + i;
                    futures.add(pool.submit(() -> createDefault(name)));
                }
                Set<Integer> seen = new HashSet<>();
                int total = 0;
                for (Future<Instance> future : futures) {
                    List<Integer> ports = future.get(10, TimeUnit.SECONDS).getAllocatedPorts();
                    total += ports.size();
                    seen.addAll(ports);
                }
                assertEquals(64, total);
                assertEquals(total, seen.size());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("records transition counters")
        void metricsRecorded() {
            Instance created = createDefault("demo");
            manager.start(created.getId());

            assertEquals(1.0, registry.get("fauxcloud.instance.transitions").tag("status", "STARTING").counter().count());
            assertEquals(1L, registry.get("fauxcloud.operation.duration")
                    .tag("operation", "start").tag("outcome", "success").timer().count());
        }
    }

    // ── end-to-end scenario ────────────────────────────────────────────────

    @Test
    @DisplayName("standalone scenario: create, start, ready, expire")
    void standaloneScenario() throws ExecutionException, InterruptedException {
        var config = InstanceConfig.builder().topology(Topology.STANDALONE).build();
        Instance created = manager.create(new InstanceCreateRequest("scenario", config, 1, Map.of()));

        assertEquals(List.of(18000, 18089, 18088, 19997), created.getAllocatedPorts());
        assertEquals("http://localhost:18000", created.getEndpoints().webUrl());

        manager.start(created.getId());
        assertEquals(InstanceStatus.RUNNING, manager.waitForReady(created.getId(), Duration.ofSeconds(5)).getStatus());

        clock.advance(Duration.ofHours(2));
        var sweeper = new ExpirySweeper(manager, new InstanceMetrics(registry), properties, clock);
        assertEquals(List.of(created.getId()), sweeper.sweepOnce());
        assertTrue(manager.list(null, null).isEmpty());
        assertTrue(allocator.reservedPorts().isEmpty());
    }
}
