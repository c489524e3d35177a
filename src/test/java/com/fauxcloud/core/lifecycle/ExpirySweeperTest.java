package com.fauxcloud.core.lifecycle;

import com.fauxcloud.core.events.EventBus;
import com.fauxcloud.core.metrics.InstanceMetrics;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceCreateRequest;
import com.fauxcloud.core.model.InstanceStatus;
import com.fauxcloud.core.persistence.FileInstanceStore;
import com.fauxcloud.orchestration.allocation.PortAllocator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExpirySweeperTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FakeOrchestrationBackend backend;
    private LifecycleProperties properties;
    private SimpleMeterRegistry registry;
    private InstanceManager manager;
    private ExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        var allocator = new PortAllocator(port -> true);
        backend = new FakeOrchestrationBackend(allocator);
        properties = new LifecycleProperties();
        registry = new SimpleMeterRegistry();
        var metrics = new InstanceMetrics(registry);
        manager = new InstanceManager(backend, new FileInstanceStore(tempDir), allocator, id -> "t",
                new CredentialGenerator(), new RequestValidator(properties), new EventBus(), metrics, properties, clock);
        manager.load();
        sweeper = new ExpirySweeper(manager, metrics, properties, clock);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    @DisplayName("destroys only instances whose expiry has passed")
    void destroysExpiredOnly() {
        Instance shortLived = manager.create(InstanceCreateRequest.of("short", 1));
        Instance longLived = manager.create(InstanceCreateRequest.of("long", 24));
        clock.advance(Duration.ofHours(2));

        List<String> destroyed = sweeper.sweepOnce();

        assertEquals(List.of(shortLived.getId()), destroyed);
        assertEquals(List.of(longLived.getId()), manager.list(null, null).stream().map(Instance::getId).toList());
    }

    @Test
    @DisplayName("an instance exactly at its expiry is kept")
    void boundaryIsNotExpired() {
        manager.create(InstanceCreateRequest.of("edge", 1));
        clock.advance(Duration.ofHours(1));

        assertTrue(sweeper.sweepOnce().isEmpty());
    }

    @Test
    @DisplayName("one failing destroy does not stop the sweep")
    void toleratesFailures() {
        Instance failing = manager.create(InstanceCreateRequest.of("failing", 1));
        Instance healthy = manager.create(InstanceCreateRequest.of("healthy", 1));
        backend.destroyFailures.add(failing.getId());
        clock.advance(Duration.ofHours(2));

        List<String> destroyed = sweeper.sweepOnce();

        assertEquals(List.of(healthy.getId()), destroyed);
        assertEquals(InstanceStatus.ERROR, manager.get(failing.getId()).getStatus());
        assertEquals(1.0, registry.get("fauxcloud.sweep.failures").counter().count());
        assertEquals(1.0, registry.get("fauxcloud.sweep.destroyed").counter().count());
    }

    @Test
    @DisplayName("shutdown waits for an in-flight sweep")
    void shutdownAwaitsInFlightSweep() throws Exception {
        var entered = new CountDownLatch(1);
        var finished = new AtomicBoolean(false);
        InstanceManager slowManager = mock(InstanceManager.class);
        when(slowManager.list(null, null)).thenAnswer(invocation -> {
            entered.countDown();
            Thread.sleep(200);
            finished.set(true);
            return List.of();
        });
        properties.getSweep().setInterval(Duration.ofMillis(10));
        var slowSweeper = new ExpirySweeper(slowManager, new InstanceMetrics(registry), properties, clock);

        slowSweeper.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        slowSweeper.stop();

        assertTrue(finished.get());
    }

    @Test
    @DisplayName("does not schedule when disabled")
    void disabled() throws Exception {
        InstanceManager idleManager = mock(InstanceManager.class);
        properties.getSweep().setEnabled(false);
        properties.getSweep().setInterval(Duration.ofMillis(5));
        var idle = new ExpirySweeper(idleManager, new InstanceMetrics(registry), properties, clock);

        idle.start();
        Thread.sleep(50);
        idle.stop();

        verifyNoInteractions(idleManager);
    }
}
