package com.fauxcloud.orchestration.allocation;

import com.fauxcloud.core.error.ResourceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide reservation of host ports.
 *
 * <p>Every method synchronises on the allocator, so two concurrent allocations in this process
 * never hand out the same port. The host probe runs before the container runtime binds the port,
 * which leaves a window in which another process on the host can take it; the compose start then
 * fails and the instance is recorded as {@code ERROR}.
 */
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    /** Maximum number of candidate ports inspected per allocation. */
    public static final int MAX_PROBES = 1000;

    private final PortProbe probe;
    private final Set<Integer> reserved = new TreeSet<>();

    public PortAllocator(PortProbe probe) {
        this.probe = probe;
    }

    /**
     * Reserves the first {@code count} free ports at or above {@code start}.
     *
     * @throws ResourceExhaustedException if {@link #MAX_PROBES} candidates were inspected first
     */
    public synchronized List<Integer> allocate(int start, int count) {
        var ports = new ArrayList<Integer>(count);
        int candidate = start;
        while (ports.size() < count) {
            if (candidate - start >= MAX_PROBES) {
                // release the partial allocation
                reserved.removeAll(ports);
                throw new ResourceExhaustedException(
                        "Unable to allocate %d port(s) from %d within %d probes".formatted(count, start, MAX_PROBES));
            }
            if (!reserved.contains(candidate) && probe.isAvailable(candidate)) {
                reserved.add(candidate);
                ports.add(candidate);
            }
            candidate++;
        }
        log.debug("Allocated ports {} from base {}", ports, start);
        return ports;
    }

    public int allocate(PortRole role) {
        return allocate(role.basePort(), 1).get(0);
    }

    public List<Integer> allocate(PortRole role, int count) {
        return allocate(role.basePort(), count);
    }

    /**
     * Re-reserves ports that are already known to belong to a live instance, e.g. after a restart.
     * Ports are not probed, since the instance's own containers may be bound to them.
     */
    public synchronized void reserve(Collection<Integer> ports) {
        reserved.addAll(ports);
    }

    public synchronized void release(Collection<Integer> ports) {
        if (ports.isEmpty()) {
            return;
        }
        reserved.removeAll(ports);
        log.debug("Released ports {}", ports);
    }

    public synchronized boolean isReserved(int port) {
        return reserved.contains(port);
    }

    /**
     * Snapshot of every port currently reserved in this process.
     */
    public synchronized Set<Integer> reservedPorts() {
        return Set.copyOf(reserved);
    }
}
