package com.fauxcloud.orchestration;

import java.util.List;

/**
 * Outcome of a best-effort teardown.
 *
 * @param runtimeRemoved whether containers, networks and volumes were removed (or never existed)
 * @param filesRemoved   whether the instance directory was deleted (or never existed)
 * @param releasedPorts  host ports returned to the allocator
 * @param failures       diagnostics for the steps that failed
 */
public record DestroyReport(
    boolean runtimeRemoved,
    boolean filesRemoved,
    List<Integer> releasedPorts,
    List<String> failures
) {

    public boolean anyRemoved() {
        return runtimeRemoved || filesRemoved;
    }

    public boolean complete() {
        return runtimeRemoved && filesRemoved;
    }
}
