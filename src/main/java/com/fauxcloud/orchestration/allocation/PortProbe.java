package com.fauxcloud.orchestration.allocation;

/**
 * Checks whether a host port is currently free.
 */
@FunctionalInterface
public interface PortProbe {

    boolean isAvailable(int port);
}
