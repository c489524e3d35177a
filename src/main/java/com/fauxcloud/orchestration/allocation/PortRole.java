package com.fauxcloud.orchestration.allocation;

/**
 * Host port roles with the base of the range each one is allocated from and the port the
 * product listens on inside its container.
 */
public enum PortRole {
    WEB(18000, 8000),
    MANAGEMENT(18089, 8089),
    INGESTION(18088, 8088),
    FORWARDING(19997, 9997),
    INDEXER_MANAGEMENT(18189, 8089),
    CLUSTER_MANAGER(18389, 8089),
    DEPLOYER(18489, 8089);

    private final int basePort;
    private final int containerPort;

    PortRole(int basePort, int containerPort) {
        this.basePort = basePort;
        this.containerPort = containerPort;
    }

    public int basePort() {
        return basePort;
    }

    public int containerPort() {
        return containerPort;
    }
}
