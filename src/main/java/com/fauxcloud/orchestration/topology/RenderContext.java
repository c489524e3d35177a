package com.fauxcloud.orchestration.topology;

import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.orchestration.allocation.PortRole;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a topology needs to render an instance's deployment.
 *
 * @param instanceId     instance the deployment belongs to
 * @param networkName    compose network shared by the instance's containers
 * @param image          product image reference
 * @param adminPassword  administrator password baked into the product configuration
 * @param ingestionToken default ingestion token, null when ingestion is disabled
 * @param clusterSecret  shared secret for indexer and search head clustering
 * @param ports          allocated host ports per role, in allocation order
 * @param config         instance configuration snapshot
 * @param defaultsDir    host directory holding the rendered product configuration
 * @param createdAt      creation time, written to container labels
 * @param expiresAt      expiry time, written to container labels
 */
public record RenderContext(
    String instanceId,
    String networkName,
    String image,
    String adminPassword,
    String ingestionToken,
    String clusterSecret,
    Map<PortRole, List<Integer>> ports,
    InstanceConfig config,
    String defaultsDir,
    Instant createdAt,
    Instant expiresAt
) {

    public int port(PortRole role) {
        return port(role, 0);
    }

    public int port(PortRole role, int index) {
        List<Integer> allocated = ports.get(role);
        if (allocated == null || allocated.size() <= index) {
            throw new IllegalStateException("No %s port #%d allocated for instance %s".formatted(role, index, instanceId));
        }
        return allocated.get(index);
    }

    public String containerName(String service) {
        return instanceId + "-" + service;
    }
}
