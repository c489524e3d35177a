package com.fauxcloud.core.health;

import com.fauxcloud.orchestration.OrchestrationProperties;
import com.fauxcloud.orchestration.allocation.PortAllocator;
import com.github.dockerjava.api.DockerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DockerClient dockerClient;
    private final OrchestrationProperties properties;
    private final PortAllocator portAllocator;

    public HealthCheckService(DockerClient dockerClient, OrchestrationProperties properties,
                              PortAllocator portAllocator) {
        this.dockerClient = dockerClient;
        this.properties = properties;
        this.portAllocator = portAllocator;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkDataDir());
        results.add(checkPorts());
        return results;
    }

    private HealthStatus checkDocker() {
        try {
            dockerClient.pingCmd().exec();
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Docker daemon reachable", Map.of("host", properties.getDockerHost()));
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of("host", properties.getDockerHost()));
        }
    }

    private HealthStatus checkDataDir() {
        Path dataDir = properties.dataPath();
        if (!Files.exists(dataDir)) {
            return new HealthStatus("data-dir", HealthStatus.Status.DEGRADED,
                    "Data directory not created yet", Map.of("path", dataDir.toString()));
        }
        if (!Files.isWritable(dataDir)) {
            return new HealthStatus("data-dir", HealthStatus.Status.DOWN,
                    "Data directory not writable", Map.of("path", dataDir.toString()));
        }
        return new HealthStatus("data-dir", HealthStatus.Status.UP,
                "Data directory writable", Map.of("path", dataDir.toString()));
    }

    private HealthStatus checkPorts() {
        int reserved = portAllocator.reservedPorts().size();
        return new HealthStatus("ports", HealthStatus.Status.UP,
                reserved + " host port(s) reserved", Map.of("reserved", String.valueOf(reserved)));
    }
}
