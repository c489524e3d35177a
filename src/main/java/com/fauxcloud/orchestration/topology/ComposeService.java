package com.fauxcloud.orchestration.topology;

import com.fauxcloud.orchestration.allocation.PortRole;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for a single compose service entry.
 */
public class ComposeService {

    static final String DEFAULTS_MOUNT = "/tmp/defaults";

    private final String name;
    private final Map<String, String> environment = new LinkedHashMap<>();
    private final List<String> ports = new ArrayList<>();
    private final List<String> volumes = new ArrayList<>();
    private final List<String> dependsOn = new ArrayList<>();
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final List<String> namedVolumes = new ArrayList<>();

    private ComposeService(String name) {
        this.name = name;
    }

    /**
     * Starts a product node with the settings every role shares.
     */
    public static ComposeService node(String name, String productRole, RenderContext context) {
        var service = new ComposeService(name);
        service.environment.put("SPLUNK_START_ARGS", "--accept-license");
        service.environment.put("SPLUNK_PASSWORD", context.adminPassword());
        service.environment.put("SPLUNK_ROLE", productRole);
        service.environment.put("SPLUNK_DEFAULTS_URL", DEFAULTS_MOUNT + "/default.yml");
        service.volumes.add(context.defaultsDir() + ":" + DEFAULTS_MOUNT + ":ro");
        String dataVolume = context.containerName(name) + "-var";
        service.namedVolumes.add(dataVolume);
        service.volumes.add(dataVolume + ":/opt/splunk/var");
        service.labels.put("fauxcloud.instance", context.instanceId());
        service.labels.put("fauxcloud.role", productRole);
        service.labels.put("fauxcloud.created-at", context.createdAt().toString());
        service.labels.put("fauxcloud.expires-at", context.expiresAt().toString());
        return service;
    }

    public ComposeService publish(int hostPort, PortRole role) {
        ports.add(hostPort + ":" + role.containerPort());
        return this;
    }

    public ComposeService env(String key, String value) {
        environment.put(key, value);
        return this;
    }

    public ComposeService dependsOn(String service) {
        dependsOn.add(service);
        return this;
    }

    public String name() {
        return name;
    }

    public List<String> namedVolumes() {
        return List.copyOf(namedVolumes);
    }

    /**
     * Renders the compose document fragment for this service.
     */
    Map<String, Object> toDocument(RenderContext context) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("image", context.image());
        doc.put("container_name", context.containerName(name));
        doc.put("hostname", context.containerName(name));
        doc.put("environment", new LinkedHashMap<>(environment));
        if (!ports.isEmpty()) {
            doc.put("ports", List.copyOf(ports));
        }
        doc.put("volumes", List.copyOf(volumes));
        doc.put("networks", List.of(context.networkName()));
        if (!dependsOn.isEmpty()) {
            doc.put("depends_on", List.copyOf(dependsOn));
        }
        doc.put("mem_limit", context.config().memoryMb() + "m");
        doc.put("cpus", BigDecimal.valueOf(context.config().cpuCores()).stripTrailingZeros().toPlainString());
        doc.put("healthcheck", Map.of(
                "test", List.of("CMD", "/sbin/checkstate.sh"),
                "interval", "30s",
                "timeout", "10s",
                "retries", 10,
                "start_period", "120s"));
        doc.put("labels", new LinkedHashMap<>(labels));
        return doc;
    }
}
