package com.fauxcloud.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ephemeral multi-container deployment of the emulated product.
 *
 * <p>Only {@code InstanceManager} mutates the instances it holds in its registry. Other components
 * receive a {@link #copy()} and hand back the updated copy, so a failed operation never leaves a
 * half-updated registry entry.
 */
public class Instance {

    private String id;
    private String name;
    private InstanceStatus status = InstanceStatus.PENDING;
    private InstanceConfig config;
    private InstanceEndpoints endpoints = InstanceEndpoints.empty();
    private InstanceCredentials credentials;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    private Map<String, String> labels = new LinkedHashMap<>();

    @JsonProperty("container_ids")
    private List<String> containerIds = new ArrayList<>();

    @JsonProperty("network_id")
    private String networkId;

    @JsonProperty("volume_ids")
    private List<String> volumeIds = new ArrayList<>();

    @JsonProperty("allocated_ports")
    private List<Integer> allocatedPorts = new ArrayList<>();

    @JsonProperty("error_message")
    private String errorMessage;

    public Instance() {}

    public Instance(String id, String name, InstanceConfig config, Instant createdAt, Instant expiresAt,
                    Map<String, String> labels) {
        this.id = id;
        this.name = name;
        this.config = config;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.labels = new LinkedHashMap<>(labels);
    }

    /**
     * Deep copy of every mutable collection; records and instants are shared.
     */
    public Instance copy() {
        var copy = new Instance(id, name, config, createdAt, expiresAt, labels);
        copy.status = status;
        copy.endpoints = endpoints;
        copy.credentials = credentials;
        copy.startedAt = startedAt;
        copy.containerIds = new ArrayList<>(containerIds);
        copy.networkId = networkId;
        copy.volumeIds = new ArrayList<>(volumeIds);
        copy.allocatedPorts = new ArrayList<>(allocatedPorts);
        copy.errorMessage = errorMessage;
        return copy;
    }

    /**
     * Moves to {@link InstanceStatus#ERROR} with a diagnostic message.
     */
    public void fail(String message) {
        this.status = InstanceStatus.ERROR;
        this.errorMessage = message;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean hasLabels(Map<String, String> required) {
        return required.entrySet().stream()
                .allMatch(e -> e.getValue().equals(labels.get(e.getKey())));
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public InstanceStatus getStatus() { return status; }

    public void setStatus(InstanceStatus status) { this.status = status; }

    /**
     * Sets a non-error status and clears any previous error message.
     */
    public void transitionTo(InstanceStatus next) {
        this.status = next;
        if (next != InstanceStatus.ERROR) {
            this.errorMessage = null;
        }
    }

    public InstanceConfig getConfig() { return config; }
    public void setConfig(InstanceConfig config) { this.config = config; }
    public InstanceEndpoints getEndpoints() { return endpoints; }
    public void setEndpoints(InstanceEndpoints endpoints) { this.endpoints = endpoints; }
    public InstanceCredentials getCredentials() { return credentials; }
    public void setCredentials(InstanceCredentials credentials) { this.credentials = credentials; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public Map<String, String> getLabels() { return labels; }
    public void setLabels(Map<String, String> labels) { this.labels = new LinkedHashMap<>(labels); }
    public List<String> getContainerIds() { return containerIds; }
    public void setContainerIds(List<String> containerIds) { this.containerIds = new ArrayList<>(containerIds); }
    public String getNetworkId() { return networkId; }
    public void setNetworkId(String networkId) { this.networkId = networkId; }
    public List<String> getVolumeIds() { return volumeIds; }
    public void setVolumeIds(List<String> volumeIds) { this.volumeIds = new ArrayList<>(volumeIds); }
    public List<Integer> getAllocatedPorts() { return allocatedPorts; }
    public void setAllocatedPorts(List<Integer> allocatedPorts) { this.allocatedPorts = new ArrayList<>(allocatedPorts); }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    @Override
    public String toString() {
        return "Instance[id=" + id + ", name=" + name + ", status=" + status + "]";
    }
}
