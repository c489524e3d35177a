package com.fauxcloud.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration snapshot captured when an instance is created.
 *
 * @param topology              container role layout
 * @param productVersion        version of the emulated product image
 * @param experience            cloud experience mode, {@code victoria} or {@code classic}
 * @param searchHeadCount       search heads for clustered topologies (1-10)
 * @param indexerCount          indexers for clustered topologies (1-10)
 * @param replicationFactor     indexer cluster replication factor (1-3)
 * @param searchFactor          indexer cluster search factor (1-3)
 * @param memoryMb              memory limit per container in MB (512-8192)
 * @param cpuCores              CPU limit per container (0.5-4.0)
 * @param ingestionEnabled      expose the HTTP ingestion endpoint and issue an ingestion token
 * @param realtimeSearchEnabled allow real-time searches
 * @param adminApiEnabled       publish the simulated admin-config API endpoint
 * @param createDefaultIndexes  create the default indexes at first start
 * @param preinstallApps        app identifiers installed at first start
 * @param customConfigs         per-file {@code .conf} overrides, e.g. {@code limits -> {max_mem_usage_mb -> 1000}}
 */
public record InstanceConfig(
    Topology topology,
    @JsonProperty("product_version") String productVersion,
    String experience,
    @JsonProperty("search_head_count") int searchHeadCount,
    @JsonProperty("indexer_count") int indexerCount,
    @JsonProperty("replication_factor") int replicationFactor,
    @JsonProperty("search_factor") int searchFactor,
    @JsonProperty("memory_mb") int memoryMb,
    @JsonProperty("cpu_cores") double cpuCores,
    @JsonProperty("ingestion_enabled") boolean ingestionEnabled,
    @JsonProperty("realtime_search_enabled") boolean realtimeSearchEnabled,
    @JsonProperty("admin_api_enabled") boolean adminApiEnabled,
    @JsonProperty("create_default_indexes") boolean createDefaultIndexes,
    @JsonProperty("preinstall_apps") List<String> preinstallApps,
    @JsonProperty("custom_configs") Map<String, Map<String, String>> customConfigs
) {

    public static final String DEFAULT_PRODUCT_VERSION = "9.3.2";

    public InstanceConfig {
        topology = topology != null ? topology : Topology.STANDALONE;
        productVersion = productVersion != null && !productVersion.isBlank() ? productVersion : DEFAULT_PRODUCT_VERSION;
        experience = experience != null && !experience.isBlank() ? experience : "victoria";
        preinstallApps = preinstallApps != null ? List.copyOf(preinstallApps) : List.of();
        customConfigs = customConfigs != null ? Map.copyOf(customConfigs) : Map.of();
    }

    /**
     * Default configuration: a standalone node with ingestion, real-time search and the admin API enabled.
     */
    public static InstanceConfig defaults() {
        return builder().build();
    }

    /**
     * JSON entry point: absent fields take the builder defaults rather than zero.
     */
    @JsonCreator
    static InstanceConfig fromJson(
            @JsonProperty("topology") Topology topology,
            @JsonProperty("product_version") String productVersion,
            @JsonProperty("experience") String experience,
            @JsonProperty("search_head_count") Integer searchHeadCount,
            @JsonProperty("indexer_count") Integer indexerCount,
            @JsonProperty("replication_factor") Integer replicationFactor,
            @JsonProperty("search_factor") Integer searchFactor,
            @JsonProperty("memory_mb") Integer memoryMb,
            @JsonProperty("cpu_cores") Double cpuCores,
            @JsonProperty("ingestion_enabled") Boolean ingestionEnabled,
            @JsonProperty("realtime_search_enabled") Boolean realtimeSearchEnabled,
            @JsonProperty("admin_api_enabled") Boolean adminApiEnabled,
            @JsonProperty("create_default_indexes") Boolean createDefaultIndexes,
            @JsonProperty("preinstall_apps") List<String> preinstallApps,
            @JsonProperty("custom_configs") Map<String, Map<String, String>> customConfigs) {
        var defaults = defaults();
        return new InstanceConfig(
                topology,
                productVersion,
                experience,
                searchHeadCount != null ? searchHeadCount : defaults.searchHeadCount(),
                indexerCount != null ? indexerCount : defaults.indexerCount(),
                replicationFactor != null ? replicationFactor : defaults.replicationFactor(),
                searchFactor != null ? searchFactor : defaults.searchFactor(),
                memoryMb != null ? memoryMb : defaults.memoryMb(),
                cpuCores != null ? cpuCores : defaults.cpuCores(),
                ingestionEnabled != null ? ingestionEnabled : defaults.ingestionEnabled(),
                realtimeSearchEnabled != null ? realtimeSearchEnabled : defaults.realtimeSearchEnabled(),
                adminApiEnabled != null ? adminApiEnabled : defaults.adminApiEnabled(),
                createDefaultIndexes != null ? createDefaultIndexes : defaults.createDefaultIndexes(),
                preinstallApps,
                customConfigs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .topology(topology)
                .productVersion(productVersion)
                .experience(experience)
                .searchHeadCount(searchHeadCount)
                .indexerCount(indexerCount)
                .replicationFactor(replicationFactor)
                .searchFactor(searchFactor)
                .memoryMb(memoryMb)
                .cpuCores(cpuCores)
                .ingestionEnabled(ingestionEnabled)
                .realtimeSearchEnabled(realtimeSearchEnabled)
                .adminApiEnabled(adminApiEnabled)
                .createDefaultIndexes(createDefaultIndexes)
                .preinstallApps(preinstallApps)
                .customConfigs(customConfigs);
    }

    public static final class Builder {
        private Topology topology = Topology.STANDALONE;
        private String productVersion = DEFAULT_PRODUCT_VERSION;
        private String experience = "victoria";
        private int searchHeadCount = 1;
        private int indexerCount = 1;
        private int replicationFactor = 1;
        private int searchFactor = 1;
        private int memoryMb = 2048;
        private double cpuCores = 1.0;
        private boolean ingestionEnabled = true;
        private boolean realtimeSearchEnabled = true;
        private boolean adminApiEnabled = true;
        private boolean createDefaultIndexes = true;
        private List<String> preinstallApps = new ArrayList<>();
        private Map<String, Map<String, String>> customConfigs = Map.of();

        private Builder() {}

        public Builder topology(Topology topology) { this.topology = topology; return this; }
        public Builder productVersion(String productVersion) { this.productVersion = productVersion; return this; }
        public Builder experience(String experience) { this.experience = experience; return this; }
        public Builder searchHeadCount(int searchHeadCount) { this.searchHeadCount = searchHeadCount; return this; }
        public Builder indexerCount(int indexerCount) { this.indexerCount = indexerCount; return this; }
        public Builder replicationFactor(int replicationFactor) { this.replicationFactor = replicationFactor; return this; }
        public Builder searchFactor(int searchFactor) { this.searchFactor = searchFactor; return this; }
        public Builder memoryMb(int memoryMb) { this.memoryMb = memoryMb; return this; }
        public Builder cpuCores(double cpuCores) { this.cpuCores = cpuCores; return this; }
        public Builder ingestionEnabled(boolean ingestionEnabled) { this.ingestionEnabled = ingestionEnabled; return this; }
        public Builder realtimeSearchEnabled(boolean realtimeSearchEnabled) { this.realtimeSearchEnabled = realtimeSearchEnabled; return this; }
        public Builder adminApiEnabled(boolean adminApiEnabled) { this.adminApiEnabled = adminApiEnabled; return this; }
        public Builder createDefaultIndexes(boolean createDefaultIndexes) { this.createDefaultIndexes = createDefaultIndexes; return this; }
        public Builder preinstallApps(List<String> preinstallApps) { this.preinstallApps = new ArrayList<>(preinstallApps); return this; }
        public Builder customConfigs(Map<String, Map<String, String>> customConfigs) { this.customConfigs = customConfigs; return this; }

        public InstanceConfig build() {
            return new InstanceConfig(topology, productVersion, experience, searchHeadCount, indexerCount,
                    replicationFactor, searchFactor, memoryMb, cpuCores, ingestionEnabled,
                    realtimeSearchEnabled, adminApiEnabled, createDefaultIndexes, preinstallApps, customConfigs);
        }
    }
}
