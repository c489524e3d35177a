package com.fauxcloud.orchestration.topology;

import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.Topology;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the product configuration document mounted into every container as {@code default.yml}.
 */
class ProductConfigBuilder {

    static final List<String> DEFAULT_INDEXES = List.of("main", "summary");

    /** 500 GB, the cloud default. */
    static final long MAX_TOTAL_DATA_SIZE_MB = 500_000L;

    /** 90 days. */
    static final long FROZEN_TIME_PERIOD_SECS = 7_776_000L;

    static final int MAX_RESULT_ROWS = 50_000;

    Map<String, Object> build(RenderContext context, TopologyStrategy strategy) {
        InstanceConfig config = context.config();

        var product = new LinkedHashMap<String, Object>();
        product.put("hostname", context.instanceId() + "-" + strategy.topology().name().toLowerCase().replace('_', '-'));
        product.put("role", strategy.productRole());
        product.put("password", context.adminPassword());
        product.put("experience", config.experience());
        product.put("hec", ingestion(context));
        product.put("conf", confFiles(config));
        if (config.createDefaultIndexes()) {
            product.put("indexes", defaultIndexes());
        }
        if (!config.preinstallApps().isEmpty()) {
            product.put("apps_location", config.preinstallApps());
        }
        if (strategy.topology() != Topology.STANDALONE) {
            product.put("idxc", Map.of(
                    "replication_factor", config.replicationFactor(),
                    "search_factor", config.searchFactor(),
                    "secret", context.clusterSecret()));
            product.put("shc", Map.of("secret", context.clusterSecret()));
        }

        var doc = new LinkedHashMap<String, Object>();
        doc.put("splunk", product);
        return doc;
    }

    private static Map<String, Object> ingestion(RenderContext context) {
        var hec = new LinkedHashMap<String, Object>();
        boolean enabled = context.config().ingestionEnabled() && context.ingestionToken() != null;
        hec.put("enable", enabled);
        hec.put("ssl", true);
        hec.put("port", 8088);
        if (enabled) {
            var token = new LinkedHashMap<String, Object>();
            token.put("name", "default");
            token.put("token", context.ingestionToken());
            token.put("defaultIndex", "main");
            token.put("indexes", DEFAULT_INDEXES);
            token.put("disabled", false);
            token.put("useACK", false);
            hec.put("tokens", List.of(token));
        }
        return hec;
    }

    private static List<Map<String, Object>> confFiles(InstanceConfig config) {
        var search = new LinkedHashMap<String, Object>();
        search.put("max_mem_usage_mb", String.valueOf(config.memoryMb()));
        search.put("max_result_rows", String.valueOf(MAX_RESULT_ROWS));
        var limits = new LinkedHashMap<String, Object>();
        limits.put("search", search);
        limits.put("realtime", Map.of(
                "indexed_realtime_use_by_default", String.valueOf(config.realtimeSearchEnabled())));

        var files = new ArrayList<Map<String, Object>>();
        files.add(confFile("limits", limits));
        config.customConfigs().forEach((file, settings) -> {
            if ("limits".equals(file)) {
                search.putAll(settings);
            } else {
                files.add(confFile(file, Map.of("default", new LinkedHashMap<>(settings))));
            }
        });
        return files;
    }

    private static Map<String, Object> confFile(String name, Map<String, Object> stanzas) {
        var file = new LinkedHashMap<String, Object>();
        file.put("key", name);
        file.put("value", Map.of(
                "directory", "/opt/splunk/etc/system/local",
                "content", stanzas));
        return file;
    }

    private static List<Map<String, Object>> defaultIndexes() {
        return DEFAULT_INDEXES.stream()
                .map(name -> {
                    var index = new LinkedHashMap<String, Object>();
                    index.put("name", name);
                    index.put("datatype", "event");
                    index.put("maxTotalDataSizeMB", MAX_TOTAL_DATA_SIZE_MB);
                    index.put("frozenTimePeriodInSecs", FROZEN_TIME_PERIOD_SECS);
                    return (Map<String, Object>) index;
                })
                .toList();
    }
}
