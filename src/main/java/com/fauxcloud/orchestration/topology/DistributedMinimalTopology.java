package com.fauxcloud.orchestration.topology;

import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.Topology;
import com.fauxcloud.orchestration.allocation.PortRole;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One search head in front of one indexer.
 */
public class DistributedMinimalTopology implements TopologyStrategy {

    static final String SEARCH_HEAD = "search-head-1";
    static final String INDEXER = "indexer-1";

    @Override
    public Topology topology() {
        return Topology.DISTRIBUTED_MINIMAL;
    }

    @Override
    public Map<PortRole, Integer> rolePortCounts(InstanceConfig config) {
        var counts = new EnumMap<PortRole, Integer>(PortRole.class);
        counts.put(PortRole.WEB, 1);
        counts.put(PortRole.MANAGEMENT, 1);
        counts.put(PortRole.INGESTION, 1);
        counts.put(PortRole.FORWARDING, 1);
        counts.put(PortRole.INDEXER_MANAGEMENT, 1);
        return counts;
    }

    @Override
    public Map<String, ComposeService> render(RenderContext context) {
        var indexer = ComposeService.node(INDEXER, "splunk_indexer", context)
                .publish(context.port(PortRole.INGESTION), PortRole.INGESTION)
                .publish(context.port(PortRole.FORWARDING), PortRole.FORWARDING)
                .publish(context.port(PortRole.INDEXER_MANAGEMENT), PortRole.INDEXER_MANAGEMENT)
                .env("SPLUNK_SEARCH_HEAD_URL", context.containerName(SEARCH_HEAD))
                .env("SPLUNK_INDEXER_URL", context.containerName(INDEXER));

        var searchHead = ComposeService.node(SEARCH_HEAD, "splunk_search_head", context)
                .publish(context.port(PortRole.WEB), PortRole.WEB)
                .publish(context.port(PortRole.MANAGEMENT), PortRole.MANAGEMENT)
                .env("SPLUNK_SEARCH_HEAD_URL", context.containerName(SEARCH_HEAD))
                .env("SPLUNK_INDEXER_URL", context.containerName(INDEXER))
                .env("SPLUNK_ENABLE_REALTIME_SEARCH", String.valueOf(context.config().realtimeSearchEnabled()))
                .dependsOn(INDEXER);

        var services = new LinkedHashMap<String, ComposeService>();
        services.put(INDEXER, indexer);
        services.put(SEARCH_HEAD, searchHead);
        return services;
    }

    @Override
    public String productRole() {
        return "splunk_search_head";
    }
}
