package com.fauxcloud.orchestration.topology;

import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.Topology;
import com.fauxcloud.orchestration.allocation.PortRole;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single container serving web, management, ingestion and forwarding.
 */
public class StandaloneTopology implements TopologyStrategy {

    static final String SERVICE = "standalone";

    @Override
    public Topology topology() {
        return Topology.STANDALONE;
    }

    @Override
    public Map<PortRole, Integer> rolePortCounts(InstanceConfig config) {
        var counts = new EnumMap<PortRole, Integer>(PortRole.class);
        counts.put(PortRole.WEB, 1);
        counts.put(PortRole.MANAGEMENT, 1);
        counts.put(PortRole.INGESTION, 1);
        counts.put(PortRole.FORWARDING, 1);
        return counts;
    }

    @Override
    public Map<String, ComposeService> render(RenderContext context) {
        var node = ComposeService.node(SERVICE, productRole(), context)
                .publish(context.port(PortRole.WEB), PortRole.WEB)
                .publish(context.port(PortRole.MANAGEMENT), PortRole.MANAGEMENT)
                .publish(context.port(PortRole.INGESTION), PortRole.INGESTION)
                .publish(context.port(PortRole.FORWARDING), PortRole.FORWARDING)
                .env("SPLUNK_ENABLE_REALTIME_SEARCH", String.valueOf(context.config().realtimeSearchEnabled()));

        var services = new LinkedHashMap<String, ComposeService>();
        services.put(SERVICE, node);
        return services;
    }

    @Override
    public String productRole() {
        return "splunk_standalone";
    }
}
