package com.fauxcloud.orchestration.topology;

import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.Topology;
import com.fauxcloud.orchestration.allocation.PortRole;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search head cluster and indexer cluster coordinated by a cluster manager and a deployer.
 * Serves both {@link Topology#DISTRIBUTED_CLUSTERED} and {@link Topology#FULL}.
 */
public class ClusteredTopology implements TopologyStrategy {

    static final String CLUSTER_MANAGER = "cluster-manager";
    static final String DEPLOYER = "deployer";

    private final Topology topology;

    public ClusteredTopology(Topology topology) {
        if (topology != Topology.DISTRIBUTED_CLUSTERED && topology != Topology.FULL) {
            throw new IllegalArgumentException("Not a clustered topology: " + topology);
        }
        this.topology = topology;
    }

    @Override
    public Topology topology() {
        return topology;
    }

    @Override
    public Map<PortRole, Integer> rolePortCounts(InstanceConfig config) {
        var counts = new EnumMap<PortRole, Integer>(PortRole.class);
        counts.put(PortRole.WEB, config.searchHeadCount());
        counts.put(PortRole.MANAGEMENT, config.searchHeadCount());
        counts.put(PortRole.INGESTION, config.indexerCount());
        counts.put(PortRole.FORWARDING, config.indexerCount());
        counts.put(PortRole.INDEXER_MANAGEMENT, config.indexerCount());
        counts.put(PortRole.CLUSTER_MANAGER, 1);
        counts.put(PortRole.DEPLOYER, 1);
        return counts;
    }

    @Override
    public Map<String, ComposeService> render(RenderContext context) {
        var config = context.config();
        List<String> searchHeads = names("search-head", config.searchHeadCount());
        List<String> indexers = names("indexer", config.indexerCount());
        String searchHeadUrls = join(context, searchHeads);
        String indexerUrls = join(context, indexers);
        String managerUrl = context.containerName(CLUSTER_MANAGER);
        String deployerUrl = context.containerName(DEPLOYER);

        var services = new LinkedHashMap<String, ComposeService>();
        services.put(CLUSTER_MANAGER, ComposeService.node(CLUSTER_MANAGER, "splunk_cluster_master", context)
                .publish(context.port(PortRole.CLUSTER_MANAGER), PortRole.CLUSTER_MANAGER)
                .env("SPLUNK_INDEXER_URL", indexerUrls)
                .env("SPLUNK_SEARCH_HEAD_URL", searchHeadUrls)
                .env("SPLUNK_CLUSTER_MASTER_URL", managerUrl));

        services.put(DEPLOYER, ComposeService.node(DEPLOYER, "splunk_deployer", context)
                .publish(context.port(PortRole.DEPLOYER), PortRole.DEPLOYER)
                .env("SPLUNK_SEARCH_HEAD_URL", searchHeadUrls)
                .env("SPLUNK_DEPLOYER_URL", deployerUrl));

        for (int i = 0; i < indexers.size(); i++) {
            String name = indexers.get(i);
            services.put(name, ComposeService.node(name, "splunk_indexer", context)
                    .publish(context.port(PortRole.INGESTION, i), PortRole.INGESTION)
                    .publish(context.port(PortRole.FORWARDING, i), PortRole.FORWARDING)
                    .publish(context.port(PortRole.INDEXER_MANAGEMENT, i), PortRole.INDEXER_MANAGEMENT)
                    .env("SPLUNK_INDEXER_URL", indexerUrls)
                    .env("SPLUNK_CLUSTER_MASTER_URL", managerUrl)
                    .dependsOn(CLUSTER_MANAGER));
        }

        for (int i = 0; i < searchHeads.size(); i++) {
            String name = searchHeads.get(i);
            var searchHead = ComposeService.node(name, "splunk_search_head", context)
                    .publish(context.port(PortRole.WEB, i), PortRole.WEB)
                    .publish(context.port(PortRole.MANAGEMENT, i), PortRole.MANAGEMENT)
                    .env("SPLUNK_SEARCH_HEAD_URL", searchHeadUrls)
                    .env("SPLUNK_SEARCH_HEAD_CAPTAIN_URL", context.containerName(searchHeads.get(0)))
                    .env("SPLUNK_CLUSTER_MASTER_URL", managerUrl)
                    .env("SPLUNK_DEPLOYER_URL", deployerUrl)
                    .env("SPLUNK_ENABLE_REALTIME_SEARCH", String.valueOf(config.realtimeSearchEnabled()))
                    .dependsOn(CLUSTER_MANAGER)
                    .dependsOn(DEPLOYER);
            services.put(name, searchHead);
        }
        return services;
    }

    @Override
    public String productRole() {
        return "splunk_search_head";
    }

    private static List<String> names(String prefix, int count) {
        var names = new ArrayList<String>(count);
        for (int i = 1; i <= count; i++) {
            names.add(prefix + "-" + i);
        }
        return names;
    }

    private static String join(RenderContext context, List<String> services) {
        return String.join(",", services.stream().map(context::containerName).toList());
    }
}
