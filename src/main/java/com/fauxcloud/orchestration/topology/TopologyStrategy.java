package com.fauxcloud.orchestration.topology;

import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.Topology;
import com.fauxcloud.orchestration.allocation.PortRole;

import java.util.Map;

/**
 * Sizing and rendering rules for one {@link Topology}.
 */
public interface TopologyStrategy {

    Topology topology();

    /**
     * Number of host ports needed per role for the given configuration.
     */
    Map<PortRole, Integer> rolePortCounts(InstanceConfig config);

    /**
     * Builds the compose services, keyed by service name, in start-up order.
     */
    Map<String, ComposeService> render(RenderContext context);

    /**
     * Product role written into the product configuration document.
     */
    String productRole();
}
