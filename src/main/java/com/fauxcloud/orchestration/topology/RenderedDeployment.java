package com.fauxcloud.orchestration.topology;

import java.util.List;

/**
 * Output of {@link TopologyRenderer#render}.
 *
 * @param descriptor    compose descriptor YAML
 * @param productConfig product configuration YAML ({@code default.yml})
 * @param services      service names in start-up order
 * @param volumes       named volumes declared by the descriptor
 */
public record RenderedDeployment(
    String descriptor,
    String productConfig,
    List<String> services,
    List<String> volumes
) {}
