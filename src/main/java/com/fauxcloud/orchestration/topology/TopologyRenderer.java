package com.fauxcloud.orchestration.topology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fauxcloud.core.model.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an instance's compose descriptor and product configuration from its topology strategy.
 * Rendering is a pure function of the topology and the {@link RenderContext}.
 */
public class TopologyRenderer {

    private static final Logger log = LoggerFactory.getLogger(TopologyRenderer.class);

    private final Map<Topology, TopologyStrategy> strategies = new EnumMap<>(Topology.class);
    private final ProductConfigBuilder productConfigBuilder = new ProductConfigBuilder();
    private final YAMLMapper yaml = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();

    public TopologyRenderer() {
        this(List.of(
                new StandaloneTopology(),
                new DistributedMinimalTopology(),
                new ClusteredTopology(Topology.DISTRIBUTED_CLUSTERED),
                new ClusteredTopology(Topology.FULL)));
    }

    public TopologyRenderer(List<TopologyStrategy> strategies) {
        for (TopologyStrategy strategy : strategies) {
            this.strategies.put(strategy.topology(), strategy);
        }
        for (Topology topology : Topology.values()) {
            if (!this.strategies.containsKey(topology)) {
                throw new IllegalArgumentException("No strategy registered for topology " + topology);
            }
        }
    }

    public TopologyStrategy strategyFor(Topology topology) {
        return strategies.get(topology);
    }

    public RenderedDeployment render(Topology topology, RenderContext context) {
        TopologyStrategy strategy = strategyFor(topology);
        Map<String, ComposeService> services = strategy.render(context);

        var serviceDocs = new LinkedHashMap<String, Object>();
        var volumeDocs = new LinkedHashMap<String, Object>();
        var volumeNames = new ArrayList<String>();
        services.forEach((name, service) -> {
            serviceDocs.put(name, service.toDocument(context));
            for (String volume : service.namedVolumes()) {
                volumeDocs.put(volume, Map.of("labels", Map.of("fauxcloud.instance", context.instanceId())));
                volumeNames.add(volume);
            }
        });

        var descriptor = new LinkedHashMap<String, Object>();
        descriptor.put("name", projectName(context.instanceId()));
        descriptor.put("services", serviceDocs);
        descriptor.put("networks", Map.of(context.networkName(),
                Map.of("name", context.networkName(), "driver", "bridge")));
        descriptor.put("volumes", volumeDocs);

        Map<String, Object> productConfig = productConfigBuilder.build(context, strategy);

        log.debug("Rendered {} descriptor for {} with services {}", topology, context.instanceId(), services.keySet());
        return new RenderedDeployment(
                write(descriptor), write(productConfig), List.copyOf(services.keySet()), List.copyOf(volumeNames));
    }

    /**
     * Compose project name for an instance; compose requires lowercase alphanumerics, dashes and underscores.
     */
    public static String projectName(String instanceId) {
        return instanceId.toLowerCase();
    }

    private String write(Map<String, Object> document) {
        try {
            return yaml.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise rendered document", e);
        }
    }
}
