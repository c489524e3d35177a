package com.fauxcloud.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fauxcloud.core.model.InstanceEndpoints;
import com.fauxcloud.orchestration.allocation.PortRole;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Derives instance endpoints from the {@code host:container} port mappings of a rendered descriptor.
 *
 * <p>Web and management come from the first service publishing them (the search head in distributed
 * layouts); ingestion and forwarding from the first service publishing those (the first indexer).
 */
public class EndpointResolver {

    private final YAMLMapper yaml = new YAMLMapper();
    private final String host;
    private final String adminApiBaseUrl;

    public EndpointResolver(String host, String adminApiBaseUrl) {
        this.host = host;
        this.adminApiBaseUrl = adminApiBaseUrl.endsWith("/")
                ? adminApiBaseUrl.substring(0, adminApiBaseUrl.length() - 1)
                : adminApiBaseUrl;
    }

    public InstanceEndpoints resolve(String instanceId, String descriptor, boolean adminApiEnabled) {
        JsonNode services;
        try {
            services = yaml.readTree(descriptor).path("services");
        } catch (IOException e) {
            throw new UncheckedIOException("Rendered descriptor for " + instanceId + " is not valid YAML", e);
        }

        String webUrl = null;
        String managementUrl = null;
        String ingestionUrl = null;
        Integer forwardingPort = null;

        Iterator<Map.Entry<String, JsonNode>> fields = services.fields();
        while (fields.hasNext()) {
            var service = fields.next();
            boolean managementIsPrimary = !service.getKey().startsWith("indexer")
                    && !service.getKey().equals("cluster-manager")
                    && !service.getKey().equals("deployer");
            for (JsonNode mapping : service.getValue().path("ports")) {
                String[] parts = mapping.asText().split(":");
                if (parts.length != 2) {
                    continue;
                }
                int hostPort = Integer.parseInt(parts[0].trim());
                int containerPort = Integer.parseInt(parts[1].trim());
                if (containerPort == PortRole.WEB.containerPort() && webUrl == null) {
                    webUrl = "http://" + host + ":" + hostPort;
                } else if (containerPort == PortRole.MANAGEMENT.containerPort() && managementUrl == null && managementIsPrimary) {
                    managementUrl = "https://" + host + ":" + hostPort;
                } else if (containerPort == PortRole.INGESTION.containerPort() && ingestionUrl == null) {
                    ingestionUrl = "https://" + host + ":" + hostPort;
                } else if (containerPort == PortRole.FORWARDING.containerPort() && forwardingPort == null) {
                    forwardingPort = hostPort;
                }
            }
        }

        String adminApiUrl = adminApiEnabled ? adminApiBaseUrl + "/" + instanceId + "/adminconfig/v2" : null;
        return new InstanceEndpoints(webUrl, managementUrl, ingestionUrl, forwardingPort, adminApiUrl);
    }
}
