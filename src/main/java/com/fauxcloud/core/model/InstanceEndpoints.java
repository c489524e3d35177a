package com.fauxcloud.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Network addresses of a provisioned instance. All fields are null until provisioning resolves host ports.
 *
 * @param webUrl         browser UI
 * @param managementUrl  management REST API
 * @param ingestionUrl   HTTP event ingestion endpoint
 * @param forwardingPort host port receiving cluster-forwarded data
 * @param adminApiUrl    simulated admin-config API for this instance
 */
public record InstanceEndpoints(
    @JsonProperty("web_url") String webUrl,
    @JsonProperty("management_url") String managementUrl,
    @JsonProperty("ingestion_url") String ingestionUrl,
    @JsonProperty("forwarding_port") Integer forwardingPort,
    @JsonProperty("admin_api_url") String adminApiUrl
) {

    public static InstanceEndpoints empty() {
        return new InstanceEndpoints(null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return webUrl == null && managementUrl == null && ingestionUrl == null
                && forwardingPort == null && adminApiUrl == null;
    }
}
