package com.fauxcloud.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request to create a new instance.
 *
 * @param name     DNS-safe instance name; uniqueness is not enforced
 * @param config   configuration snapshot; null means {@link InstanceConfig#defaults()}
 * @param ttlHours time-to-live in hours (1-168)
 * @param labels   free-form metadata
 */
public record InstanceCreateRequest(
    String name,
    InstanceConfig config,
    @JsonProperty("ttl_hours") Integer ttlHours,
    Map<String, String> labels
) {

    public static final int DEFAULT_TTL_HOURS = 24;

    public InstanceCreateRequest {
        config = config != null ? config : InstanceConfig.defaults();
        ttlHours = ttlHours != null ? ttlHours : DEFAULT_TTL_HOURS;
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public static InstanceCreateRequest of(String name, int ttlHours) {
        return new InstanceCreateRequest(name, InstanceConfig.defaults(), ttlHours, Map.of());
    }
}
