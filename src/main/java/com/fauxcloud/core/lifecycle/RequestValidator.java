package com.fauxcloud.core.lifecycle;

import com.fauxcloud.core.error.ValidationException;
import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.InstanceCreateRequest;
import com.fauxcloud.core.model.Topology;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a create request before any resource is touched. All violations are collected and
 * reported together.
 */
@Component
public class RequestValidator {

    static final Pattern NAME = Pattern.compile("^[a-z][a-z0-9-]*[a-z0-9]$");
    static final int MAX_NAME_LENGTH = 63;
    static final Set<String> EXPERIENCES = Set.of("victoria", "classic");

    private final LifecycleProperties properties;

    public RequestValidator(LifecycleProperties properties) {
        this.properties = properties;
    }

    public void validate(InstanceCreateRequest request) {
        var violations = new ArrayList<String>();
        validateName(request.name(), violations);
        validateTtl("ttl_hours", request.ttlHours(), violations);
        validateConfig(request.config(), violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public void validateExtension(int hours) {
        if (hours < 1) {
            throw new ValidationException(List.of("hours must be at least 1, got " + hours));
        }
    }

    private void validateName(String name, List<String> violations) {
        if (name == null || name.isEmpty()) {
            violations.add("name is required");
            return;
        }
        if (name.length() > MAX_NAME_LENGTH) {
            violations.add("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        // single lowercase letters are valid names but do not match the two-character pattern
        if (!(name.length() == 1 && Character.isLowerCase(name.charAt(0))) && !NAME.matcher(name).matches()) {
            violations.add("name must start with a lowercase letter, contain only lowercase letters, digits and "
                    + "hyphens, and not end with a hyphen: " + name);
        }
    }

    private void validateTtl(String field, int hours, List<String> violations) {
        if (hours < 1 || hours > properties.getMaxTtlHours()) {
            violations.add(field + " must be between 1 and " + properties.getMaxTtlHours() + ", got " + hours);
        }
    }

    private void validateConfig(InstanceConfig config, List<String> violations) {
        range("search_head_count", config.searchHeadCount(), 1, 10, violations);
        range("indexer_count", config.indexerCount(), 1, 10, violations);
        range("replication_factor", config.replicationFactor(), 1, 3, violations);
        range("search_factor", config.searchFactor(), 1, 3, violations);
        range("memory_mb", config.memoryMb(), 512, 8192, violations);
        if (config.cpuCores() < 0.5 || config.cpuCores() > 4.0) {
            violations.add("cpu_cores must be between 0.5 and 4.0, got " + config.cpuCores());
        }
        if (!EXPERIENCES.contains(config.experience())) {
            violations.add("experience must be one of " + EXPERIENCES + ", got " + config.experience());
        }
        boolean clustered = config.topology() == Topology.DISTRIBUTED_CLUSTERED || config.topology() == Topology.FULL;
        if (clustered && config.searchFactor() > config.replicationFactor()) {
            violations.add("search_factor must not exceed replication_factor");
        }
        if (clustered && config.replicationFactor() > config.indexerCount()) {
            violations.add("replication_factor must not exceed indexer_count");
        }
    }

    private static void range(String field, int value, int min, int max, List<String> violations) {
        if (value < min || value > max) {
            violations.add("%s must be between %d and %d, got %d".formatted(field, min, max, value));
        }
    }
}
