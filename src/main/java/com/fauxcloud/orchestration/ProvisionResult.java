package com.fauxcloud.orchestration;

import com.fauxcloud.core.model.Instance;

/**
 * @param instance      provisioned instance snapshot
 * @param adminPassword administrator password the deployment was rendered with
 */
public record ProvisionResult(Instance instance, String adminPassword) {}
