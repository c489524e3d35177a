package com.fauxcloud.core.security;

/**
 * Issues the bearer token handed to callers of an instance's admin-config API.
 * The lifecycle manager calls it once per created instance and never decodes the result.
 */
@FunctionalInterface
public interface AccessTokenIssuer {

    String issue(String instanceId);
}
