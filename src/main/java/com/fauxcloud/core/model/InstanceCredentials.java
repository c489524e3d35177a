package com.fauxcloud.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credentials generated once at creation.
 *
 * @param adminUsername  administrator login
 * @param adminPassword  generated administrator password
 * @param accessToken    admin-config API token issued for this instance
 * @param ingestionToken default ingestion token, null when ingestion is disabled
 */
public record InstanceCredentials(
    @JsonProperty("admin_username") String adminUsername,
    @JsonProperty("admin_password") String adminPassword,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("ingestion_token") String ingestionToken
) {

    public static final String ADMIN_USERNAME = "admin";

    @Override
    public String toString() {
        return "InstanceCredentials[adminUsername=" + adminUsername + ", adminPassword=***, accessToken=***, ingestionToken="
                + (ingestionToken != null ? "***" : "null") + "]";
    }
}
