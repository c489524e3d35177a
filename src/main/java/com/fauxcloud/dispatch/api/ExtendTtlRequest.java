package com.fauxcloud.dispatch.api;

/**
 * @param hours hours to add to the current expiry (at least 1)
 */
public record ExtendTtlRequest(int hours) {}
