package com.processflow.core.model;

/**
 * The caller on whose behalf an operation runs.
 */
public record Actor(String userId, String tenantId) {

    public static final String SYSTEM_USER = "system";

    public static Actor system(String tenantId) {
        return new Actor(SYSTEM_USER, tenantId);
    }
}
