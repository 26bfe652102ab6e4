package com.processflow.engine.security;

import com.processflow.core.model.Actor;

import java.util.Objects;

/**
 * Default policy: callers see their own tenant's resources plus shared ones,
 * and may only modify their own tenant's resources.
 */
public class TenantAccessPolicy implements AccessPolicy {

    @Override
    public boolean canRead(Actor actor, String resourceTenantId) {
        return resourceTenantId == null || Objects.equals(actor.tenantId(), resourceTenantId);
    }

    @Override
    public boolean canWrite(Actor actor, String resourceTenantId) {
        return Objects.equals(actor.tenantId(), resourceTenantId);
    }
}
