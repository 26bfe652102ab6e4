package com.processflow.engine.security;

import com.processflow.core.model.Actor;

/**
 * Authorization decisions for definitions and instances.
 * Implementations decide from the owning tenant of the resource; a null tenant
 * marks a shared resource such as a catalog template.
 */
public interface AccessPolicy {

    boolean canRead(Actor actor, String resourceTenantId);

    boolean canWrite(Actor actor, String resourceTenantId);
}
