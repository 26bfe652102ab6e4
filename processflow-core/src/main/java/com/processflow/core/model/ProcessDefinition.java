package com.processflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Versioned template describing a directed graph of typed steps.
 * Never mutated by the engine; authors replace it through explicit updates.
 *
 * Primary Key: definitionId
 * Unique Constraint: (name, version)
 *
 * Invariants (checked by the validator, not by construction):
 * - node ids are unique
 * - exactly one START node exists
 * - every connection target references an existing node
 * - a definition without nodes cannot be activated
 */
public record ProcessDefinition(
    // Identity
    UUID definitionId,
    String name,
    String version,
    String description,
    ProcessCategory category,

    // Graph structure
    List<ProcessNode> nodes,
    Map<String, JsonNode> variables,

    // Availability
    boolean active,
    Set<String> permissions,
    List<String> tags,

    // Ownership
    String tenantId,
    String createdBy,
    String updatedBy,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String DEFAULT_VERSION = "1.0.0";

    public ProcessDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Human-readable key, unique across definitions.
     */
    public String key() {
        return name + ":" + version;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID definitionId = UUID.randomUUID();
        private String name;
        private String version = DEFAULT_VERSION;
        private String description;
        private ProcessCategory category = ProcessCategory.CUSTOM;
        private List<ProcessNode> nodes = List.of();
        private Map<String, JsonNode> variables = Map.of();
        private boolean active = true;
        private Set<String> permissions = Set.of();
        private List<String> tags = List.of();
        private String tenantId;
        private String createdBy;
        private String updatedBy;
        private Instant createdAt = Instant.now();
        private Instant updatedAt;

        public Builder() {
        }

        public Builder(ProcessDefinition definition) {
            this.definitionId = definition.definitionId();
            this.name = definition.name();
            this.version = definition.version();
            this.description = definition.description();
            this.category = definition.category();
            this.nodes = definition.nodes();
            this.variables = definition.variables();
            this.active = definition.active();
            this.permissions = definition.permissions();
            this.tags = definition.tags();
            this.tenantId = definition.tenantId();
            this.createdBy = definition.createdBy();
            this.updatedBy = definition.updatedBy();
            this.createdAt = definition.createdAt();
            this.updatedAt = definition.updatedAt();
        }

        public Builder definitionId(UUID definitionId) {
            this.definitionId = definitionId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(ProcessCategory category) {
            this.category = category;
            return this;
        }

        public Builder nodes(List<ProcessNode> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder variables(Map<String, JsonNode> variables) {
            this.variables = variables;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder permissions(Set<String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder updatedBy(String updatedBy) {
            this.updatedBy = updatedBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ProcessDefinition build() {
            return new ProcessDefinition(
                definitionId, name, version, description, category,
                nodes, variables, active, permissions, tags,
                tenantId, createdBy, updatedBy, createdAt, updatedAt
            );
        }
    }
}
