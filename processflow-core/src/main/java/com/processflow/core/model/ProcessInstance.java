package com.processflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Projected current state of one execution of a ProcessDefinition.
 * The audit trail is the source of truth; this row is written in the same
 * atomic commit as each audit entry.
 *
 * Primary Key: instanceId
 *
 * Invariants:
 * - endTime is set iff status is terminal
 * - sequenceNumber equals the number of audit entries and grows by one per commit
 * - currentStep resolves to a node of the bound definition while status is not terminal
 */
public record ProcessInstance(
    // Primary key
    UUID instanceId,

    // Bound definition (name and version pinned at start)
    UUID definitionId,
    String definitionName,
    String definitionVersion,

    // Correlation and scope
    String businessKey,
    String tenantId,
    String departmentId,

    // State
    ProcessStatus status,
    String currentStep,
    Map<String, JsonNode> variables,

    // Timing
    Instant startTime,
    Instant endTime,

    // Participants
    String initiatedBy,
    Set<String> assignedTo,
    Priority priority,

    // Versioning (optimistic locking)
    long sequenceNumber,
    Instant updatedAt
) {
    public ProcessInstance {
        if (status.isTerminal() != (endTime != null)) {
            throw new IllegalStateException(String.format(
                "Process instance %s in status %s must %shave an end time",
                instanceId, status, status.isTerminal() ? "" : "not "));
        }
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        assignedTo = assignedTo == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(assignedTo));
        priority = priority == null ? Priority.MEDIUM : priority;
    }

    /**
     * Elapsed time between start and end. Null while the instance is not terminal.
     */
    public Duration duration() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID instanceId = UUID.randomUUID();
        private UUID definitionId;
        private String definitionName;
        private String definitionVersion;
        private String businessKey;
        private String tenantId;
        private String departmentId;
        private ProcessStatus status = ProcessStatus.RUNNING;
        private String currentStep;
        private Map<String, JsonNode> variables = Map.of();
        private Instant startTime;
        private Instant endTime;
        private String initiatedBy;
        private Set<String> assignedTo = Set.of();
        private Priority priority = Priority.MEDIUM;
        private long sequenceNumber;
        private Instant updatedAt;

        public Builder() {
        }

        public Builder(ProcessInstance instance) {
            this.instanceId = instance.instanceId();
            this.definitionId = instance.definitionId();
            this.definitionName = instance.definitionName();
            this.definitionVersion = instance.definitionVersion();
            this.businessKey = instance.businessKey();
            this.tenantId = instance.tenantId();
            this.departmentId = instance.departmentId();
            this.status = instance.status();
            this.currentStep = instance.currentStep();
            this.variables = instance.variables();
            this.startTime = instance.startTime();
            this.endTime = instance.endTime();
            this.initiatedBy = instance.initiatedBy();
            this.assignedTo = instance.assignedTo();
            this.priority = instance.priority();
            this.sequenceNumber = instance.sequenceNumber();
            this.updatedAt = instance.updatedAt();
        }

        public Builder instanceId(UUID instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder definition(ProcessDefinition definition) {
            this.definitionId = definition.definitionId();
            this.definitionName = definition.name();
            this.definitionVersion = definition.version();
            return this;
        }

        public Builder definitionId(UUID definitionId) {
            this.definitionId = definitionId;
            return this;
        }

        public Builder definitionName(String definitionName) {
            this.definitionName = definitionName;
            return this;
        }

        public Builder definitionVersion(String definitionVersion) {
            this.definitionVersion = definitionVersion;
            return this;
        }

        public Builder businessKey(String businessKey) {
            this.businessKey = businessKey;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder departmentId(String departmentId) {
            this.departmentId = departmentId;
            return this;
        }

        public Builder status(ProcessStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder variables(Map<String, JsonNode> variables) {
            this.variables = variables;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder initiatedBy(String initiatedBy) {
            this.initiatedBy = initiatedBy;
            return this;
        }

        public Builder assignedTo(Set<String> assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder incrementSequence() {
            this.sequenceNumber++;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ProcessInstance build() {
            return new ProcessInstance(
                instanceId, definitionId, definitionName, definitionVersion,
                businessKey, tenantId, departmentId, status, currentStep, variables,
                startTime, endTime, initiatedBy, assignedTo, priority,
                sequenceNumber, updatedAt
            );
        }
    }
}
