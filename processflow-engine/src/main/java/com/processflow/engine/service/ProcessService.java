package com.processflow.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.processflow.core.model.Actor;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.Priority;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.engine.history.ReplayedState;
import com.processflow.engine.history.StepView;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Engine facade for process instances.
 * Every mutating operation commits the new instance state and exactly one audit
 * entry atomically, or fails without writing anything.
 */
public interface ProcessService {

    /**
     * Start a new instance of an active, valid definition.
     *
     * @throws com.processflow.core.exception.NotFoundException if the definition does not exist
     * @throws com.processflow.core.exception.ProcessDefinitionNotInstantiableException if it is inactive or invalid
     */
    ProcessInstance start(StartProcessRequest request, Actor actor);

    ProcessInstance getInstance(UUID instanceId, Actor actor);

    /**
     * Complete the current step, merge the submitted variables and advance along the first connection.
     *
     * @throws com.processflow.core.exception.InvalidStateTransitionException if the instance is not running
     * @throws com.processflow.core.exception.CurrentStepNotFoundException if the definition no longer has the step
     * @throws com.processflow.core.exception.OptimisticLockException if another writer committed first
     */
    ProcessInstance completeTask(UUID instanceId, Map<String, JsonNode> variables, Actor actor);

    ProcessInstance suspend(UUID instanceId, Actor actor);

    ProcessInstance resume(UUID instanceId, Actor actor);

    /**
     * @param reason optional free text recorded in the audit entry
     */
    ProcessInstance cancel(UUID instanceId, String reason, Actor actor);

    ProcessInstance fail(UUID instanceId, String cause, Actor actor);

    ProcessInstance retry(UUID instanceId, Actor actor);

    Map<String, JsonNode> getVariables(UUID instanceId, Actor actor);

    /**
     * Shallow-merge variables into a running or suspended instance.
     *
     * @return the full variable map after the merge
     */
    Map<String, JsonNode> updateVariables(UUID instanceId, Map<String, JsonNode> variables, Actor actor);

    /**
     * Audit entries in sequence order.
     */
    List<AuditEntry> getHistory(UUID instanceId, Actor actor);

    /**
     * One entry per definition node, in definition order.
     */
    List<StepView> getSteps(UUID instanceId, Actor actor);

    /**
     * Reconstruct the instance state from its audit trail.
     *
     * @param toSequence last sequence number to fold, or null for the whole trail
     */
    ReplayedState replay(UUID instanceId, Long toSequence, Actor actor);

    List<ProcessInstance> queryInstances(InstanceQueryRequest query, Actor actor);

    /**
     * Request to start a process instance.
     */
    record StartProcessRequest(
        UUID definitionId,
        String businessKey,
        String departmentId,
        Map<String, JsonNode> variables,
        Priority priority,
        Set<String> assignedTo
    ) {
        public static StartProcessRequest of(UUID definitionId) {
            return new StartProcessRequest(definitionId, null, null, Map.of(), null, Set.of());
        }
    }

    /**
     * Query criteria for instances. Results are limited to the caller's tenant.
     */
    record InstanceQueryRequest(
        ProcessStatus status,
        UUID definitionId,
        String businessKey,
        Priority priority,
        Integer limit,
        Integer offset
    ) {
        public static InstanceQueryRequest all() {
            return new InstanceQueryRequest(null, null, null, null, null, null);
        }
    }
}
