package com.processflow.core.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.processflow.core.exception.InvalidStateTransitionException;
import com.processflow.core.exception.ProcessDefinitionNotInstantiableException;
import com.processflow.core.graph.ProcessGraph;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.LifecycleOperation;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.validation.DefinitionValidator;
import com.processflow.core.validation.ValidationResult;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure transition function for process instances.
 *
 * Every operation checks the current status first and throws
 * {@link InvalidStateTransitionException} before computing anything, so a
 * rejected operation produces neither a new state nor an audit entry.
 * Nothing here touches storage; callers commit the returned {@link Transition}.
 */
public class LifecycleStateMachine {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final Clock clock;
    private final DefinitionValidator validator;
    private final StepAdvancer stepAdvancer;

    public LifecycleStateMachine(Clock clock) {
        this(clock, new DefinitionValidator(), new StepAdvancer());
    }

    public LifecycleStateMachine(Clock clock, DefinitionValidator validator, StepAdvancer stepAdvancer) {
        this.clock = clock;
        this.validator = validator;
        this.stepAdvancer = stepAdvancer;
    }

    /**
     * Create a RUNNING instance positioned at the definition's start node.
     * Definition variables seed the instance; start variables override them.
     */
    public Transition start(ProcessDefinition definition, StartCommand command) {
        if (!definition.active()) {
            throw ProcessDefinitionNotInstantiableException.inactive(definition.definitionId());
        }
        ValidationResult validation = validator.validate(definition);
        if (!validation.isValid()) {
            throw ProcessDefinitionNotInstantiableException.invalid(definition.definitionId(), validation.errors());
        }
        ProcessNode startNode = ProcessGraph.of(definition).findStartNode().orElseThrow();

        Instant now = clock.instant();
        ProcessInstance instance = ProcessInstance.builder()
            .definition(definition)
            .businessKey(command.businessKey())
            .tenantId(command.tenantId())
            .departmentId(command.departmentId())
            .status(ProcessStatus.RUNNING)
            .currentStep(startNode.id())
            .variables(VariableMerger.merge(definition.variables(), command.variables()))
            .startTime(now)
            .initiatedBy(command.initiatedBy())
            .assignedTo(command.assignedTo())
            .priority(command.priority())
            .sequenceNumber(1)
            .updatedAt(now)
            .build();

        ObjectNode details = JSON.objectNode()
            .put("definitionId", definition.definitionId().toString())
            .put("definitionName", definition.name())
            .put("definitionVersion", definition.version())
            .put("businessKey", command.businessKey())
            .put("startNode", startNode.id());
        details.set("variables", toJson(instance.variables()));

        AuditEntry entry = AuditEntry.create(instance.instanceId(), 1, now, LifecycleOperation.START,
            command.initiatedBy(), details, null, stateOf(instance));
        return Transition.created(instance, entry);
    }

    /**
     * Complete the current step and follow its first connection.
     */
    public Transition completeTask(ProcessInstance instance, ProcessDefinition definition,
                                   String actor, Map<String, JsonNode> submitted) {
        require(instance, LifecycleOperation.COMPLETE_TASK);
        StepAdvancer.Advance advance = stepAdvancer.advance(instance, definition);

        Instant now = nextTimestamp(instance);
        String completedId = advance.completedStep().id();
        Map<String, JsonNode> variables = VariableMerger.merge(instance.variables(), submitted);
        variables.put(completedId + "_completed", JSON.booleanNode(true));
        variables.put(completedId + "_completedAt", JSON.textNode(now.toString()));
        variables.put(completedId + "_completedBy", JSON.textNode(actor));

        ProcessInstance.Builder builder = instance.toBuilder()
            .variables(variables)
            .incrementSequence()
            .updatedAt(now);
        if (advance.nextStep() != null) {
            builder.currentStep(advance.nextStep());
        }
        if (advance.completes()) {
            builder.status(ProcessStatus.COMPLETED).endTime(now);
        }
        ProcessInstance updated = builder.build();

        ObjectNode details = JSON.objectNode()
            .put("completedStep", completedId)
            .put("nextStep", advance.nextStep());
        details.set("variables", toJson(submitted));

        return transition(instance, updated, LifecycleOperation.COMPLETE_TASK, actor, details, now);
    }

    public Transition suspend(ProcessInstance instance, String actor) {
        require(instance, LifecycleOperation.SUSPEND);
        Instant now = nextTimestamp(instance);
        ProcessInstance updated = instance.toBuilder()
            .status(ProcessStatus.SUSPENDED)
            .incrementSequence()
            .updatedAt(now)
            .build();
        ObjectNode details = JSON.objectNode().put("previousStatus", instance.status().wireName());
        return transition(instance, updated, LifecycleOperation.SUSPEND, actor, details, now);
    }

    public Transition resume(ProcessInstance instance, String actor) {
        require(instance, LifecycleOperation.RESUME);
        Instant now = nextTimestamp(instance);
        ProcessInstance updated = instance.toBuilder()
            .status(ProcessStatus.RUNNING)
            .incrementSequence()
            .updatedAt(now)
            .build();
        ObjectNode details = JSON.objectNode().put("previousStatus", instance.status().wireName());
        return transition(instance, updated, LifecycleOperation.RESUME, actor, details, now);
    }

    public Transition cancel(ProcessInstance instance, String actor, String reason) {
        require(instance, LifecycleOperation.CANCEL);
        Instant now = nextTimestamp(instance);
        ProcessInstance updated = instance.toBuilder()
            .status(ProcessStatus.CANCELLED)
            .endTime(now)
            .incrementSequence()
            .updatedAt(now)
            .build();
        ObjectNode details = JSON.objectNode()
            .put("previousStatus", instance.status().wireName())
            .put("reason", reason);
        return transition(instance, updated, LifecycleOperation.CANCEL, actor, details, now);
    }

    public Transition fail(ProcessInstance instance, String actor, String cause) {
        require(instance, LifecycleOperation.FAIL);
        Instant now = nextTimestamp(instance);
        ProcessInstance updated = instance.toBuilder()
            .status(ProcessStatus.FAILED)
            .endTime(now)
            .incrementSequence()
            .updatedAt(now)
            .build();
        ObjectNode details = JSON.objectNode()
            .put("cause", cause)
            .put("failedStep", instance.currentStep());
        return transition(instance, updated, LifecycleOperation.FAIL, actor, details, now);
    }

    /**
     * Return a FAILED instance to RUNNING at the step where it failed.
     *
     * @param priorRetries number of retry entries already in the instance's audit trail
     */
    public Transition retry(ProcessInstance instance, String actor, long priorRetries) {
        require(instance, LifecycleOperation.RETRY);
        Instant now = nextTimestamp(instance);
        ProcessInstance updated = instance.toBuilder()
            .status(ProcessStatus.RUNNING)
            .endTime(null)
            .incrementSequence()
            .updatedAt(now)
            .build();
        ObjectNode details = JSON.objectNode()
            .put("retryAttempt", priorRetries + 1)
            .put("retriedStep", instance.currentStep());
        return transition(instance, updated, LifecycleOperation.RETRY, actor, details, now);
    }

    /**
     * Merge variables into the instance. Returns empty when the update changes nothing,
     * in which case no audit entry is due.
     */
    public Optional<Transition> updateVariables(ProcessInstance instance, String actor,
                                                Map<String, JsonNode> updates) {
        require(instance, LifecycleOperation.UPDATE_VARIABLES);
        List<String> changed = VariableMerger.changedKeys(instance.variables(), updates);
        if (changed.isEmpty()) {
            return Optional.empty();
        }
        Instant now = nextTimestamp(instance);
        ProcessInstance updated = instance.toBuilder()
            .variables(VariableMerger.merge(instance.variables(), updates))
            .incrementSequence()
            .updatedAt(now)
            .build();

        ObjectNode details = JSON.objectNode();
        details.set("updatedKeys", JSON.arrayNode().addAll(changed.stream().map(JSON::textNode).toList()));
        details.set("variables", toJson(updates));

        Map<String, JsonNode> before = new LinkedHashMap<>();
        Map<String, JsonNode> after = new LinkedHashMap<>();
        for (String key : changed) {
            before.put(key, instance.variables().getOrDefault(key, JSON.nullNode()));
            after.put(key, updates.get(key));
        }
        ObjectNode previousState = stateOf(instance);
        previousState.set("variables", toJson(before));
        ObjectNode newState = stateOf(updated);
        newState.set("variables", toJson(after));

        AuditEntry entry = AuditEntry.create(instance.instanceId(), updated.sequenceNumber(), now,
            LifecycleOperation.UPDATE_VARIABLES, actor, details, previousState, newState);
        return Optional.of(new Transition(instance, updated, entry));
    }

    private void require(ProcessInstance instance, LifecycleOperation operation) {
        if (!operation.isAllowedFrom(instance.status())) {
            throw new InvalidStateTransitionException(instance.status(), operation);
        }
    }

    /**
     * Audit timestamps never go backwards within an instance, even if the clock does.
     */
    private Instant nextTimestamp(ProcessInstance instance) {
        Instant now = clock.instant();
        Instant last = instance.updatedAt();
        return last != null && now.isBefore(last) ? last : now;
    }

    private Transition transition(ProcessInstance previous, ProcessInstance updated,
                                  LifecycleOperation operation, String actor,
                                  ObjectNode details, Instant timestamp) {
        AuditEntry entry = AuditEntry.create(previous.instanceId(), updated.sequenceNumber(), timestamp,
            operation, actor, details, stateOf(previous), stateOf(updated));
        return new Transition(previous, updated, entry);
    }

    private static ObjectNode stateOf(ProcessInstance instance) {
        return JSON.objectNode()
            .put("status", instance.status().wireName())
            .put("currentStep", instance.currentStep());
    }

    private static ObjectNode toJson(Map<String, JsonNode> variables) {
        ObjectNode node = JSON.objectNode();
        if (variables != null) {
            variables.forEach(node::set);
        }
        return node;
    }
}
