package com.processflow.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.processflow.core.exception.AccessDeniedException;
import com.processflow.core.exception.DefinitionIntegrityException;
import com.processflow.core.exception.NotFoundException;
import com.processflow.core.exception.OptimisticLockException;
import com.processflow.core.lifecycle.BusinessKeyGenerator;
import com.processflow.core.lifecycle.LifecycleStateMachine;
import com.processflow.core.lifecycle.StartCommand;
import com.processflow.core.lifecycle.Transition;
import com.processflow.core.model.Actor;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.LifecycleOperation;
import com.processflow.core.model.Priority;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.InstanceQuery;
import com.processflow.core.repository.ProcessDefinitionRepository;
import com.processflow.core.repository.ProcessInstanceRepository;
import com.processflow.engine.history.ProcessHistoryService;
import com.processflow.engine.history.ReplayedState;
import com.processflow.engine.history.StepView;
import com.processflow.engine.logging.LoggingContext;
import com.processflow.engine.metrics.ProcessMetrics;
import com.processflow.engine.security.AccessPolicy;
import com.processflow.engine.service.ProcessService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Drives process instances through their lifecycle.
 *
 * Each mutating operation reads the instance, lets the state machine compute the
 * transition and commits it conditionally on the sequence number that was read.
 * A concurrent writer makes the commit fail with {@link OptimisticLockException};
 * the coordinator never retries on its own.
 */
public class ProcessCoordinator implements ProcessService {

    private static final Logger log = LoggerFactory.getLogger(ProcessCoordinator.class);

    private static final String INSTANCE = "ProcessInstance";
    private static final String DEFINITION = "ProcessDefinition";

    private final ProcessDefinitionRepository definitionRepository;
    private final ProcessInstanceRepository instanceRepository;
    private final ProcessHistoryService historyService;
    private final LifecycleStateMachine stateMachine;
    private final BusinessKeyGenerator businessKeyGenerator;
    private final AccessPolicy accessPolicy;
    private final DefinitionLocks definitionLocks;
    private final ProcessMetrics metrics;
    private final Priority defaultPriority;
    private final int maxQueryLimit;

    public ProcessCoordinator(
            ProcessDefinitionRepository definitionRepository,
            ProcessInstanceRepository instanceRepository,
            ProcessHistoryService historyService,
            LifecycleStateMachine stateMachine,
            BusinessKeyGenerator businessKeyGenerator,
            AccessPolicy accessPolicy,
            DefinitionLocks definitionLocks,
            ProcessMetrics metrics,
            Priority defaultPriority,
            int maxQueryLimit) {
        this.definitionRepository = definitionRepository;
        this.instanceRepository = instanceRepository;
        this.historyService = historyService;
        this.stateMachine = stateMachine;
        this.businessKeyGenerator = businessKeyGenerator;
        this.accessPolicy = accessPolicy;
        this.definitionLocks = definitionLocks;
        this.metrics = metrics;
        this.defaultPriority = defaultPriority;
        this.maxQueryLimit = maxQueryLimit;
    }

    @Override
    public ProcessInstance start(StartProcessRequest request, Actor actor) {
        UUID definitionId = request.definitionId();
        if (definitionId == null) {
            throw new NotFoundException(DEFINITION, "null");
        }
        try (var ctx = LoggingContext.forDefinition(definitionId, actor)) {
            return definitionLocks.withShared(definitionId, () -> startLocked(definitionId, request, actor));
        }
    }

    private ProcessInstance startLocked(UUID definitionId, StartProcessRequest request, Actor actor) {
        ProcessDefinition definition = definitionRepository.findById(definitionId)
            .orElseThrow(() -> new NotFoundException(DEFINITION, definitionId.toString()));
        if (!accessPolicy.canRead(actor, definition.tenantId())) {
            throw new AccessDeniedException(DEFINITION, definition.definitionId().toString(), actor.userId());
        }

        String businessKey = request.businessKey() != null && !request.businessKey().isBlank()
            ? request.businessKey()
            : businessKeyGenerator.generate();
        LoggingContext.setBusinessKey(businessKey);

        StartCommand command = new StartCommand(
            businessKey,
            actor.tenantId(),
            request.departmentId(),
            actor.userId(),
            request.variables(),
            request.priority() != null ? request.priority() : defaultPriority,
            request.assignedTo()
        );

        Transition transition = stateMachine.start(definition, command);
        instanceRepository.create(transition.updated(), transition.entry());

        ProcessInstance instance = transition.updated();
        LoggingContext.setInstanceId(instance.instanceId());
        metrics.instanceStarted(definition.name());
        log.info("Started process instance {} of {} at step {}",
            instance.instanceId(), definition.key(), instance.currentStep());
        return instance;
    }

    @Override
    public ProcessInstance getInstance(UUID instanceId, Actor actor) {
        ProcessInstance instance = load(instanceId);
        if (!accessPolicy.canRead(actor, instance.tenantId())) {
            throw new AccessDeniedException(INSTANCE, instanceId.toString(), actor.userId());
        }
        return instance;
    }

    @Override
    public ProcessInstance completeTask(UUID instanceId, Map<String, JsonNode> variables, Actor actor) {
        return apply(instanceId, actor, LifecycleOperation.COMPLETE_TASK, instance -> {
            ProcessDefinition definition = definitionRepository.findById(instance.definitionId())
                .orElseThrow(() -> new DefinitionIntegrityException(String.format(
                    "Process definition %s of instance %s no longer exists",
                    instance.definitionId(), instance.instanceId())));
            return stateMachine.completeTask(instance, definition, actor.userId(), variables);
        });
    }

    @Override
    public ProcessInstance suspend(UUID instanceId, Actor actor) {
        return apply(instanceId, actor, LifecycleOperation.SUSPEND,
            instance -> stateMachine.suspend(instance, actor.userId()));
    }

    @Override
    public ProcessInstance resume(UUID instanceId, Actor actor) {
        return apply(instanceId, actor, LifecycleOperation.RESUME,
            instance -> stateMachine.resume(instance, actor.userId()));
    }

    @Override
    public ProcessInstance cancel(UUID instanceId, String reason, Actor actor) {
        return apply(instanceId, actor, LifecycleOperation.CANCEL,
            instance -> stateMachine.cancel(instance, actor.userId(), reason));
    }

    @Override
    public ProcessInstance fail(UUID instanceId, String cause, Actor actor) {
        return apply(instanceId, actor, LifecycleOperation.FAIL,
            instance -> stateMachine.fail(instance, actor.userId(), cause));
    }

    @Override
    public ProcessInstance retry(UUID instanceId, Actor actor) {
        return apply(instanceId, actor, LifecycleOperation.RETRY,
            instance -> stateMachine.retry(instance, actor.userId(), historyService.retryCount(instanceId)));
    }

    @Override
    public Map<String, JsonNode> getVariables(UUID instanceId, Actor actor) {
        return getInstance(instanceId, actor).variables();
    }

    @Override
    public Map<String, JsonNode> updateVariables(UUID instanceId, Map<String, JsonNode> variables, Actor actor) {
        ProcessInstance instance = loadForWrite(instanceId, actor);
        try (var ctx = LoggingContext.forInstance(instance, actor)) {
            Optional<Transition> transition = stateMachine.updateVariables(instance, actor.userId(), variables);
            if (transition.isEmpty()) {
                log.debug("Variable update on instance {} changed nothing", instanceId);
                return instance.variables();
            }
            ProcessInstance updated = commit(transition.get(), LifecycleOperation.UPDATE_VARIABLES);
            log.info("Updated variables {} of instance {}",
                transition.get().entry().details().get("updatedKeys"), instanceId);
            return updated.variables();
        }
    }

    @Override
    public List<AuditEntry> getHistory(UUID instanceId, Actor actor) {
        getInstance(instanceId, actor);
        return historyService.history(instanceId);
    }

    @Override
    public List<StepView> getSteps(UUID instanceId, Actor actor) {
        ProcessInstance instance = getInstance(instanceId, actor);
        ProcessDefinition definition = definitionRepository.findById(instance.definitionId())
            .orElseThrow(() -> new NotFoundException(DEFINITION, instance.definitionId().toString()));
        return historyService.steps(instance, definition);
    }

    @Override
    public ReplayedState replay(UUID instanceId, Long toSequence, Actor actor) {
        getInstance(instanceId, actor);
        return historyService.replay(instanceId, toSequence);
    }

    @Override
    public List<ProcessInstance> queryInstances(InstanceQueryRequest query, Actor actor) {
        int limit = query.limit() == null ? maxQueryLimit : Math.min(Math.max(query.limit(), 0), maxQueryLimit);
        int offset = query.offset() == null ? 0 : Math.max(query.offset(), 0);
        return instanceRepository.query(new InstanceQuery(
            actor.tenantId(),
            query.status(),
            query.definitionId(),
            query.businessKey(),
            query.priority(),
            limit,
            offset
        ));
    }

    // ========== Helper Methods ==========

    private ProcessInstance apply(UUID instanceId, Actor actor, LifecycleOperation operation,
                                  Function<ProcessInstance, Transition> step) {
        ProcessInstance instance = loadForWrite(instanceId, actor);
        try (var ctx = LoggingContext.forInstance(instance, actor)) {
            Transition transition;
            try {
                transition = step.apply(instance);
            } catch (DefinitionIntegrityException e) {
                log.warn("Cannot apply {} to instance {}: {}", operation.tag(), instanceId, e.getMessage());
                throw e;
            }
            ProcessInstance updated = commit(transition, operation);
            log.info("Applied {} to instance {}: {} -> {} at step {}",
                operation.tag(), instanceId, instance.status(), updated.status(), updated.currentStep());
            recordOutcome(instance, updated);
            return updated;
        }
    }

    private ProcessInstance commit(Transition transition, LifecycleOperation operation) {
        try {
            instanceRepository.commit(transition.updated(), transition.entry(), transition.expectedSequence());
        } catch (OptimisticLockException e) {
            metrics.commitConflict(operation.tag());
            log.warn("Concurrent modification of instance {} during {}: {}",
                transition.updated().instanceId(), operation.tag(), e.getMessage());
            throw e;
        }
        return transition.updated();
    }

    private void recordOutcome(ProcessInstance before, ProcessInstance after) {
        String definitionName = after.definitionName();
        if (before.status() == after.status()) {
            return;
        }
        if (after.status() == ProcessStatus.COMPLETED) {
            metrics.instanceCompleted(definitionName, after.duration());
        } else if (after.status() == ProcessStatus.CANCELLED) {
            metrics.instanceCancelled(definitionName, after.duration());
        } else if (after.status() == ProcessStatus.FAILED) {
            metrics.instanceFailed(definitionName, after.duration());
        } else if (before.status() == ProcessStatus.FAILED) {
            metrics.instanceRetried(definitionName);
        }
    }

    private ProcessInstance loadForWrite(UUID instanceId, Actor actor) {
        ProcessInstance instance = load(instanceId);
        if (!accessPolicy.canWrite(actor, instance.tenantId())) {
            throw new AccessDeniedException(INSTANCE, instanceId.toString(), actor.userId());
        }
        return instance;
    }

    private ProcessInstance load(UUID instanceId) {
        return instanceRepository.findById(instanceId)
            .orElseThrow(() -> new NotFoundException(INSTANCE, instanceId.toString()));
    }
}
