package com.processflow.engine.coordinator;

import com.processflow.core.exception.AccessDeniedException;
import com.processflow.core.exception.DefinitionInUseException;
import com.processflow.core.exception.DuplicateDefinitionException;
import com.processflow.core.exception.NotFoundException;
import com.processflow.core.model.Actor;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.repository.DefinitionQuery;
import com.processflow.core.repository.ProcessDefinitionRepository;
import com.processflow.core.repository.ProcessInstanceRepository;
import com.processflow.core.validation.DefinitionValidator;
import com.processflow.core.validation.ValidationResult;
import com.processflow.engine.logging.LoggingContext;
import com.processflow.engine.security.AccessPolicy;
import com.processflow.engine.service.DefinitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Authoring side of process definitions: registration, edits, activation and removal.
 */
public class DefinitionCoordinator implements DefinitionService {

    private static final Logger log = LoggerFactory.getLogger(DefinitionCoordinator.class);

    private static final String DEFINITION = "ProcessDefinition";

    private final ProcessDefinitionRepository definitionRepository;
    private final ProcessInstanceRepository instanceRepository;
    private final DefinitionValidator validator;
    private final AccessPolicy accessPolicy;
    private final DefinitionLocks definitionLocks;
    private final Clock clock;
    private final int maxQueryLimit;

    public DefinitionCoordinator(
            ProcessDefinitionRepository definitionRepository,
            ProcessInstanceRepository instanceRepository,
            DefinitionValidator validator,
            AccessPolicy accessPolicy,
            DefinitionLocks definitionLocks,
            Clock clock,
            int maxQueryLimit) {
        this.definitionRepository = definitionRepository;
        this.instanceRepository = instanceRepository;
        this.validator = validator;
        this.accessPolicy = accessPolicy;
        this.definitionLocks = definitionLocks;
        this.clock = clock;
        this.maxQueryLimit = maxQueryLimit;
    }

    @Override
    public ProcessDefinition register(ProcessDefinition definition, Actor actor) {
        Instant now = clock.instant();
        ProcessDefinition registered = definition.toBuilder()
            .definitionId(UUID.randomUUID())
            .version(definition.version() != null ? definition.version() : ProcessDefinition.DEFAULT_VERSION)
            .tenantId(actor.tenantId())
            .createdBy(actor.userId())
            .updatedBy(actor.userId())
            .createdAt(now)
            .updatedAt(now)
            .build();

        try (var ctx = LoggingContext.forDefinition(registered.definitionId(), actor)) {
            log.info("Registering process definition {}", registered.key());
            if (registered.active()) {
                validator.requireValid(registered);
            }
            ensureKeyAvailable(registered, null);
            definitionRepository.save(registered);
            log.info("Registered process definition {} as {}", registered.key(), registered.definitionId());
            return registered;
        }
    }

    @Override
    public ProcessDefinition update(UUID definitionId, ProcessDefinition changes, Actor actor) {
        ProcessDefinition existing = loadForWrite(definitionId, actor);
        try (var ctx = LoggingContext.forDefinition(definitionId, actor)) {
            ProcessDefinition updated = changes.toBuilder()
                .definitionId(existing.definitionId())
                .version(changes.version() != null ? changes.version() : existing.version())
                .tenantId(existing.tenantId())
                .createdBy(existing.createdBy())
                .createdAt(existing.createdAt())
                .updatedBy(actor.userId())
                .updatedAt(clock.instant())
                .build();
            if (updated.active()) {
                validator.requireValid(updated);
            }
            ensureKeyAvailable(updated, definitionId);
            definitionRepository.update(updated);
            log.info("Updated process definition {} ({})", updated.key(), definitionId);
            return updated;
        }
    }

    @Override
    public ProcessDefinition activate(UUID definitionId, Actor actor) {
        ProcessDefinition existing = loadForWrite(definitionId, actor);
        try (var ctx = LoggingContext.forDefinition(definitionId, actor)) {
            validator.requireValid(existing);
            ProcessDefinition activated = touch(existing.toBuilder().active(true), actor);
            definitionRepository.update(activated);
            log.info("Activated process definition {}", existing.key());
            return activated;
        }
    }

    @Override
    public ProcessDefinition deactivate(UUID definitionId, Actor actor) {
        ProcessDefinition existing = loadForWrite(definitionId, actor);
        try (var ctx = LoggingContext.forDefinition(definitionId, actor)) {
            ProcessDefinition deactivated = touch(existing.toBuilder().active(false), actor);
            definitionRepository.update(deactivated);
            log.info("Deactivated process definition {}", existing.key());
            return deactivated;
        }
    }

    @Override
    public void delete(UUID definitionId, Actor actor) {
        ProcessDefinition existing = loadForWrite(definitionId, actor);
        try (var ctx = LoggingContext.forDefinition(definitionId, actor)) {
            definitionLocks.withExclusive(definitionId, () -> {
                long active = instanceRepository.countActiveByDefinition(definitionId);
                if (active > 0) {
                    throw new DefinitionInUseException(definitionId, active);
                }
                definitionRepository.delete(definitionId);
            });
            log.info("Deleted process definition {}", existing.key());
        }
    }

    @Override
    public ProcessDefinition get(UUID definitionId, Actor actor) {
        ProcessDefinition definition = load(definitionId);
        if (!accessPolicy.canRead(actor, definition.tenantId())) {
            throw new AccessDeniedException(DEFINITION, definitionId.toString(), actor.userId());
        }
        return definition;
    }

    @Override
    public List<ProcessDefinition> query(DefinitionQueryRequest query, Actor actor) {
        int limit = query.limit() == null ? maxQueryLimit : Math.min(Math.max(query.limit(), 0), maxQueryLimit);
        int offset = query.offset() == null ? 0 : Math.max(query.offset(), 0);
        return definitionRepository.query(new DefinitionQuery(
            actor.tenantId(),
            query.category(),
            query.active(),
            query.search(),
            limit,
            offset
        ));
    }

    @Override
    public ValidationResult validate(ProcessDefinition definition) {
        return validator.validate(definition);
    }

    private void ensureKeyAvailable(ProcessDefinition definition, UUID ownId) {
        definitionRepository.findByNameAndVersion(definition.name(), definition.version())
            .filter(other -> !other.definitionId().equals(ownId))
            .ifPresent(other -> {
                throw new DuplicateDefinitionException(definition.name(), definition.version());
            });
    }

    private ProcessDefinition touch(ProcessDefinition.Builder builder, Actor actor) {
        return builder
            .updatedBy(actor.userId())
            .updatedAt(clock.instant())
            .build();
    }

    private ProcessDefinition loadForWrite(UUID definitionId, Actor actor) {
        ProcessDefinition definition = load(definitionId);
        if (!accessPolicy.canWrite(actor, definition.tenantId())) {
            throw new AccessDeniedException(DEFINITION, definitionId.toString(), actor.userId());
        }
        return definition;
    }

    private ProcessDefinition load(UUID definitionId) {
        return definitionRepository.findById(definitionId)
            .orElseThrow(() -> new NotFoundException(DEFINITION, definitionId.toString()));
    }
}
