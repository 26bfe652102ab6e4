package com.processflow.engine.service;

import com.processflow.core.model.Actor;
import com.processflow.core.model.ProcessCategory;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.validation.ValidationResult;

import java.util.List;
import java.util.UUID;

/**
 * Authoring operations for process definitions.
 * Activation always runs the validator; inactive definitions may be stored invalid.
 */
public interface DefinitionService {

    /**
     * Register a new definition owned by the caller's tenant.
     *
     * @throws com.processflow.core.exception.DuplicateDefinitionException if name and version are taken
     * @throws com.processflow.core.exception.DefinitionValidationException if active and invalid
     */
    ProcessDefinition register(ProcessDefinition definition, Actor actor);

    /**
     * Replace the authored content of a definition. Identity, owner and creation data are kept.
     */
    ProcessDefinition update(UUID definitionId, ProcessDefinition changes, Actor actor);

    ProcessDefinition activate(UUID definitionId, Actor actor);

    ProcessDefinition deactivate(UUID definitionId, Actor actor);

    /**
     * @throws com.processflow.core.exception.DefinitionInUseException if running or suspended instances are bound to it
     */
    void delete(UUID definitionId, Actor actor);

    ProcessDefinition get(UUID definitionId, Actor actor);

    List<ProcessDefinition> query(DefinitionQueryRequest query, Actor actor);

    ValidationResult validate(ProcessDefinition definition);

    /**
     * Query criteria for definitions. Results are limited to the caller's tenant and shared templates.
     */
    record DefinitionQueryRequest(
        ProcessCategory category,
        Boolean active,
        String search,
        Integer limit,
        Integer offset
    ) {
        public static DefinitionQueryRequest all() {
            return new DefinitionQueryRequest(null, null, null, null, null);
        }
    }
}
