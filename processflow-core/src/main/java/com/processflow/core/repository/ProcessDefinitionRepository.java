package com.processflow.core.repository;

import com.processflow.core.model.ProcessDefinition;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ProcessDefinition persistence.
 * The engine only reads definitions; authors write them through the definition service.
 */
public interface ProcessDefinitionRepository {

    /**
     * Save a new definition.
     *
     * @throws com.processflow.core.exception.DuplicateDefinitionException if name and version are taken
     */
    void save(ProcessDefinition definition);

    /**
     * Replace an existing definition.
     *
     * @throws com.processflow.core.exception.NotFoundException if the definition does not exist
     * @throws com.processflow.core.exception.DuplicateDefinitionException if the new name and version
     *         belong to another definition
     */
    void update(ProcessDefinition definition);

    Optional<ProcessDefinition> findById(UUID definitionId);

    Optional<ProcessDefinition> findByNameAndVersion(String name, String version);

    List<ProcessDefinition> query(DefinitionQuery query);

    /**
     * Stores shared between processes recount bound instances under their own lock.
     *
     * @return true if a definition was removed
     * @throws com.processflow.core.exception.DefinitionInUseException if the store itself sees
     *         RUNNING or SUSPENDED instances bound to the definition
     */
    boolean delete(UUID definitionId);
}
