package com.docflow.core.repository;

import com.docflow.core.model.SemanticVersion;
import com.docflow.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Workflow definitions are immutable once stored; only the active flag changes.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a new, already validated workflow definition.
     *
     * @param definition The workflow definition to store
     * @throws com.docflow.core.exception.DuplicateDefinitionException if (name, version) exists
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a workflow definition by id.
     */
    Optional<WorkflowDefinition> findById(String definitionId);

    /**
     * Find a workflow definition by name and version.
     */
    Optional<WorkflowDefinition> find(String name, SemanticVersion version);

    /**
     * Find the highest active version of a workflow definition.
     */
    Optional<WorkflowDefinition> findLatest(String name);

    /**
     * List all versions of a workflow definition.
     *
     * @return All versions ordered by version descending
     */
    List<WorkflowDefinition> listVersions(String name);

    /**
     * List the latest version of every definition name.
     */
    List<WorkflowDefinition> listLatest();

    /**
     * Mark a definition inactive so no new instances can start from it.
     *
     * @return the updated definition
     * @throws com.docflow.core.exception.NotFoundException if the id is unknown
     */
    WorkflowDefinition deactivate(String definitionId);
}
