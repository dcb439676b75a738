package com.docflow.core.repository;

import com.docflow.core.exception.NotFoundException;
import com.docflow.core.model.EntityReference;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage contract for workflow instances. Implementations are injected; the engine only
 * relies on the guarantees below.
 *
 * <ul>
 *   <li>save succeeds only when the stored version equals {@code expectedVersion} and the new
 *       instance's version is {@code expectedVersion + 1}</li>
 *   <li>history only grows: a save whose history is not an extension of the stored one is rejected</li>
 *   <li>a successful save is visible to every subsequent load</li>
 * </ul>
 */
public interface WorkflowInstanceStore {

    /**
     * Store a new instance at version 0.
     *
     * @throws IllegalStateException if the id already exists
     */
    void create(WorkflowInstance instance);

    Optional<WorkflowInstance> findById(UUID instanceId);

    /**
     * Load an instance that must exist.
     *
     * @throws NotFoundException if no instance has this id
     */
    default WorkflowInstance load(UUID instanceId) {
        return findById(instanceId)
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", instanceId.toString()));
    }

    /**
     * Replace the stored instance if it is still at {@code expectedVersion}.
     *
     * @throws com.docflow.core.exception.ConcurrencyConflictException if the stored version differs
     * @throws IllegalStateException if the new history does not extend the stored history
     */
    void save(WorkflowInstance instance, long expectedVersion);

    List<WorkflowInstance> findByEntity(EntityReference entity);

    List<WorkflowInstance> findByStatus(WorkflowStatus status);

    List<WorkflowInstance> findByDefinition(String definitionId);

    List<WorkflowInstance> findAll();
}
