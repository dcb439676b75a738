package com.docflow.engine.persistence;

import com.docflow.core.exception.ConcurrencyConflictException;
import com.docflow.core.model.EntityReference;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.WorkflowTransition;
import com.docflow.core.repository.WorkflowInstanceStore;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowInstanceStore.
 * Compare-and-set happens inside {@link ConcurrentHashMap#compute}, so two saves against the
 * same version cannot both succeed.
 */
@Repository
public class InMemoryWorkflowInstanceStore implements WorkflowInstanceStore {

    private final Map<UUID, WorkflowInstance> instances = new ConcurrentHashMap<>();

    @Override
    public void create(WorkflowInstance instance) {
        if (instance.version() != 0) {
            throw new IllegalStateException("New instance must start at version 0: " + instance.instanceId());
        }
        WorkflowInstance existing = instances.putIfAbsent(instance.instanceId(), instance);
        if (existing != null) {
            throw new IllegalStateException("Instance already exists: " + instance.instanceId());
        }
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public void save(WorkflowInstance instance, long expectedVersion) {
        if (instance.version() != expectedVersion + 1) {
            throw new IllegalStateException(String.format(
                "Saved version must be %d, got %d", expectedVersion + 1, instance.version()));
        }
        instances.compute(instance.instanceId(), (id, stored) -> {
            if (stored == null) {
                throw new ConcurrencyConflictException(id, expectedVersion, -1);
            }
            if (stored.version() != expectedVersion) {
                throw new ConcurrencyConflictException(id, expectedVersion, stored.version());
            }
            if (!extendsHistory(stored.history(), instance.history())) {
                throw new IllegalStateException("History of instance " + id + " may only grow");
            }
            return instance;
        });
    }

    private static boolean extendsHistory(List<WorkflowTransition> stored, List<WorkflowTransition> updated) {
        return updated.size() >= stored.size() && updated.subList(0, stored.size()).equals(stored);
    }

    @Override
    public List<WorkflowInstance> findByEntity(EntityReference entity) {
        return instances.values().stream()
            .filter(i -> entity.equals(i.entity()))
            .sorted(Comparator.comparing(WorkflowInstance::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findByStatus(WorkflowStatus status) {
        return instances.values().stream()
            .filter(i -> i.status() == status)
            .sorted(Comparator.comparing(WorkflowInstance::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findByDefinition(String definitionId) {
        return instances.values().stream()
            .filter(i -> definitionId.equals(i.definitionId()))
            .sorted(Comparator.comparing(WorkflowInstance::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findAll() {
        return instances.values().stream()
            .sorted(Comparator.comparing(WorkflowInstance::createdAt))
            .collect(Collectors.toList());
    }
}
