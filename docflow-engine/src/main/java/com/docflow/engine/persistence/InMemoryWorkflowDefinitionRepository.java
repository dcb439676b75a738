package com.docflow.engine.persistence;

import com.docflow.core.exception.DuplicateDefinitionException;
import com.docflow.core.exception.NotFoundException;
import com.docflow.core.model.SemanticVersion;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.repository.WorkflowDefinitionRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 * For demonstration and testing purposes.
 */
@Repository
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final Map<String, WorkflowDefinition> byId = new ConcurrentHashMap<>();

    // Key: name@version
    private final Map<String, String> idByKey = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowDefinition definition) {
        String previous = idByKey.putIfAbsent(definition.key(), definition.id());
        if (previous != null) {
            throw new DuplicateDefinitionException(definition.name(), definition.version().toString());
        }
        byId.put(definition.id(), definition);
    }

    @Override
    public Optional<WorkflowDefinition> findById(String definitionId) {
        return Optional.ofNullable(byId.get(definitionId));
    }

    @Override
    public Optional<WorkflowDefinition> find(String name, SemanticVersion version) {
        return Optional.ofNullable(idByKey.get(name + "@" + version)).map(byId::get);
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        return byId.values().stream()
            .filter(d -> d.name().equals(name) && d.active())
            .max(Comparator.comparing(WorkflowDefinition::version));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String name) {
        return byId.values().stream()
            .filter(d -> d.name().equals(name))
            .sorted(Comparator.comparing(WorkflowDefinition::version).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        // Latest version of each name, active or not
        Map<String, WorkflowDefinition> latestByName = new HashMap<>();
        byId.values().forEach(d -> {
            WorkflowDefinition existing = latestByName.get(d.name());
            if (existing == null || d.version().compareTo(existing.version()) > 0) {
                latestByName.put(d.name(), d);
            }
        });
        List<WorkflowDefinition> latest = new ArrayList<>(latestByName.values());
        latest.sort(Comparator.comparing(WorkflowDefinition::name));
        return latest;
    }

    @Override
    public WorkflowDefinition deactivate(String definitionId) {
        WorkflowDefinition updated = byId.computeIfPresent(definitionId, (id, d) -> d.deactivated());
        if (updated == null) {
            throw new NotFoundException("WorkflowDefinition", definitionId);
        }
        return updated;
    }
}
