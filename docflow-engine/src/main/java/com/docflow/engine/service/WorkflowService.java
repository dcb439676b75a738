package com.docflow.engine.service;

import com.docflow.core.model.EntityReference;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.guard.Actor;
import com.docflow.core.validation.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service interface for workflow definitions and instances.
 */
public interface WorkflowService {

    // ========== Definitions ==========

    /**
     * Check a definition without publishing it.
     */
    ValidationReport validateDefinition(WorkflowDefinition definition);

    /**
     * Validate and store a definition. The stored copy is active.
     *
     * @throws com.docflow.core.exception.WorkflowDefinitionException if validation fails
     * @throws com.docflow.core.exception.DuplicateDefinitionException if (name, version) exists
     */
    WorkflowDefinition publishDefinition(WorkflowDefinition definition);

    /**
     * Parse a JSON definition, then validate and store it.
     */
    WorkflowDefinition publishDefinition(String definitionJson);

    /**
     * Block new starts from a definition. Running instances are unaffected.
     */
    WorkflowDefinition deactivateDefinition(String definitionId);

    Optional<WorkflowDefinition> getDefinition(String definitionId);

    /**
     * Highest active semantic version published under a name.
     */
    Optional<WorkflowDefinition> getLatestDefinition(String name);

    List<WorkflowDefinition> listDefinitionVersions(String name);

    // ========== Commands ==========

    /**
     * Start a new instance and move it onto the start node's successors.
     *
     * @return the persisted instance
     * @throws com.docflow.core.exception.NotFoundException if the definition or entity is unknown
     * @throws com.docflow.core.exception.InvalidVariablesException if initial variables are invalid
     */
    WorkflowInstance startWorkflow(StartWorkflowRequest request);

    /**
     * Start an instance of every definition whose trigger matches the entity's type and the
     * event. Only the latest active version of each definition name is considered.
     *
     * @return the started instances, empty when nothing is triggered
     */
    List<WorkflowInstance> onEntityEvent(EntityReference entity, String eventName, Map<String, JsonNode> variables,
                                         Actor actor);

    /**
     * Move an instance along an edge out of an active node.
     *
     * @return the instance at its new version
     * @throws com.docflow.core.exception.ConcurrencyConflictException if the expected version is stale
     * @throws com.docflow.core.exception.GuardDeniedException if a guard or condition rejects the move
     * @throws com.docflow.core.exception.TerminalStateViolationException if the trigger node is not active
     */
    WorkflowInstance transition(TransitionRequest request);

    /**
     * Complete an active task with the given data and follow the first eligible edge.
     */
    WorkflowInstance completeTask(CompleteTaskRequest request);

    /**
     * Deliver a named signal, releasing every active timer node waiting on it.
     */
    WorkflowInstance signal(UUID instanceId, String signalName, Map<String, JsonNode> data, Actor actor);

    WorkflowInstance suspend(UUID instanceId, Actor actor, String reason);

    WorkflowInstance resume(UUID instanceId, Actor actor);

    /**
     * Run cancellation actions on every active node and mark the instance cancelled.
     */
    WorkflowInstance cancel(UUID instanceId, Actor actor, String reason);

    // ========== Queries ==========

    Optional<WorkflowInstance> getWorkflow(UUID instanceId);

    /**
     * Instances matching every non-null criterion of the query.
     */
    List<WorkflowInstance> findWorkflows(WorkflowQuery query);

    /**
     * Targets reachable now from an active node for the given actor: edges whose condition
     * holds and whose destination guards allow.
     */
    List<String> availableTransitions(UUID instanceId, String nodeId, Actor actor);

    // ========== Request Types ==========

    /**
     * @param definitionId definition to start; when null the latest active version of
     *                     {@code definitionName} is used
     * @param startNode start node to enter; when null the first start node the definition
     *                  declares
     */
    record StartWorkflowRequest(
        String definitionId,
        String definitionName,
        EntityReference entity,
        Actor initiator,
        Map<String, JsonNode> variables,
        String startNode
    ) {
        public StartWorkflowRequest {
            if (definitionId == null && definitionName == null) {
                throw new IllegalArgumentException("A definition id or name is required");
            }
            if (initiator == null) {
                throw new IllegalArgumentException("Initiator is required");
            }
            variables = variables == null ? Map.of() : Map.copyOf(variables);
        }

        public static StartWorkflowRequest of(String definitionId, EntityReference entity, Actor initiator,
                                              Map<String, JsonNode> variables) {
            return new StartWorkflowRequest(definitionId, null, entity, initiator, variables, null);
        }

        public static StartWorkflowRequest latest(String definitionName, EntityReference entity,
                                                  Actor initiator, Map<String, JsonNode> variables) {
            return new StartWorkflowRequest(null, definitionName, entity, initiator, variables, null);
        }

        public StartWorkflowRequest fromStartNode(String startNode) {
            return new StartWorkflowRequest(definitionId, definitionName, entity, initiator, variables, startNode);
        }
    }

    /**
     * @param expectedVersion version the caller last observed; checked strictly
     * @param targetNode destination to move to, or null for the first eligible edge
     */
    record TransitionRequest(
        UUID instanceId,
        long expectedVersion,
        String triggerNode,
        String targetNode,
        Map<String, JsonNode> data,
        Actor actor
    ) {
        public TransitionRequest {
            if (instanceId == null || triggerNode == null || actor == null) {
                throw new IllegalArgumentException("Transition needs an instance, a trigger node and an actor");
            }
            data = data == null ? Map.of() : Map.copyOf(data);
        }
    }

    /**
     * @param expectedVersion version the caller last observed, or null to act on the latest
     */
    record CompleteTaskRequest(
        UUID instanceId,
        String nodeId,
        Map<String, JsonNode> data,
        Actor actor,
        Long expectedVersion
    ) {
        public CompleteTaskRequest {
            if (instanceId == null || nodeId == null || actor == null) {
                throw new IllegalArgumentException("Task completion needs an instance, a node and an actor");
            }
            data = data == null ? Map.of() : Map.copyOf(data);
        }

        public static CompleteTaskRequest of(UUID instanceId, String nodeId, Map<String, JsonNode> data,
                                             Actor actor) {
            return new CompleteTaskRequest(instanceId, nodeId, data, actor, null);
        }
    }

    record WorkflowQuery(
        EntityReference entity,
        WorkflowStatus status,
        String definitionId
    ) {
        public static WorkflowQuery byEntity(EntityReference entity) {
            return new WorkflowQuery(entity, null, null);
        }

        public static WorkflowQuery byStatus(WorkflowStatus status) {
            return new WorkflowQuery(null, status, null);
        }

        public static WorkflowQuery byDefinition(String definitionId) {
            return new WorkflowQuery(null, null, definitionId);
        }
    }
}
