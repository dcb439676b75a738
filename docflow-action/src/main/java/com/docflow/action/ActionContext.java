package com.docflow.action;

import com.docflow.core.model.action.Action;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Map;
import java.util.UUID;

/**
 * Context handed to custom action handlers for one dispatch attempt.
 */
public class ActionContext {

    private final ActionRequest request;
    private final int attemptNumber;
    private final ObjectMapper objectMapper;

    public ActionContext(ActionRequest request, int attemptNumber, ObjectMapper objectMapper) {
        this.request = request;
        this.attemptNumber = attemptNumber;
        this.objectMapper = objectMapper;
    }

    public ActionRequest getRequest() {
        return request;
    }

    public Action getAction() {
        return request.action();
    }

    public UUID getInstanceId() {
        return request.instanceId();
    }

    public String getNodeId() {
        return request.nodeId();
    }

    /**
     * 1-indexed.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    /**
     * Pass this on to downstream systems so a retried call is recognised as the same call.
     */
    public String getIdempotencyKey() {
        return request.idempotencyKey();
    }

    public Map<String, JsonNode> getVariables() {
        return request.variables();
    }

    public JsonNode getVariable(String name) {
        return request.variables().get(name);
    }

    /**
     * Parameters of a custom or external action, or a missing node for other kinds.
     */
    public JsonNode getParameters() {
        Action action = request.action();
        JsonNode parameters = null;
        if (action.kind() == Action.ActionKind.CUSTOM) {
            parameters = ((Action.Custom) action).parameters();
        } else if (action.kind() == Action.ActionKind.INVOKE_EXTERNAL) {
            parameters = ((Action.InvokeExternal) action).parameters();
        }
        return parameters == null ? MissingNode.getInstance() : parameters;
    }

    public <T> T getParameters(Class<T> type) {
        return objectMapper.convertValue(getParameters(), type);
    }

    public JsonNode toJsonNode(Object value) {
        return objectMapper.valueToTree(value);
    }
}
