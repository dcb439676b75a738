package com.docflow.action.sink;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Call into an external system on behalf of an instance.
 *
 * @param target logical system name, e.g. "archive" or "signature-service"
 * @param operation operation on that system
 */
public record IntegrationRequest(
    String idempotencyKey,
    UUID instanceId,
    String nodeId,
    String target,
    String operation,
    JsonNode parameters
) {}
