package com.docflow.action.sink;

import com.docflow.action.ActionException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound integrations (archiving, e-signature, publishing). Implementations pass the
 * request's idempotency key on so that retried calls are not applied twice downstream.
 */
@FunctionalInterface
public interface IntegrationGateway {

    /**
     * @return the response body, or null when the call produces nothing
     */
    JsonNode invoke(IntegrationRequest request) throws ActionException;

    /**
     * Gateway for deployments without integrations: every call fails permanently.
     */
    static IntegrationGateway unavailable() {
        return request -> {
            throw ActionException.permanent("NO_INTEGRATION",
                "No integration gateway configured for target " + request.target());
        };
    }
}
