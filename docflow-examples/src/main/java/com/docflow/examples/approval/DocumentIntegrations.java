package com.docflow.examples.approval;

import com.docflow.action.ActionException;
import com.docflow.action.ActionHandler;
import com.docflow.action.sink.IntegrationGateway;
import com.docflow.action.sink.IntegrationRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated document management system behind the templates' integration actions.
 *
 * Calls are idempotent on the request's idempotency key: a retried call gets the reference
 * issued by the first successful one. Transient outages can be switched on to show retries.
 */
public class DocumentIntegrations implements IntegrationGateway {

    private static final Logger log = LoggerFactory.getLogger(DocumentIntegrations.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final Map<String, JsonNode> responses = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger references = new AtomicInteger();
    private final AtomicInteger remainingOutages = new AtomicInteger();

    /**
     * Fail the next {@code count} calls with a transient DMS_UNAVAILABLE error.
     */
    public void simulateOutage(int count) {
        remainingOutages.set(count);
    }

    public int getCallCount() {
        return calls.get();
    }

    @Override
    public JsonNode invoke(IntegrationRequest request) throws ActionException {
        calls.incrementAndGet();
        if (!DocumentWorkflowTemplates.DMS.equals(request.target())) {
            throw ActionException.permanent("UNKNOWN_TARGET", "No such system: " + request.target());
        }

        JsonNode previous = responses.get(request.idempotencyKey());
        if (previous != null) {
            log.info("[{}] Replaying earlier {} response", request.idempotencyKey(), request.operation());
            return previous;
        }

        if (remainingOutages.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            log.warn("[{}] SIMULATED FAILURE: DMS unavailable for {}", request.idempotencyKey(), request.operation());
            throw ActionException.transientFailure("DMS_UNAVAILABLE", "Document store did not answer");
        }

        ObjectNode response = switch (request.operation()) {
            case "archive" -> reference("ARC");
            case "publish" -> reference("PUB");
            default -> throw ActionException.permanent("UNKNOWN_OPERATION",
                "DMS does not support " + request.operation());
        };
        responses.put(request.idempotencyKey(), response);
        log.info("[{}] DMS {} for instance {} -> {}", request.idempotencyKey(), request.operation(),
            request.instanceId(), response.get("ref").asText());
        return response;
    }

    /**
     * Handler for the {@code contract-reference} custom action: writes {@code contractRef}.
     */
    public ActionHandler contractReferenceHandler() {
        return context -> {
            ObjectNode result = mapper.createObjectNode();
            result.put("contractRef", String.format("CTR-%05d", references.incrementAndGet()));
            log.info("[{}] Assigned {} to instance {}", context.getIdempotencyKey(),
                result.get("contractRef").asText(), context.getInstanceId());
            return result;
        };
    }

    private ObjectNode reference(String prefix) {
        ObjectNode node = mapper.createObjectNode();
        node.put("ref", String.format("%s-%05d", prefix, references.incrementAndGet()));
        return node;
    }
}
