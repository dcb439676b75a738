package com.docflow.action.sink;

import com.docflow.core.model.action.NotificationChannel;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A rendered-on-delivery notification. The sink owns the template lookup.
 *
 * @param recipients user ids or {@code role:NAME} entries, placeholders already resolved
 * @param model variables available to the template
 */
public record Notification(
    String idempotencyKey,
    UUID instanceId,
    String nodeId,
    String template,
    NotificationChannel channel,
    List<String> recipients,
    Map<String, JsonNode> model
) {
    public Notification {
        recipients = List.copyOf(recipients);
        model = model == null ? Map.of() : Map.copyOf(model);
    }
}
