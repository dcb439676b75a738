package com.docflow.action.sink;

import java.util.List;
import java.util.UUID;

public record EscalationNotice(
    String idempotencyKey,
    UUID instanceId,
    String nodeId,
    List<String> targets,
    String reason
) {
    public EscalationNotice {
        targets = List.copyOf(targets);
    }
}
