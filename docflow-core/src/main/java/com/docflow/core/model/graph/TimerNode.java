package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;
import com.docflow.core.model.action.EscalationRule;

import java.time.Duration;
import java.util.List;

/**
 * Holds a branch until the duration elapses or the named signal arrives.
 * Timeout actions run only when the duration elapses.
 */
public record TimerNode(
    String id,
    String name,
    Duration duration,
    String signalName,
    List<Action> timeoutActions,
    List<EscalationRule> escalations
) implements Node {

    public TimerNode {
        timeoutActions = timeoutActions == null ? List.of() : List.copyOf(timeoutActions);
        escalations = escalations == null ? List.of() : List.copyOf(escalations);
    }

    public static TimerNode after(String id, Duration duration, Action... timeoutActions) {
        return new TimerNode(id, id, duration, null, List.of(timeoutActions), List.of());
    }

    public static TimerNode untilSignal(String id, String signalName, Duration timeout) {
        return new TimerNode(id, id, timeout, signalName, List.of(), List.of());
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TIMER;
    }
}
