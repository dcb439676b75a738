package com.docflow.engine.coordinator;

import java.util.UUID;

/**
 * Dispatch and event keys. A key is stable for as long as the stimulus that produces it can
 * be retried against the same stored instance, and changes once the instance moves on.
 */
final class IdempotencyKeys {

    static final String ENTRY = "entry";
    static final String EXIT = "exit";
    static final String TIMEOUT = "timeout";
    static final String CANCEL = "cancel";

    private IdempotencyKeys() {
    }

    /**
     * @param ordinal history length before the transition, plus a suffix for repeated
     *                entries of the same node within one walk
     */
    static String action(UUID instanceId, String nodeId, String actionId, String phase, String ordinal) {
        return instanceId + ":" + nodeId + ":" + actionId + ":" + phase + ":" + ordinal;
    }

    static String escalation(UUID instanceId, String nodeId, String actionId, int ruleIndex, int firing,
                             long armOrdinal) {
        return instanceId + ":" + nodeId + ":" + actionId + ":escalation-" + ruleIndex + "-" + firing
            + ":" + armOrdinal;
    }

    static String event(UUID instanceId, long version, String type) {
        return instanceId + ":" + version + ":" + type;
    }

    static String escalationEvent(UUID instanceId, String nodeId, int ruleIndex, int firing, long armOrdinal) {
        return instanceId + ":" + nodeId + ":escalated-" + ruleIndex + "-" + firing + ":" + armOrdinal;
    }

    static String escalationFailure(UUID instanceId, String nodeId, String actionId, int ruleIndex, int firing,
                                    long armOrdinal) {
        return instanceId + ":" + nodeId + ":" + actionId + ":escalation-failed-" + ruleIndex + "-" + firing
            + ":" + armOrdinal;
    }
}
