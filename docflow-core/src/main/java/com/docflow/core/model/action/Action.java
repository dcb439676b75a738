package com.docflow.core.model.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Side effect attached to a node. Every action carries an id that is stable within its
 * node; together with the instance and node it forms the idempotency key for dispatch.
 *
 * SetVariable is pure and applied directly to the variable context. All other variants
 * reach an external collaborator and go through the executor's ledger.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Action.SetVariable.class, name = "setVariable"),
    @JsonSubTypes.Type(value = Action.Notify.class, name = "notify"),
    @JsonSubTypes.Type(value = Action.InvokeExternal.class, name = "invoke"),
    @JsonSubTypes.Type(value = Action.Escalate.class, name = "escalate"),
    @JsonSubTypes.Type(value = Action.Custom.class, name = "custom")
})
public sealed interface Action {

    String id();

    ActionKind kind();

    enum ActionKind {
        SET_VARIABLE,
        NOTIFY,
        INVOKE_EXTERNAL,
        ESCALATE,
        CUSTOM;

        public boolean external() {
            return this != SET_VARIABLE;
        }
    }

    record SetVariable(String id, String name, JsonNode value) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.SET_VARIABLE;
        }
    }

    /**
     * Send a templated notification. Recipients may reference instance variables as
     * {@code ${variable}}; the template name is resolved by the notification sink.
     */
    record Notify(String id, String template, NotificationChannel channel, List<String> recipients)
            implements Action {
        public Notify {
            channel = channel == null ? NotificationChannel.EMAIL : channel;
            recipients = recipients == null ? List.of() : List.copyOf(recipients);
        }

        @Override
        public ActionKind kind() {
            return ActionKind.NOTIFY;
        }
    }

    /**
     * Call an external system. The response, if any, is stored in {@code resultVariable}.
     */
    record InvokeExternal(String id, String target, String operation, JsonNode parameters,
                          String resultVariable) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.INVOKE_EXTERNAL;
        }
    }

    record Escalate(String id, List<String> targets, String reason) implements Action {
        public Escalate {
            targets = targets == null ? List.of() : List.copyOf(targets);
        }

        @Override
        public ActionKind kind() {
            return ActionKind.ESCALATE;
        }
    }

    /**
     * Dispatch to a handler registered under {@code handler} in the executor.
     */
    record Custom(String id, String handler, JsonNode parameters) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.CUSTOM;
        }
    }

    static Action setVariable(String id, String name, JsonNode value) {
        return new SetVariable(id, name, value);
    }

    static Action notify(String id, String template, String... recipients) {
        return new Notify(id, template, NotificationChannel.EMAIL, List.of(recipients));
    }

    static Action invoke(String id, String target, String operation) {
        return new InvokeExternal(id, target, operation, null, null);
    }

    static Action escalate(String id, String reason, String... targets) {
        return new Escalate(id, List.of(targets), reason);
    }
}
