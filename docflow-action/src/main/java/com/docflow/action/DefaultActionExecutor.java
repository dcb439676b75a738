package com.docflow.action;

import com.docflow.action.ledger.ActionLedger;
import com.docflow.action.ledger.InMemoryActionLedger;
import com.docflow.action.ledger.LedgerEntry;
import com.docflow.action.sink.EscalationNotice;
import com.docflow.action.sink.IntegrationGateway;
import com.docflow.action.sink.IntegrationRequest;
import com.docflow.action.sink.LoggingNotificationSink;
import com.docflow.action.sink.Notification;
import com.docflow.action.sink.NotificationSink;
import com.docflow.core.codec.JsonSupport;
import com.docflow.core.exception.ActionFailedException;
import com.docflow.core.model.action.Action;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Action executor backed by an idempotency ledger.
 *
 * SetVariable is applied without dispatch. Every other action claims its idempotency key
 * in the ledger before the first attempt; a key that is already dispatched or acknowledged
 * is skipped and its recorded variable updates are replayed. Transient failures are retried
 * on the configured executor with the retry policy's backoff. Fatal failures, and transient
 * ones that run out of attempts, complete the future with {@link ActionFailedException} and
 * release the key for a later re-run.
 */
public class DefaultActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionExecutor.class);

    private final ActionLedger ledger;
    private final NotificationSink notificationSink;
    private final IntegrationGateway integrationGateway;
    private final Map<String, ActionHandler> customHandlers;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ActionListener listener;

    private DefaultActionExecutor(Builder builder) {
        this.ledger = builder.ledger;
        this.notificationSink = builder.notificationSink;
        this.integrationGateway = builder.integrationGateway;
        this.customHandlers = Map.copyOf(builder.customHandlers);
        this.retryPolicy = builder.retryPolicy;
        this.executor = builder.executor;
        this.clock = builder.clock;
        this.objectMapper = builder.objectMapper;
        this.listener = builder.listener;
    }

    @Override
    public CompletableFuture<ActionResult> execute(ActionRequest request) {
        Action action = request.action();

        if (action.kind() == Action.ActionKind.SET_VARIABLE) {
            Action.SetVariable setVariable = (Action.SetVariable) action;
            JsonNode value = setVariable.value() == null ? NullNode.getInstance() : setVariable.value();
            return CompletableFuture.completedFuture(new ActionResult(action.id(), request.idempotencyKey(),
                ActionResult.Status.APPLIED, Map.of(setVariable.name(), value), 0));
        }

        Optional<LedgerEntry> blocking = ledger.claim(LedgerEntry.dispatched(
            request.idempotencyKey(), request.instanceId(), request.nodeId(), action.id(), clock.instant()));
        if (blocking.isPresent()) {
            log.debug("Skipping duplicate action {} on node {} (key {}, {})",
                action.id(), request.nodeId(), request.idempotencyKey(), blocking.get().status());
            return CompletableFuture.completedFuture(new ActionResult(action.id(), request.idempotencyKey(),
                ActionResult.Status.SKIPPED_DUPLICATE, blocking.get().variableUpdates(), 0));
        }

        CompletableFuture<ActionResult> result = new CompletableFuture<>();
        executor.execute(() -> attempt(request, 1, result));
        return result;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public boolean hasHandler(String handlerName) {
        return customHandlers.containsKey(handlerName);
    }

    // ========== Attempts ==========

    private void attempt(ActionRequest request, int attemptNumber, CompletableFuture<ActionResult> result) {
        Map<String, JsonNode> updates;
        try {
            updates = dispatch(new ActionContext(request, attemptNumber, objectMapper));
        } catch (ActionException e) {
            onAttemptFailed(request, attemptNumber, e, result);
            return;
        } catch (RuntimeException e) {
            onAttemptFailed(request, attemptNumber,
                new ActionException("INTERNAL_ERROR", String.valueOf(e.getMessage()), e, true), result);
            return;
        }

        ledger.acknowledge(request.idempotencyKey(), updates, attemptNumber, clock.instant());
        if (attemptNumber > 1) {
            log.info("Action {} on node {} succeeded after {} attempts",
                request.actionId(), request.nodeId(), attemptNumber);
        }
        result.complete(new ActionResult(request.actionId(), request.idempotencyKey(),
            ActionResult.Status.SUCCEEDED, updates, attemptNumber));
    }

    private void onAttemptFailed(ActionRequest request, int attemptNumber, ActionException failure,
                                 CompletableFuture<ActionResult> result) {
        if (retryPolicy.shouldRetry(failure) && retryPolicy.hasMoreAttempts(attemptNumber)) {
            Duration backoff = retryPolicy.computeBackoff(attemptNumber);
            log.warn("Action {} on node {} failed (attempt {}/{}): {} - {}. Retrying in {}ms",
                request.actionId(), request.nodeId(), attemptNumber, retryPolicy.maxAttempts(),
                failure.getErrorCode(), failure.getMessage(), backoff.toMillis());
            listener.onRetry(request, attemptNumber, failure);
            Executor delayed = CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS, executor);
            delayed.execute(() -> attempt(request, attemptNumber + 1, result));
            return;
        }

        ledger.fail(request.idempotencyKey(), failure.getErrorCode(), attemptNumber, clock.instant());
        ActionFailedException failed = new ActionFailedException(request.nodeId(), request.actionId(),
            failure.getErrorCode(), failure.getMessage(), failure.isTransient(), attemptNumber, failure);
        log.error("Action {} on node {} of instance {} failed: {}",
            request.actionId(), request.nodeId(), request.instanceId(), failed.getMessage());
        listener.onFailure(request, failed);
        result.completeExceptionally(failed);
    }

    // ========== Dispatch ==========

    private Map<String, JsonNode> dispatch(ActionContext context) throws ActionException {
        Action action = context.getAction();
        return switch (action.kind()) {
            case NOTIFY -> sendNotification(context.getRequest(), (Action.Notify) action);
            case ESCALATE -> sendEscalation(context.getRequest(), (Action.Escalate) action);
            case INVOKE_EXTERNAL -> invokeExternal(context.getRequest(), (Action.InvokeExternal) action);
            case CUSTOM -> runCustom(context, (Action.Custom) action);
            case SET_VARIABLE -> throw new IllegalStateException("SetVariable is applied without dispatch");
        };
    }

    private Map<String, JsonNode> sendNotification(ActionRequest request, Action.Notify notify)
            throws ActionException {
        List<String> recipients = Placeholders.resolve(notify.recipients(), request.variables(), request.initiator());
        if (recipients.isEmpty()) {
            throw ActionException.permanent("NO_RECIPIENTS",
                "Notification " + notify.template() + " resolved to no recipients");
        }
        notificationSink.send(new Notification(request.idempotencyKey(), request.instanceId(), request.nodeId(),
            notify.template(), notify.channel(), recipients, request.variables()));
        return Map.of();
    }

    private Map<String, JsonNode> sendEscalation(ActionRequest request, Action.Escalate escalate)
            throws ActionException {
        List<String> targets = Placeholders.resolve(escalate.targets(), request.variables(), request.initiator());
        if (targets.isEmpty()) {
            throw ActionException.permanent("NO_RECIPIENTS", "Escalation resolved to no targets");
        }
        notificationSink.escalate(new EscalationNotice(request.idempotencyKey(), request.instanceId(),
            request.nodeId(), targets, escalate.reason()));
        return Map.of();
    }

    private Map<String, JsonNode> invokeExternal(ActionRequest request, Action.InvokeExternal invoke)
            throws ActionException {
        JsonNode response = integrationGateway.invoke(new IntegrationRequest(request.idempotencyKey(),
            request.instanceId(), request.nodeId(), invoke.target(), invoke.operation(), invoke.parameters()));
        if (invoke.resultVariable() == null) {
            return Map.of();
        }
        return Map.of(invoke.resultVariable(), response == null ? NullNode.getInstance() : response);
    }

    private Map<String, JsonNode> runCustom(ActionContext context, Action.Custom custom) throws ActionException {
        ActionHandler handler = customHandlers.get(custom.handler());
        if (handler == null) {
            throw ActionException.permanent("UNKNOWN_HANDLER", "No action handler registered: " + custom.handler());
        }
        JsonNode output = handler.handle(context);
        if (output == null || !output.isObject()) {
            return Map.of();
        }
        Map<String, JsonNode> updates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = output.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            updates.put(field.getKey(), field.getValue());
        }
        return updates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ActionLedger ledger = new InMemoryActionLedger();
        private NotificationSink notificationSink = new LoggingNotificationSink();
        private IntegrationGateway integrationGateway = IntegrationGateway.unavailable();
        private final Map<String, ActionHandler> customHandlers = new HashMap<>();
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private Executor executor = ForkJoinPool.commonPool();
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper = JsonSupport.newObjectMapper();
        private ActionListener listener = ActionListener.NO_OP;

        public Builder ledger(ActionLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder notificationSink(NotificationSink notificationSink) {
            this.notificationSink = notificationSink;
            return this;
        }

        public Builder integrationGateway(IntegrationGateway integrationGateway) {
            this.integrationGateway = integrationGateway;
            return this;
        }

        public Builder handler(String name, ActionHandler handler) {
            this.customHandlers.put(name, handler);
            return this;
        }

        public Builder handlers(Map<String, ActionHandler> handlers) {
            this.customHandlers.putAll(handlers);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder listener(ActionListener listener) {
            this.listener = listener;
            return this;
        }

        public DefaultActionExecutor build() {
            return new DefaultActionExecutor(this);
        }
    }
}
