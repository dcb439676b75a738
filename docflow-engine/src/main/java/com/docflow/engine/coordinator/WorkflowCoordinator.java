package com.docflow.engine.coordinator;

import com.docflow.action.ActionExecutor;
import com.docflow.action.ActionRequest;
import com.docflow.core.codec.JsonSupport;
import com.docflow.core.codec.WorkflowDefinitionCodec;
import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventPublisher;
import com.docflow.core.event.WorkflowEventType;
import com.docflow.core.exception.ActionFailedException;
import com.docflow.core.exception.ConcurrencyConflictException;
import com.docflow.core.exception.GuardDeniedException;
import com.docflow.core.exception.InvalidStateTransitionException;
import com.docflow.core.exception.NotFoundException;
import com.docflow.core.exception.TerminalStateViolationException;
import com.docflow.core.exception.WorkflowException;
import com.docflow.core.model.EntityReference;
import com.docflow.core.model.FailureInfo;
import com.docflow.core.model.TransitionKind;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.WorkflowTransition;
import com.docflow.core.model.action.Action;
import com.docflow.core.model.action.EscalationRule;
import com.docflow.core.model.graph.CompletionStatus;
import com.docflow.core.model.graph.Node;
import com.docflow.core.model.graph.NodeType;
import com.docflow.core.model.graph.TaskNode;
import com.docflow.core.model.graph.TimerNode;
import com.docflow.core.model.guard.Actor;
import com.docflow.core.repository.WorkflowDefinitionRepository;
import com.docflow.core.repository.WorkflowInstanceStore;
import com.docflow.core.validation.DefinitionValidator;
import com.docflow.core.validation.ValidationReport;
import com.docflow.engine.guard.ConditionEvaluator;
import com.docflow.engine.guard.DefaultGuardEvaluator;
import com.docflow.engine.guard.GuardEvaluator;
import com.docflow.engine.guard.SpelExpressionChecker;
import com.docflow.engine.logging.LoggingContext;
import com.docflow.engine.metrics.WorkflowMetrics;
import com.docflow.engine.service.WorkflowService;
import com.docflow.scheduler.EscalationScheduler;
import com.docflow.scheduler.FireOutcome;
import com.docflow.scheduler.InMemoryTimerQueue;
import com.docflow.scheduler.ScheduledTimer;
import com.docflow.scheduler.SchedulerSettings;
import com.docflow.scheduler.TimerCallback;
import com.docflow.scheduler.TimerKind;
import com.docflow.scheduler.TimerQueue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Central coordinator for workflow execution.
 * Implements the WorkflowService interface and receives due timers from its scheduler.
 *
 * Every stimulus follows the same path: load the instance and its definition, let the
 * {@link TransitionEngine} compute the outcome on a working copy, save it against the version
 * that was loaded, then re-arm timers and publish events. A save that loses the version race
 * is retried from a fresh load, unless the caller pinned the version it expects.
 */
public class WorkflowCoordinator implements WorkflowService, TimerCallback {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowInstanceStore instanceStore;
    private final WorkflowEventPublisher eventPublisher;
    private final ActionExecutor actionExecutor;
    private final GuardEvaluator guardEvaluator;
    private final EntityResolver entityResolver;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final WorkflowDefinitionCodec codec;
    private final DefinitionValidator validator;
    private final TransitionEngine engine;
    private final EscalationScheduler scheduler;
    private final SchedulerSettings schedulerSettings;
    private final int maxConflictRetries;
    private final Actor systemActor;

    private WorkflowCoordinator(Builder builder) {
        this.definitionRepository = Objects.requireNonNull(builder.definitionRepository, "definitionRepository");
        this.instanceStore = Objects.requireNonNull(builder.instanceStore, "instanceStore");
        this.actionExecutor = Objects.requireNonNull(builder.actionExecutor, "actionExecutor");
        this.eventPublisher = builder.eventPublisher;
        this.guardEvaluator = builder.guardEvaluator;
        this.entityResolver = builder.entityResolver;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.objectMapper = builder.objectMapper;
        this.codec = new WorkflowDefinitionCodec(objectMapper);
        this.validator = new DefinitionValidator(new SpelExpressionChecker(), guardEvaluator.guardNames());
        this.engine = new TransitionEngine(guardEvaluator,
            new ConditionEvaluator(guardEvaluator, objectMapper), actionExecutor, builder.historySnapshotVariables);
        this.schedulerSettings = builder.schedulerSettings;
        this.scheduler = new EscalationScheduler(builder.timerQueue, this, clock, schedulerSettings);
        this.maxConflictRetries = builder.maxConflictRetries;
        this.systemActor = builder.systemActor;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Lifecycle ==========

    /**
     * Re-arm the timers of live instances, then start the background timer poll.
     */
    public void start() {
        recoverRunningInstances();
        scheduler.start();
    }

    public void stop() {
        scheduler.stop();
    }

    public EscalationScheduler getScheduler() {
        return scheduler;
    }

    public WorkflowMetrics getMetrics() {
        return metrics;
    }

    // ========== Definitions ==========

    @Override
    public ValidationReport validateDefinition(WorkflowDefinition definition) {
        return validator.validate(definition);
    }

    @Override
    public WorkflowDefinition publishDefinition(WorkflowDefinition definition) {
        try (LoggingContext ctx = LoggingContext.forDefinition(definition.key())) {
            validateDefinition(definition).throwIfInvalid();
            WorkflowDefinition published = definition.active()
                ? definition
                : new WorkflowDefinition.Builder(definition).active(true).build();
            definitionRepository.save(published);
            log.info("Published workflow definition {} ({})", published.key(), published.id());
            return published;
        }
    }

    @Override
    public WorkflowDefinition publishDefinition(String definitionJson) {
        return publishDefinition(codec.fromJson(definitionJson));
    }

    @Override
    public WorkflowDefinition deactivateDefinition(String definitionId) {
        WorkflowDefinition deactivated = definitionRepository.deactivate(definitionId);
        log.info("Deactivated workflow definition {} ({})", deactivated.key(), definitionId);
        return deactivated;
    }

    @Override
    public Optional<WorkflowDefinition> getDefinition(String definitionId) {
        return definitionRepository.findById(definitionId);
    }

    @Override
    public Optional<WorkflowDefinition> getLatestDefinition(String name) {
        return definitionRepository.findLatest(name);
    }

    @Override
    public List<WorkflowDefinition> listDefinitionVersions(String name) {
        return definitionRepository.listVersions(name);
    }

    // ========== Commands ==========

    @Override
    public WorkflowInstance startWorkflow(StartWorkflowRequest request) {
        WorkflowDefinition definition = resolveDefinition(request);
        if (!definition.active()) {
            throw new WorkflowException("DEFINITION_INACTIVE",
                "Workflow definition " + definition.key() + " is deactivated");
        }
        if (request.entity() != null && !entityResolver.exists(request.entity())) {
            throw new NotFoundException("Entity", request.entity().toString());
        }
        String startNode = resolveStartNode(definition, request.startNode());

        Instant now = clock.instant();
        WorkflowInstance created = WorkflowInstance.create(definition, request.entity(),
            request.initiator().id(), VariableBinder.bindInitial(definition, request.variables()), now);

        try (LoggingContext ctx = LoggingContext.forInstance(created.instanceId())) {
            LoggingContext.setDefinition(definition.key());
            LoggingContext.setActor(request.initiator().id());
            log.info("Starting workflow {} for {}", definition.key(), request.entity());

            TransitionOutcome outcome = guarded(definition, startNode, () -> engine.start(new Stimulus(
                definition, created, TransitionKind.START, startNode, null, Map.of(),
                request.initiator(), "started", now)));

            instanceStore.create(created);
            metrics.instanceStarted(definition.name());
            return commit(definition, created, outcome, request.initiator(),
                WorkflowEventType.WORKFLOW_STARTED, payload("entity", String.valueOf(request.entity())));
        }
    }

    @Override
    public List<WorkflowInstance> onEntityEvent(EntityReference entity, String eventName,
                                                Map<String, JsonNode> variables, Actor actor) {
        List<WorkflowInstance> started = new ArrayList<>();
        for (WorkflowDefinition latest : definitionRepository.listLatest()) {
            Optional<WorkflowDefinition> triggered = definitionRepository.findLatest(latest.name())
                .filter(d -> d.isTriggeredBy(entity, eventName));
            if (triggered.isPresent()) {
                started.add(startWorkflow(StartWorkflowRequest.of(triggered.get().id(), entity, actor, variables)));
            }
        }
        log.info("Event {} on {} started {} workflow(s)", eventName, entity, started.size());
        return started;
    }

    @Override
    public WorkflowInstance transition(TransitionRequest request) {
        return withVersion(request.instanceId(), request.expectedVersion(), current -> {
            WorkflowDefinition definition = loadDefinition(current);
            requireRunning(current, request.triggerNode(), "transition");
            requireWaiting(current, definition, request.triggerNode(), null);
            try (LoggingContext ctx = LoggingContext.forInstance(current.instanceId(), request.triggerNode())) {
                LoggingContext.setActor(request.actor().id());
                TransitionOutcome outcome = guarded(definition, request.triggerNode(), () -> engine.depart(
                    new Stimulus(definition, current, TransitionKind.TRANSITION, request.triggerNode(),
                        request.targetNode(), request.data(), request.actor(), null, clock.instant()),
                    false));
                return commit(definition, current, outcome, request.actor(), null, null);
            }
        });
    }

    @Override
    public WorkflowInstance completeTask(CompleteTaskRequest request) {
        return withVersion(request.instanceId(), request.expectedVersion(), current -> {
            WorkflowDefinition definition = loadDefinition(current);
            requireRunning(current, request.nodeId(), "completeTask");
            requireWaiting(current, definition, request.nodeId(), NodeType.TASK);
            try (LoggingContext ctx = LoggingContext.forInstance(current.instanceId(), request.nodeId())) {
                LoggingContext.setActor(request.actor().id());
                TransitionOutcome outcome = guarded(definition, request.nodeId(), () -> engine.depart(
                    new Stimulus(definition, current, TransitionKind.TASK_COMPLETION, request.nodeId(), null,
                        request.data(), request.actor(), "task completed", clock.instant()),
                    false));
                log.info("Task {} completed by {}", request.nodeId(), request.actor().id());
                return commit(definition, current, outcome, request.actor(), WorkflowEventType.TASK_COMPLETED,
                    payload("node", request.nodeId()));
            }
        });
    }

    @Override
    public WorkflowInstance signal(UUID instanceId, String signalName, Map<String, JsonNode> data, Actor actor) {
        WorkflowInstance current = instanceStore.load(instanceId);
        WorkflowDefinition definition = loadDefinition(current);
        requireRunning(current, null, "signal");

        List<String> waiting = current.activeNodes().stream()
            .filter(id -> isWaitingForSignal(definition.graph().node(id), signalName))
            .toList();
        if (waiting.isEmpty()) {
            log.info("No timer of instance {} waits for signal {}", instanceId, signalName);
            return current;
        }

        WorkflowInstance latest = current;
        for (String nodeId : waiting) {
            latest = withVersion(instanceId, null, loaded -> {
                if (!loaded.isActive(nodeId) || loaded.status() != WorkflowStatus.RUNNING) {
                    return loaded;
                }
                try (LoggingContext ctx = LoggingContext.forInstance(instanceId, nodeId)) {
                    LoggingContext.setActor(actor.id());
                    TransitionOutcome outcome = guarded(definition, nodeId, () -> engine.depart(
                        new Stimulus(definition, loaded, TransitionKind.SIGNAL, nodeId, null,
                            data, actor, "signal:" + signalName, clock.instant()),
                        false));
                    log.info("Signal {} released timer {}", signalName, nodeId);
                    return commit(definition, loaded, outcome, actor, WorkflowEventType.SIGNAL_RECEIVED,
                        payload("signal", signalName));
                }
            });
        }
        return latest;
    }

    @Override
    public WorkflowInstance suspend(UUID instanceId, Actor actor, String reason) {
        return withVersion(instanceId, null, current -> {
            if (current.status() != WorkflowStatus.RUNNING) {
                throw new InvalidStateTransitionException(current.status(), WorkflowStatus.SUSPENDED);
            }
            WorkflowInstance suspended = current.withStatus(WorkflowStatus.SUSPENDED, clock.instant());
            instanceStore.save(suspended, current.version());
            metrics.statusChanged(WorkflowStatus.RUNNING, WorkflowStatus.SUSPENDED);
            log.info("Suspended instance {}: {}", instanceId, reason);
            publish(suspended, WorkflowEventType.WORKFLOW_SUSPENDED, suspended.activeNodes(), actor,
                payload("reason", reason));
            return suspended;
        });
    }

    @Override
    public WorkflowInstance resume(UUID instanceId, Actor actor) {
        WorkflowInstance resumed = withVersion(instanceId, null, current -> {
            if (current.status() != WorkflowStatus.SUSPENDED) {
                throw new InvalidStateTransitionException(current.status(), WorkflowStatus.RUNNING);
            }
            WorkflowInstance running = current.withStatus(WorkflowStatus.RUNNING, clock.instant());
            instanceStore.save(running, current.version());
            metrics.statusChanged(WorkflowStatus.SUSPENDED, WorkflowStatus.RUNNING);
            publish(running, WorkflowEventType.WORKFLOW_RESUMED, running.activeNodes(), actor, null);
            return running;
        });
        int released = scheduler.resume(instanceId);
        log.info("Resumed instance {}, {} deferred timer(s) released", instanceId, released);
        return resumed;
    }

    @Override
    public WorkflowInstance cancel(UUID instanceId, Actor actor, String reason) {
        return withVersion(instanceId, null, current -> {
            if (current.isTerminal()) {
                throw new InvalidStateTransitionException(current.status(), WorkflowStatus.CANCELLED);
            }
            WorkflowDefinition definition = loadDefinition(current);
            try (LoggingContext ctx = LoggingContext.forInstance(instanceId)) {
                LoggingContext.setActor(actor.id());
                runCancellationActions(definition, current, actor);

                Instant now = clock.instant();
                WorkflowInstance cancelled = current.toBuilder()
                    .status(WorkflowStatus.CANCELLED)
                    .completionStatus(CompletionStatus.CANCELLED)
                    .updatedAt(now)
                    .completedAt(now)
                    .incrementVersion()
                    .build();
                instanceStore.save(cancelled, current.version());
                scheduler.cancelForInstance(instanceId);
                metrics.instanceCancelled(definition.name(), current.status());
                log.info("Cancelled instance {} by {}: {}", instanceId, actor.id(), reason);
                publish(cancelled, WorkflowEventType.WORKFLOW_CANCELLED, current.activeNodes(), actor,
                    payload("reason", reason));
                return cancelled;
            }
        });
    }

    // ========== Queries ==========

    @Override
    public Optional<WorkflowInstance> getWorkflow(UUID instanceId) {
        return instanceStore.findById(instanceId);
    }

    @Override
    public List<WorkflowInstance> findWorkflows(WorkflowQuery query) {
        List<WorkflowInstance> candidates;
        if (query.entity() != null) {
            candidates = instanceStore.findByEntity(query.entity());
        } else if (query.definitionId() != null) {
            candidates = instanceStore.findByDefinition(query.definitionId());
        } else if (query.status() != null) {
            candidates = instanceStore.findByStatus(query.status());
        } else {
            candidates = instanceStore.findAll();
        }
        return candidates.stream()
            .filter(i -> query.status() == null || i.status() == query.status())
            .filter(i -> query.definitionId() == null || query.definitionId().equals(i.definitionId()))
            .filter(i -> query.entity() == null || query.entity().equals(i.entity()))
            .collect(Collectors.toList());
    }

    @Override
    public List<String> availableTransitions(UUID instanceId, String nodeId, Actor actor) {
        WorkflowInstance instance = instanceStore.load(instanceId);
        if (instance.status() != WorkflowStatus.RUNNING || !instance.isActive(nodeId)) {
            return List.of();
        }
        WorkflowDefinition definition = loadDefinition(instance);
        return engine.availableTargets(new Stimulus(definition, instance, TransitionKind.TRANSITION, nodeId,
            null, Map.of(), actor, null, clock.instant()));
    }

    /**
     * Instances started from any version of a definition name.
     */
    public List<WorkflowInstance> findByDefinitionName(String name) {
        return definitionRepository.listVersions(name).stream()
            .flatMap(d -> instanceStore.findByDefinition(d.id()).stream())
            .collect(Collectors.toList());
    }

    // ========== Timers ==========

    @Override
    public FireOutcome onTimerDue(ScheduledTimer timer, Duration lateBy) {
        try (LoggingContext ctx = LoggingContext.forInstance(timer.instanceId(), timer.nodeId())) {
            Optional<WorkflowInstance> found = instanceStore.findById(timer.instanceId());
            if (found.isEmpty() || !isCurrent(found.get(), timer)) {
                log.debug("Discarding {} timer for node {}: no longer current", timer.kind(), timer.nodeId());
                return FireOutcome.DISCARDED;
            }
            if (found.get().status() == WorkflowStatus.SUSPENDED) {
                return FireOutcome.DEFERRED;
            }
            if (timer.kind() == TimerKind.TIMEOUT) {
                fireTimeout(timer, lateBy);
            } else {
                fireEscalation(found.get(), timer, lateBy);
            }
            return FireOutcome.FIRED;
        }
    }

    @Override
    public void onTimerMissed(ScheduledTimer timer, Duration lateBy) {
        metrics.timerMissed(timer.kind().name());
    }

    /**
     * Rebuild the timer queue from the store after a restart.
     *
     * Every running or suspended instance gets the timeouts and escalations of its active
     * nodes re-armed from the recorded entry times. Nodes that already have timers queued are
     * left alone. An instance whose definition is gone is failed.
     *
     * @return number of instances whose timers were re-armed
     */
    public int recoverRunningInstances() {
        List<WorkflowInstance> live = new ArrayList<>(instanceStore.findByStatus(WorkflowStatus.RUNNING));
        live.addAll(instanceStore.findByStatus(WorkflowStatus.SUSPENDED));

        int recovered = 0;
        int timers = 0;
        for (WorkflowInstance instance : live) {
            try (LoggingContext ctx = LoggingContext.forInstance(instance.instanceId())) {
                Optional<WorkflowDefinition> definition = definitionRepository.findById(instance.definitionId());
                if (definition.isEmpty()) {
                    failOrphan(instance);
                    continue;
                }
                int armed = recoverTimers(definition.get(), instance);
                if (armed > 0) {
                    recovered++;
                    timers += armed;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover timers of instance {}", instance.instanceId(), e);
            }
        }
        log.info("Recovered {} timer(s) across {} of {} live instance(s)", timers, recovered, live.size());
        return recovered;
    }

    private int recoverTimers(WorkflowDefinition definition, WorkflowInstance instance) {
        int armed = 0;
        for (String nodeId : instance.activeNodes()) {
            Instant enteredAt = instance.nodeEnteredAt().get(nodeId);
            if (enteredAt == null || scheduler.hasPending(instance.instanceId(), nodeId)) {
                continue;
            }
            long armOrdinal = armOrdinal(instance, nodeId);
            Node node = definition.graph().node(nodeId);
            if (node instanceof TaskNode) {
                armed += scheduler.recoverEscalations(instance.instanceId(), nodeId,
                    ((TaskNode) node).effectiveEscalations(), enteredAt, armOrdinal).size();
            } else if (node instanceof TimerNode) {
                TimerNode timerNode = (TimerNode) node;
                if (timerNode.duration() != null) {
                    scheduler.scheduleTimeout(instance.instanceId(), nodeId, enteredAt, timerNode.duration(),
                        armOrdinal);
                    armed++;
                }
                armed += scheduler.recoverEscalations(instance.instanceId(), nodeId, timerNode.escalations(),
                    enteredAt, armOrdinal).size();
            }
        }
        return armed;
    }

    /**
     * History length right after the transition that activated the node, matching what
     * {@link #rearmTimers} used when the node was entered.
     */
    private static long armOrdinal(WorkflowInstance instance, String nodeId) {
        List<WorkflowTransition> history = instance.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            WorkflowTransition transition = history.get(i);
            if (transition.activated().contains(nodeId) || nodeId.equals(transition.toNode())) {
                return i + 1L;
            }
        }
        return history.size();
    }

    private void failOrphan(WorkflowInstance instance) {
        Instant now = clock.instant();
        WorkflowInstance failed = instance.withStatus(WorkflowStatus.FAILED, now).toBuilder()
            .failure(new FailureInfo(null, null, "DEFINITION_MISSING",
                "Workflow definition " + instance.definitionId() + " no longer exists", now))
            .build();
        instanceStore.save(failed, instance.version());
        scheduler.cancelForInstance(instance.instanceId());
        metrics.instanceFailed(instance.definitionName(), "DEFINITION_MISSING");
        log.error("Failing instance {}: definition {} no longer exists", instance.instanceId(),
            instance.definitionId());
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("errorCode", "DEFINITION_MISSING");
        publish(failed, WorkflowEventType.WORKFLOW_FAILED, failed.activeNodes(), systemActor, payload);
    }

    private boolean isCurrent(WorkflowInstance instance, ScheduledTimer timer) {
        return !instance.isTerminal()
            && instance.isActive(timer.nodeId())
            && Objects.equals(instance.nodeEnteredAt().get(timer.nodeId()), timer.anchor());
    }

    private void fireTimeout(ScheduledTimer timer, Duration lateBy) {
        withVersion(timer.instanceId(), null, current -> {
            if (!isCurrent(current, timer) || current.status() != WorkflowStatus.RUNNING) {
                return current;
            }
            WorkflowDefinition definition = loadDefinition(current);
            TransitionOutcome outcome = guarded(definition, timer.nodeId(), () -> engine.depart(
                new Stimulus(definition, current, TransitionKind.TIMER, timer.nodeId(), null, Map.of(),
                    systemActor, "timeout", clock.instant()),
                true));
            metrics.timerFired(definition.name());
            log.info("Timer {} elapsed", timer.nodeId());
            return commit(definition, current, outcome, systemActor, WorkflowEventType.TIMER_FIRED,
                timerPayload(timer, lateBy));
        });
    }

    private void fireEscalation(WorkflowInstance instance, ScheduledTimer timer, Duration lateBy) {
        WorkflowDefinition definition = loadDefinition(instance);
        EscalationRule rule = timer.rule();
        List<String> assignees = instance.assignments().getOrDefault(timer.nodeId(), List.of());

        for (Action action : rule.actionsFor(assignees)) {
            ActionRequest request = new ActionRequest(instance.instanceId(), timer.nodeId(), action,
                IdempotencyKeys.escalation(instance.instanceId(), timer.nodeId(), action.id(), timer.ruleIndex(),
                    timer.firing(), timer.armOrdinal()),
                instance.variables(), systemActor.id(), instance.initiator());
            try {
                TransitionEngine.await(actionExecutor.execute(request));
            } catch (ActionFailedException e) {
                log.error("Escalation action {} on node {} failed: {}", action.id(), timer.nodeId(), e.getMessage());
                ObjectNode failure = timerPayload(timer, lateBy);
                failure.put("rule", timer.ruleIndex());
                failure.put("firing", timer.firing());
                failure.put("action", action.id());
                failure.put("errorCode", e.getCauseCode());
                failure.put("message", e.getMessage());
                publishEvent(WorkflowEvent.create(instance.instanceId(), WorkflowEventType.ESCALATION_FAILED,
                    clock.instant(), List.of(timer.nodeId()), systemActor.id(), failure,
                    IdempotencyKeys.escalationFailure(instance.instanceId(), timer.nodeId(), action.id(),
                        timer.ruleIndex(), timer.firing(), timer.armOrdinal())));
            }
        }

        metrics.escalationFired(definition.name(), timer.nodeId());
        log.info("Escalated node {} (rule {}, firing {})", timer.nodeId(), timer.ruleIndex(), timer.firing());

        ObjectNode payload = timerPayload(timer, lateBy);
        payload.put("rule", timer.ruleIndex());
        payload.put("firing", timer.firing());
        payload.putPOJO("targets", rule.targets().isEmpty() ? assignees : rule.targets());
        publishEvent(WorkflowEvent.create(instance.instanceId(), WorkflowEventType.WORKFLOW_ESCALATED,
            clock.instant(), List.of(timer.nodeId()), systemActor.id(), payload,
            IdempotencyKeys.escalationEvent(instance.instanceId(), timer.nodeId(), timer.ruleIndex(),
                timer.firing(), timer.armOrdinal())));
    }

    private ObjectNode timerPayload(ScheduledTimer timer, Duration lateBy) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("node", timer.nodeId());
        payload.put("dueAt", timer.fireAt().toString());
        if (lateBy.compareTo(schedulerSettings.missThreshold()) > 0) {
            payload.put("lateBy", lateBy.toString());
        }
        return payload;
    }

    // ========== Commit ==========

    /**
     * Save an outcome against the version it was computed from, then re-arm timers and
     * publish events. Timers and events only follow a successful save.
     */
    private WorkflowInstance commit(WorkflowDefinition definition, WorkflowInstance current,
                                    TransitionOutcome outcome, Actor actor,
                                    WorkflowEventType stimulusEvent, JsonNode stimulusPayload) {
        WorkflowInstance updated = outcome.instance();
        try {
            instanceStore.save(updated, current.version());
        } catch (ConcurrencyConflictException e) {
            metrics.versionConflict(definition.name());
            throw e;
        }

        rearmTimers(definition, updated, outcome);

        if (stimulusEvent != null) {
            publish(updated, stimulusEvent, outcome.entered(), actor, stimulusPayload);
        }
        if (outcome.transition() != null) {
            metrics.transitionApplied(definition.name(), outcome.transition().kind().name());
            log.info("Transition {} -> {} applied (version {})", outcome.transition().fromNode(),
                outcome.transition().toNode(), updated.version());
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("from", outcome.transition().fromNode());
            payload.put("to", outcome.transition().toNode());
            payload.put("kind", outcome.transition().kind().name());
            publish(updated, WorkflowEventType.WORKFLOW_TRANSITIONED, outcome.transition().activated(), actor,
                payload);
        }

        if (updated.status() == WorkflowStatus.COMPLETED) {
            metrics.instanceCompleted(definition.name(), Duration.between(updated.createdAt(), updated.updatedAt()));
            log.info("Workflow {} completed with {}", updated.instanceId(), updated.completionStatus());
            publish(updated, WorkflowEventType.WORKFLOW_COMPLETED, updated.activeNodes(), actor,
                payload("completionStatus", String.valueOf(updated.completionStatus())));
        } else if (outcome.failed()) {
            metrics.instanceFailed(definition.name(), outcome.failure().errorCode());
            log.error("Workflow {} failed on node {}: {}", updated.instanceId(), outcome.failure().nodeId(),
                outcome.failure().message());
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("action", outcome.failure().actionId());
            payload.put("errorCode", outcome.failure().errorCode());
            publish(updated, WorkflowEventType.WORKFLOW_FAILED, List.of(outcome.failure().nodeId()), actor, payload);
        }
        return updated;
    }

    private void rearmTimers(WorkflowDefinition definition, WorkflowInstance updated, TransitionOutcome outcome) {
        if (updated.isTerminal()) {
            scheduler.cancelForInstance(updated.instanceId());
            return;
        }
        outcome.left().forEach(nodeId -> scheduler.cancelForNode(updated.instanceId(), nodeId));

        long armOrdinal = updated.history().size();
        for (String nodeId : outcome.entered()) {
            Instant enteredAt = updated.nodeEnteredAt().get(nodeId);
            if (!updated.isActive(nodeId) || enteredAt == null) {
                continue;
            }
            Node node = definition.graph().node(nodeId);
            if (node instanceof TaskNode) {
                scheduler.scheduleEscalations(updated.instanceId(), nodeId,
                    ((TaskNode) node).effectiveEscalations(), enteredAt, armOrdinal);
            } else if (node instanceof TimerNode) {
                TimerNode timerNode = (TimerNode) node;
                if (timerNode.duration() != null) {
                    scheduler.scheduleTimeout(updated.instanceId(), nodeId, enteredAt, timerNode.duration(),
                        armOrdinal);
                }
                scheduler.scheduleEscalations(updated.instanceId(), nodeId, timerNode.escalations(), enteredAt,
                    armOrdinal);
            }
        }
    }

    private void runCancellationActions(WorkflowDefinition definition, WorkflowInstance current, Actor actor) {
        String ordinal = String.valueOf(current.history().size());
        for (String nodeId : current.activeNodes()) {
            for (Action action : definition.cancellationActions()) {
                ActionRequest request = new ActionRequest(current.instanceId(), nodeId, action,
                    IdempotencyKeys.action(current.instanceId(), nodeId, action.id(), IdempotencyKeys.CANCEL, ordinal),
                    current.variables(), actor.id(), current.initiator());
                try {
                    TransitionEngine.await(actionExecutor.execute(request));
                } catch (ActionFailedException e) {
                    log.warn("Cancellation action {} on node {} failed: {}", action.id(), nodeId, e.getMessage());
                }
            }
        }
    }

    // ========== Events ==========

    private void publish(WorkflowInstance instance, WorkflowEventType type, List<String> nodeIds, Actor actor,
                         JsonNode payload) {
        publishEvent(WorkflowEvent.create(instance.instanceId(), type, instance.updatedAt(), nodeIds, actor.id(),
            payload, IdempotencyKeys.event(instance.instanceId(), instance.version(), type.name())));
    }

    private void publishEvent(WorkflowEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for instance {}: {}", event.type(), event.instanceId(), e.getMessage());
        }
    }

    private ObjectNode payload(String field, String value) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put(field, value);
        return payload;
    }

    // ========== Helpers ==========

    /**
     * Run an attempt against the stored instance. With an expected version the attempt runs
     * once and a stale or lost version is the caller's conflict; without one, lost races are
     * retried from a fresh load.
     */
    private WorkflowInstance withVersion(UUID instanceId, Long expectedVersion,
                                         Function<WorkflowInstance, WorkflowInstance> attempt) {
        int conflicts = 0;
        while (true) {
            WorkflowInstance current = instanceStore.load(instanceId);
            if (expectedVersion != null && current.version() != expectedVersion) {
                throw new ConcurrencyConflictException(instanceId, expectedVersion, current.version());
            }
            try {
                return attempt.apply(current);
            } catch (ConcurrencyConflictException e) {
                conflicts++;
                if (expectedVersion != null || conflicts >= maxConflictRetries) {
                    throw e;
                }
                log.debug("Version conflict on instance {} ({}), retrying", instanceId, e.getMessage());
            }
        }
    }

    private TransitionOutcome guarded(WorkflowDefinition definition, String nodeId,
                                      Supplier<TransitionOutcome> walk) {
        try {
            return walk.get();
        } catch (GuardDeniedException e) {
            metrics.guardDenied(definition.name(), e.getNodeId());
            log.warn("Transition from {} rejected: {}", nodeId, e.getMessage());
            throw e;
        }
    }

    private WorkflowDefinition resolveDefinition(StartWorkflowRequest request) {
        if (request.definitionId() != null) {
            return definitionRepository.findById(request.definitionId())
                .orElseThrow(() -> new NotFoundException("WorkflowDefinition", request.definitionId()));
        }
        return definitionRepository.findLatest(request.definitionName())
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", request.definitionName()));
    }

    private static String resolveStartNode(WorkflowDefinition definition, String requested) {
        if (requested == null) {
            return definition.graph().startNodeIds().stream().findFirst()
                .orElseThrow(() -> new WorkflowException("NO_START_NODE", definition.key() + " has no start node"));
        }
        if (!definition.graph().startNodeIds().contains(requested)) {
            throw new WorkflowException("NO_START_NODE",
                requested + " is not a start node of " + definition.key());
        }
        return requested;
    }

    private WorkflowDefinition loadDefinition(WorkflowInstance instance) {
        return definitionRepository.findById(instance.definitionId())
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", instance.definitionId()));
    }

    private void requireRunning(WorkflowInstance instance, String nodeId, String operation) {
        if (instance.isTerminal()) {
            throw new TerminalStateViolationException(instance.instanceId(), nodeId,
                "instance is " + instance.status());
        }
        if (instance.status() != WorkflowStatus.RUNNING) {
            throw new InvalidStateTransitionException(instance.status(), operation);
        }
    }

    /**
     * The node must be active and be a node a branch can wait on.
     */
    private void requireWaiting(WorkflowInstance instance, WorkflowDefinition definition, String nodeId,
                                NodeType requiredType) {
        if (!instance.isActive(nodeId)) {
            throw new TerminalStateViolationException(instance.instanceId(), nodeId, "node is not active");
        }
        NodeType type = definition.graph().node(nodeId).nodeType();
        if (type == NodeType.JOIN) {
            throw new TerminalStateViolationException(instance.instanceId(), nodeId, "join is waiting for branches");
        }
        if (type == NodeType.END) {
            throw new TerminalStateViolationException(instance.instanceId(), nodeId, "branch has ended");
        }
        if (requiredType != null && type != requiredType) {
            throw new TerminalStateViolationException(instance.instanceId(), nodeId,
                "node is a " + type + ", not a " + requiredType);
        }
    }

    private static boolean isWaitingForSignal(Node node, String signalName) {
        return node instanceof TimerNode && signalName.equals(((TimerNode) node).signalName());
    }

    // ========== Builder ==========

    public static class Builder {
        private WorkflowDefinitionRepository definitionRepository;
        private WorkflowInstanceStore instanceStore;
        private ActionExecutor actionExecutor;
        private WorkflowEventPublisher eventPublisher = WorkflowEventPublisher.NO_OP;
        private GuardEvaluator guardEvaluator = new DefaultGuardEvaluator();
        private EntityResolver entityResolver = EntityResolver.ACCEPT_ALL;
        private WorkflowMetrics metrics = new WorkflowMetrics();
        private TimerQueue timerQueue = new InMemoryTimerQueue();
        private SchedulerSettings schedulerSettings = SchedulerSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper = JsonSupport.newObjectMapper();
        private int maxConflictRetries = 3;
        private int historySnapshotVariables = 16;
        private Actor systemActor = Actor.system();

        public Builder definitionRepository(WorkflowDefinitionRepository definitionRepository) {
            this.definitionRepository = definitionRepository;
            return this;
        }

        public Builder instanceStore(WorkflowInstanceStore instanceStore) {
            this.instanceStore = instanceStore;
            return this;
        }

        public Builder actionExecutor(ActionExecutor actionExecutor) {
            this.actionExecutor = actionExecutor;
            return this;
        }

        public Builder eventPublisher(WorkflowEventPublisher eventPublisher) {
            this.eventPublisher = eventPublisher;
            return this;
        }

        public Builder guardEvaluator(GuardEvaluator guardEvaluator) {
            this.guardEvaluator = guardEvaluator;
            return this;
        }

        public Builder entityResolver(EntityResolver entityResolver) {
            this.entityResolver = entityResolver;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder timerQueue(TimerQueue timerQueue) {
            this.timerQueue = timerQueue;
            return this;
        }

        public Builder schedulerSettings(SchedulerSettings schedulerSettings) {
            this.schedulerSettings = schedulerSettings;
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

        public Builder maxConflictRetries(int maxConflictRetries) {
            this.maxConflictRetries = Math.max(1, maxConflictRetries);
            return this;
        }

        public Builder historySnapshotVariables(int historySnapshotVariables) {
            this.historySnapshotVariables = Math.max(0, historySnapshotVariables);
            return this;
        }

        /**
         * Actor recorded for timeouts and escalations.
         */
        public Builder systemActor(Actor systemActor) {
            this.systemActor = systemActor;
            return this;
        }

        public WorkflowCoordinator build() {
            return new WorkflowCoordinator(this);
        }
    }
}
