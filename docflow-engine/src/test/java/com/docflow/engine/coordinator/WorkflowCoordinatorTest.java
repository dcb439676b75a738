package com.docflow.engine.coordinator;

import com.docflow.action.ActionException;
import com.docflow.core.codec.WorkflowDefinitionCodec;
import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventType;
import com.docflow.core.exception.ConcurrencyConflictException;
import com.docflow.core.exception.GuardDeniedException;
import com.docflow.core.exception.InvalidStateTransitionException;
import com.docflow.core.exception.InvalidVariablesException;
import com.docflow.core.exception.NotFoundException;
import com.docflow.core.exception.TerminalStateViolationException;
import com.docflow.core.exception.WorkflowDefinitionException;
import com.docflow.core.exception.WorkflowException;
import com.docflow.core.model.EntityReference;
import com.docflow.core.model.TransitionKind;
import com.docflow.core.model.VariableDefinition;
import com.docflow.core.model.VariableType;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.WorkflowTransition;
import com.docflow.core.model.action.Action;
import com.docflow.core.model.action.EscalationRule;
import com.docflow.core.model.graph.AssigneeRule;
import com.docflow.core.model.graph.CompletionStatus;
import com.docflow.core.model.graph.EndNode;
import com.docflow.core.model.graph.StartNode;
import com.docflow.core.model.graph.TaskNode;
import com.docflow.core.model.graph.WorkflowGraph;
import com.docflow.core.model.guard.Actor;
import com.docflow.core.model.guard.Guard;
import com.docflow.core.test.SampleDefinitions;
import com.docflow.engine.metrics.WorkflowMetrics;
import com.docflow.engine.service.WorkflowService.CompleteTaskRequest;
import com.docflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.docflow.engine.service.WorkflowService.TransitionRequest;
import com.docflow.engine.service.WorkflowService.WorkflowQuery;
import com.docflow.engine.test.EngineFixture;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class WorkflowCoordinatorTest {

    private static final Actor BOB = Actor.of("bob");
    private static final Actor ALICE = Actor.withRoles("alice", "reviewer");
    private static final EntityReference DOC = EntityReference.document("doc-42");

    private EngineFixture fixture;
    private WorkflowCoordinator coordinator;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        coordinator = fixture.coordinator();
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
    }

    private WorkflowInstance start(WorkflowDefinition definition, Actor initiator) {
        WorkflowDefinition published = coordinator.publishDefinition(definition);
        return coordinator.startWorkflow(StartWorkflowRequest.of(published.id(), DOC, initiator, Map.of()));
    }

    private WorkflowInstance complete(WorkflowInstance instance, String nodeId, Actor actor,
                                      Map<String, JsonNode> data) {
        return coordinator.completeTask(CompleteTaskRequest.of(instance.instanceId(), nodeId, data, actor));
    }

    private List<WorkflowEventType> eventTypes(UUID instanceId) {
        return fixture.events.findByInstance(instanceId).stream().map(WorkflowEvent::type).toList();
    }

    // ========== Review workflow ==========

    @Nested
    @DisplayName("Document review")
    class Review {

        @Test
        @DisplayName("Start enters the draft task and assigns it to the initiator")
        void start_shouldEnterFirstTask() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            assertThat(instance.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(instance.activeNodes()).containsExactly("draft");
            assertThat(instance.assignments()).containsEntry("draft", List.of("bob"));
            assertThat(instance.version()).isEqualTo(1);
            assertThat(instance.history()).hasSize(1);
            assertThat(instance.history().get(0).kind()).isEqualTo(TransitionKind.START);
            assertThat(fixture.instances.load(instance.instanceId())).isEqualTo(instance);
            assertThat(eventTypes(instance.instanceId()))
                .containsExactly(WorkflowEventType.WORKFLOW_STARTED, WorkflowEventType.WORKFLOW_TRANSITIONED);
        }

        @Test
        @DisplayName("Approval passes through the decision and completes the workflow")
        void approve_shouldComplete() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            instance = complete(instance, "draft", BOB, Map.of());
            assertThat(instance.activeNodes()).containsExactly("review");
            assertThat(instance.assignments()).containsEntry("review", List.of("alice"));

            instance = complete(instance, "review", ALICE, Map.of("decision", TextNode.valueOf("approve")));

            assertThat(instance.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(instance.completionStatus()).isEqualTo(CompletionStatus.SUCCESS);
            assertThat(instance.completedAt()).isEqualTo(fixture.clock.instant());
            assertThat(instance.activeNodes()).containsExactly("done");
            assertThat(instance.history()).hasSize(3);

            WorkflowTransition last = instance.history().get(2);
            assertThat(last.fromNode()).isEqualTo("review");
            assertThat(last.via()).containsExactly("decide");
            assertThat(last.toNode()).isEqualTo("done");
            assertThat(last.actor()).isEqualTo("alice");
            assertThat(last.snapshot()).containsEntry("decision", TextNode.valueOf("approve"));

            assertThat(eventTypes(instance.instanceId())).containsExactly(
                WorkflowEventType.WORKFLOW_STARTED, WorkflowEventType.WORKFLOW_TRANSITIONED,
                WorkflowEventType.TASK_COMPLETED, WorkflowEventType.WORKFLOW_TRANSITIONED,
                WorkflowEventType.TASK_COMPLETED, WorkflowEventType.WORKFLOW_TRANSITIONED,
                WorkflowEventType.WORKFLOW_COMPLETED);
            assertThat(fixture.counter(WorkflowMetrics.INSTANCES_COMPLETED, "definition", "document-review"))
                .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Rejection routes back to draft")
        void reject_shouldReturnToDraft() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);
            instance = complete(instance, "draft", BOB, Map.of());

            instance = complete(instance, "review", ALICE, Map.of("decision", TextNode.valueOf("reject")));

            assertThat(instance.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(instance.activeNodes()).containsExactly("draft");
            assertThat(instance.variable("decision").asText()).isEqualTo("reject");
            assertThat(instance.history()).hasSize(3);
        }

        @Test
        @DisplayName("No decision routes through the default edge back to review")
        void noDecision_shouldTakeDefaultEdge() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);
            instance = complete(instance, "draft", BOB, Map.of());

            instance = complete(instance, "review", ALICE, Map.of());

            assertThat(instance.activeNodes()).containsExactly("review");
            assertThat(instance.history().get(2).via()).containsExactly("decide");
        }

        @Test
        @DisplayName("Explicit transition follows the edge to the requested target")
        void transition_shouldFollowRequestedEdge() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            WorkflowInstance moved = coordinator.transition(new TransitionRequest(
                instance.instanceId(), instance.version(), "draft", "review", Map.of(), BOB));

            assertThat(moved.activeNodes()).containsExactly("review");
            assertThat(moved.history().get(1).kind()).isEqualTo(TransitionKind.TRANSITION);
        }

        @Test
        @DisplayName("Transition to a node with no connecting edge is rejected")
        void transition_shouldRejectUnknownTarget() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            assertThatThrownBy(() -> coordinator.transition(new TransitionRequest(
                instance.instanceId(), instance.version(), "draft", "done", Map.of(), BOB)))
                .isInstanceOf(GuardDeniedException.class)
                .hasMessageContaining("No edge from draft to done");

            assertThat(fixture.instances.load(instance.instanceId())).isEqualTo(instance);
        }

        @Test
        @DisplayName("Stale expected version is a conflict and changes nothing")
        void transition_shouldRejectStaleVersion() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);
            complete(instance, "draft", BOB, Map.of());

            assertThatThrownBy(() -> coordinator.transition(new TransitionRequest(
                instance.instanceId(), instance.version(), "review", null, Map.of(), ALICE)))
                .isInstanceOf(ConcurrencyConflictException.class);

            WorkflowInstance stored = fixture.instances.load(instance.instanceId());
            assertThat(stored.version()).isEqualTo(2);
            assertThat(stored.activeNodes()).containsExactly("review");
        }

        @Test
        @DisplayName("Completing a node that is not active is a terminal state violation")
        void completeTask_shouldRejectInactiveNode() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            assertThatThrownBy(() -> complete(instance, "review", ALICE, Map.of()))
                .isInstanceOf(TerminalStateViolationException.class);
        }

        @Test
        @DisplayName("Data of the wrong type is rejected before anything runs")
        void completeTask_shouldRejectMistypedData() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);
            complete(instance, "draft", BOB, Map.of());

            assertThatThrownBy(() -> complete(instance, "review", ALICE, Map.of("decision", IntNode.valueOf(3))))
                .isInstanceOf(InvalidVariablesException.class);
        }

        @Test
        @DisplayName("Available transitions lists eligible targets of an active node")
        void availableTransitions_shouldListTargets() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            assertThat(coordinator.availableTransitions(instance.instanceId(), "draft", BOB))
                .containsExactly("review");
            assertThat(coordinator.availableTransitions(instance.instanceId(), "review", BOB)).isEmpty();
        }
    }

    // ========== Parallel ==========

    @Nested
    @DisplayName("Parallel branches")
    class Parallel {

        @Test
        @DisplayName("Fan-out activates every branch in one transition")
        void start_shouldActivateAllBranches() {
            WorkflowInstance instance = start(SampleDefinitions.parallelWorkflow(), BOB);

            assertThat(instance.activeNodes()).containsExactlyInAnyOrder("legal", "finance");
            WorkflowTransition fanOut = instance.history().get(0);
            assertThat(fanOut.toNode()).isEqualTo("split");
            assertThat(fanOut.activated()).containsExactlyInAnyOrder("legal", "finance");
            assertThat(instance.assignments()).containsEntry("legal", List.of("role:legal"));
        }

        @Test
        @DisplayName("Join waits for both branches, legal first")
        void join_shouldWaitLegalFirst() {
            assertJoinCompletes("legal", "finance");
        }

        @Test
        @DisplayName("Join waits for both branches, finance first")
        void join_shouldWaitFinanceFirst() {
            assertJoinCompletes("finance", "legal");
        }

        private void assertJoinCompletes(String first, String second) {
            WorkflowInstance instance = start(SampleDefinitions.parallelWorkflow(), BOB);

            instance = complete(instance, first, BOB, Map.of());
            assertThat(instance.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(instance.activeNodes()).containsExactlyInAnyOrder(second, "join");
            WorkflowTransition partial = instance.history().get(1);
            assertThat(partial.toNode()).isEqualTo("join");
            assertThat(partial.activated()).isEmpty();

            instance = complete(instance, second, BOB, Map.of());
            assertThat(instance.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(instance.activeNodes()).containsExactly("done");
            assertThat(instance.history().get(2).via()).containsExactly("join");
        }

        @Test
        @DisplayName("A two-of-three join releases on the second arrival and retires the open branch")
        void quorumJoin_shouldRetireOpenBranch() {
            WorkflowInstance instance = start(SampleDefinitions.quorumWorkflow(), BOB);
            assertThat(instance.activeNodes()).containsExactlyInAnyOrder("legal", "finance", "audit");
            assertThat(coordinator.getScheduler().pending(instance.instanceId())).isNotEmpty();

            instance = complete(instance, "legal", BOB, Map.of());
            assertThat(instance.activeNodes()).containsExactlyInAnyOrder("finance", "audit", "join");

            instance = complete(instance, "finance", BOB, Map.of());

            assertThat(instance.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(instance.activeNodes()).containsExactly("done");
            assertThat(instance.assignments()).doesNotContainKey("audit");
            assertThat(instance.slaDeadlines()).doesNotContainKey("audit");
            assertThat(instance.history().get(2).via()).containsExactly("join");
            assertThat(coordinator.getScheduler().pending(instance.instanceId())).isEmpty();
        }

        @Test
        @DisplayName("A two-of-three join releases whichever two branches arrive first")
        void quorumJoin_shouldReleaseInAnyOrder() {
            WorkflowInstance instance = start(SampleDefinitions.quorumWorkflow(), BOB);

            instance = complete(instance, "audit", BOB, Map.of());
            instance = complete(instance, "legal", BOB, Map.of());

            assertThat(instance.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(instance.activeNodes()).containsExactly("done");
            WorkflowInstance finished = instance;
            assertThatThrownBy(() -> complete(finished, "finance", BOB, Map.of()))
                .isInstanceOf(TerminalStateViolationException.class);
        }

        @Test
        @DisplayName("A pending join cannot be completed like a task")
        void completeTask_shouldRejectPendingJoin() {
            WorkflowInstance instance = start(SampleDefinitions.parallelWorkflow(), BOB);
            WorkflowInstance waiting = complete(instance, "legal", BOB, Map.of());

            assertThatThrownBy(() -> complete(waiting, "join", BOB, Map.of()))
                .isInstanceOf(TerminalStateViolationException.class);
        }
    }

    // ========== Guards ==========

    @Nested
    @DisplayName("Guards")
    class Guards {

        private WorkflowDefinition guarded() {
            WorkflowGraph graph = WorkflowGraph.builder()
                .node(StartNode.of("start"))
                .node(TaskNode.builder("draft").assignees(AssigneeRule.initiator()).build())
                .node(TaskNode.builder("approve")
                    .assignees(AssigneeRule.role("manager"))
                    .guard(Guard.role("manager"))
                    .build())
                .node(EndNode.of("done"))
                .edge("start-draft", "start", "draft")
                .edge("draft-approve", "draft", "approve")
                .edge("approve-done", "approve", "done")
                .build();
            return WorkflowDefinition.builder().name("guarded-approval").graph(graph).build();
        }

        @Test
        @DisplayName("Denied guard leaves the instance untouched and is counted")
        void deniedGuard_shouldLeaveInstanceUnchanged() {
            WorkflowInstance instance = start(guarded(), BOB);

            assertThatThrownBy(() -> complete(instance, "draft", BOB, Map.of()))
                .isInstanceOf(GuardDeniedException.class)
                .satisfies(e -> assertThat(((GuardDeniedException) e).getNodeId()).isEqualTo("approve"));

            WorkflowInstance stored = fixture.instances.load(instance.instanceId());
            assertThat(stored).isEqualTo(instance);
            assertThat(eventTypes(instance.instanceId())).hasSize(2);
            assertThat(fixture.counter(WorkflowMetrics.GUARD_DENIALS, "node", "approve")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Actor with the role passes the guard")
        void allowedGuard_shouldTransition() {
            WorkflowInstance instance = start(guarded(), BOB);

            WorkflowInstance moved = complete(instance, "draft", Actor.withRoles("carol", "manager"), Map.of());

            assertThat(moved.activeNodes()).containsExactly("approve");
            assertThat(coordinator.availableTransitions(moved.instanceId(), "approve", BOB))
                .containsExactly("done");
        }

        @Test
        @DisplayName("Available transitions hides targets the actor may not enter")
        void availableTransitions_shouldRespectGuards() {
            WorkflowInstance instance = start(guarded(), BOB);

            assertThat(coordinator.availableTransitions(instance.instanceId(), "draft", BOB)).isEmpty();
            assertThat(coordinator.availableTransitions(instance.instanceId(), "draft",
                Actor.withRoles("carol", "manager"))).containsExactly("approve");
        }
    }

    // ========== Actions ==========

    @Nested
    @DisplayName("Action failures")
    class ActionFailures {

        private WorkflowDefinition archiving(boolean withErrorEdge) {
            TaskNode.Builder archive = TaskNode.builder("archive")
                .onEntry(Action.invoke("archive-doc", "dms", "archive"));
            WorkflowGraph.Builder graph = WorkflowGraph.builder()
                .node(StartNode.of("start"))
                .node(TaskNode.builder("draft").assignees(AssigneeRule.initiator()).build())
                .node(EndNode.of("done"))
                .edge("start-draft", "start", "draft")
                .edge("draft-archive", "draft", "archive")
                .edge("archive-done", "archive", "done");
            if (withErrorEdge) {
                archive.errorEdge("archive-error");
                graph.node(TaskNode.builder("fix").assignees(AssigneeRule.users("ops")).build())
                    .edge("archive-error", "archive", "fix")
                    .edge("fix-done", "fix", "done");
            }
            graph.node(archive.build());
            return WorkflowDefinition.builder().name("archiving").graph(graph.build()).build();
        }

        @BeforeEach
        void failingGateway() {
            fixture.gateway(request -> {
                throw ActionException.permanent("DMS_DOWN", "archive unavailable");
            });
            coordinator = fixture.coordinator();
        }

        @Test
        @DisplayName("Fatal failure with no error edge fails the instance")
        void fatalFailure_shouldFailInstance() {
            WorkflowInstance instance = start(archiving(false), BOB);

            WorkflowInstance failed = complete(instance, "draft", BOB, Map.of());

            assertThat(failed.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(failed.failure().actionId()).isEqualTo("archive-doc");
            assertThat(failed.failure().nodeId()).isEqualTo("archive");
            assertThat(failed.history()).hasSize(1);
            assertThat(fixture.instances.load(failed.instanceId()).status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(eventTypes(failed.instanceId())).contains(WorkflowEventType.WORKFLOW_FAILED);
        }

        @Test
        @DisplayName("Failure on a node with an error edge routes along it")
        void failureWithErrorEdge_shouldRoute() {
            WorkflowInstance instance = start(archiving(true), BOB);

            WorkflowInstance routed = complete(instance, "draft", BOB, Map.of());

            assertThat(routed.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(routed.activeNodes()).containsExactly("fix");
            WorkflowTransition transition = routed.history().get(1);
            assertThat(transition.kind()).isEqualTo(TransitionKind.ERROR_ROUTE);
            assertThat(transition.reason()).contains("DMS_DOWN");
        }

        @Test
        @DisplayName("Failed instance rejects further stimuli")
        void failedInstance_shouldRejectCommands() {
            WorkflowInstance failed = complete(start(archiving(false), BOB), "draft", BOB, Map.of());

            assertThatThrownBy(() -> complete(failed, "draft", BOB, Map.of()))
                .isInstanceOf(TerminalStateViolationException.class);
        }
    }

    // ========== Lifecycle ==========

    @Nested
    @DisplayName("Lifecycle commands")
    class Lifecycle {

        @Test
        @DisplayName("Cancel runs cancellation actions and ends the instance")
        void cancel_shouldNotifyAndEnd() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            WorkflowInstance cancelled = coordinator.cancel(instance.instanceId(), Actor.system(), "withdrawn");

            assertThat(cancelled.status()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(cancelled.completionStatus()).isEqualTo(CompletionStatus.CANCELLED);
            assertThat(fixture.sink.sent).hasSize(1);
            assertThat(fixture.sink.sent.get(0).recipients()).containsExactly("bob");
            assertThat(eventTypes(instance.instanceId())).last().isEqualTo(WorkflowEventType.WORKFLOW_CANCELLED);

            assertThatThrownBy(() -> complete(cancelled, "draft", BOB, Map.of()))
                .isInstanceOf(TerminalStateViolationException.class);
            assertThatThrownBy(() -> coordinator.cancel(instance.instanceId(), Actor.system(), "again"))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Suspended instance rejects transitions until resumed")
        void suspend_shouldBlockUntilResume() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            WorkflowInstance suspended = coordinator.suspend(instance.instanceId(), Actor.system(), "audit");
            assertThat(suspended.status()).isEqualTo(WorkflowStatus.SUSPENDED);
            assertThatThrownBy(() -> complete(suspended, "draft", BOB, Map.of()))
                .isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> coordinator.suspend(instance.instanceId(), Actor.system(), "twice"))
                .isInstanceOf(InvalidStateTransitionException.class);

            WorkflowInstance resumed = coordinator.resume(instance.instanceId(), Actor.system());
            assertThat(resumed.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(complete(resumed, "draft", BOB, Map.of()).activeNodes()).containsExactly("review");
        }

        @Test
        @DisplayName("Resuming a running instance is rejected")
        void resume_shouldRejectRunningInstance() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(), BOB);

            assertThatThrownBy(() -> coordinator.resume(instance.instanceId(), Actor.system()))
                .isInstanceOf(InvalidStateTransitionException.class);
        }
    }

    // ========== Timers ==========

    @Nested
    @DisplayName("Timers and escalations")
    class Timers {

        @Test
        @DisplayName("Elapsed timer runs its timeout actions and moves on")
        void timeout_shouldRunActionsAndAdvance() {
            WorkflowInstance instance = start(SampleDefinitions.timerWorkflow(Duration.ofHours(1), null), BOB);
            assertThat(instance.activeNodes()).containsExactly("wait");
            assertThat(coordinator.getScheduler().pending(instance.instanceId())).hasSize(1);

            fixture.clock.advanceMinutes(59);
            assertThat(coordinator.getScheduler().pollDue()).isZero();

            fixture.clock.advanceMinutes(1);
            assertThat(coordinator.getScheduler().pollDue()).isEqualTo(1);

            WorkflowInstance done = fixture.instances.load(instance.instanceId());
            assertThat(done.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(done.variable("timedOut").asBoolean()).isTrue();
            assertThat(done.history().get(1).kind()).isEqualTo(TransitionKind.TIMER);
            assertThat(eventTypes(instance.instanceId())).contains(WorkflowEventType.TIMER_FIRED);
        }

        @Test
        @DisplayName("Signal releases a waiting timer without its timeout actions")
        void signal_shouldReleaseTimer() {
            WorkflowInstance instance = start(
                SampleDefinitions.timerWorkflow(Duration.ofDays(7), "documents-received"), BOB);

            WorkflowInstance released = coordinator.signal(instance.instanceId(), "documents-received",
                Map.of("status", TextNode.valueOf("received")), BOB);

            assertThat(released.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(released.variable("status").asText()).isEqualTo("received");
            assertThat(released.variables()).doesNotContainKey("timedOut");
            assertThat(released.history().get(1).kind()).isEqualTo(TransitionKind.SIGNAL);
            assertThat(coordinator.getScheduler().pending(instance.instanceId())).isEmpty();
        }

        @Test
        @DisplayName("Unknown signal leaves the instance as it is")
        void unknownSignal_shouldBeIgnored() {
            WorkflowInstance instance = start(
                SampleDefinitions.timerWorkflow(Duration.ofDays(7), "documents-received"), BOB);

            WorkflowInstance same = coordinator.signal(instance.instanceId(), "other", Map.of(), BOB);

            assertThat(same).isEqualTo(instance);
        }

        @Test
        @DisplayName("SLA breach escalates to the assignees once")
        void sla_shouldEscalateToAssignees() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(Duration.ofHours(4)), BOB);
            complete(instance, "draft", BOB, Map.of());

            fixture.clock.advance(Duration.ofHours(4));
            coordinator.getScheduler().pollDue();
            fixture.clock.advance(Duration.ofHours(4));
            coordinator.getScheduler().pollDue();

            assertThat(fixture.sink.escalations).hasSize(1);
            assertThat(fixture.sink.escalations.get(0).targets()).containsExactly("alice");
            assertThat(eventTypes(instance.instanceId())).contains(WorkflowEventType.WORKFLOW_ESCALATED);
            assertThat(fixture.counter(WorkflowMetrics.ESCALATIONS, "node", "review")).isEqualTo(1.0);
            assertThat(fixture.instances.load(instance.instanceId()).activeNodes()).containsExactly("review");
        }

        @Test
        @DisplayName("A failing escalation action is recorded in the event log")
        void failedEscalation_shouldBeRecorded() {
            WorkflowGraph graph = WorkflowGraph.builder()
                .node(StartNode.of("start"))
                .node(TaskNode.builder("review")
                    .assignees(AssigneeRule.users("alice"))
                    .escalation(EscalationRule.once(Duration.ofHours(1), List.of("lead"),
                        Action.invoke("open-ticket", "helpdesk", "create")))
                    .build())
                .node(EndNode.of("done"))
                .edge("start-review", "start", "review")
                .edge("review-done", "review", "done")
                .build();
            WorkflowInstance instance = start(
                WorkflowDefinition.builder().name("ticketed-review").graph(graph).build(), BOB);

            fixture.clock.advance(Duration.ofHours(1));
            coordinator.getScheduler().pollDue();

            List<WorkflowEvent> failures = fixture.events.findByInstance(instance.instanceId()).stream()
                .filter(e -> e.type() == WorkflowEventType.ESCALATION_FAILED)
                .toList();
            assertThat(failures).hasSize(1);
            assertThat(failures.get(0).nodeIds()).containsExactly("review");
            assertThat(failures.get(0).payload().get("action").asText()).isEqualTo("open-ticket");
            assertThat(failures.get(0).payload().get("errorCode").asText()).isEqualTo("NO_INTEGRATION");
            assertThat(eventTypes(instance.instanceId())).contains(WorkflowEventType.WORKFLOW_ESCALATED);
            assertThat(fixture.historyService().getHistory(instance.instanceId()).statistics().escalationFailures())
                .isEqualTo(1);
            assertThat(fixture.instances.load(instance.instanceId()).status()).isEqualTo(WorkflowStatus.RUNNING);
        }

        @Test
        @DisplayName("Leaving a node before its SLA disarms the escalation")
        void leavingNode_shouldDisarmEscalation() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(Duration.ofHours(4)), BOB);
            instance = complete(instance, "draft", BOB, Map.of());
            assertThat(coordinator.getScheduler().pending(instance.instanceId())).hasSize(1);

            complete(instance, "review", ALICE, Map.of("decision", TextNode.valueOf("approve")));

            assertThat(coordinator.getScheduler().pending(instance.instanceId())).isEmpty();
            fixture.clock.advance(Duration.ofHours(5));
            coordinator.getScheduler().pollDue();
            assertThat(fixture.sink.escalations).isEmpty();
        }

        @Test
        @DisplayName("Escalations due while suspended fire after resume")
        void suspendedEscalation_shouldBeDeferred() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(Duration.ofHours(1)), BOB);
            complete(instance, "draft", BOB, Map.of());
            coordinator.suspend(instance.instanceId(), Actor.system(), "audit");

            fixture.clock.advance(Duration.ofHours(2));
            coordinator.getScheduler().pollDue();
            assertThat(fixture.sink.escalations).isEmpty();

            coordinator.resume(instance.instanceId(), Actor.system());
            coordinator.getScheduler().pollDue();
            assertThat(fixture.sink.escalations).hasSize(1);
        }
    }

    // ========== Restart recovery ==========

    @Nested
    @DisplayName("Restart recovery")
    class Recovery {

        @Test
        @DisplayName("A restarted coordinator fires an escalation that fell due while it was down")
        void restart_shouldFireOverdueEscalation() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(Duration.ofHours(4)), BOB);
            complete(instance, "draft", BOB, Map.of());

            WorkflowCoordinator restarted = fixture.coordinator();
            fixture.clock.advance(Duration.ofHours(5));
            assertThat(restarted.getScheduler().pending(instance.instanceId())).isEmpty();

            assertThat(restarted.recoverRunningInstances()).isEqualTo(1);
            assertThat(restarted.getScheduler().pollDue()).isEqualTo(1);

            assertThat(fixture.sink.escalations).hasSize(1);
            assertThat(fixture.sink.escalations.get(0).targets()).containsExactly("alice");
            assertThat(eventTypes(instance.instanceId())).contains(WorkflowEventType.WORKFLOW_ESCALATED);
        }

        @Test
        @DisplayName("Recovering twice does not arm the same node twice")
        void recover_shouldSkipNodesWithQueuedTimers() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(Duration.ofHours(4)), BOB);
            complete(instance, "draft", BOB, Map.of());

            WorkflowCoordinator restarted = fixture.coordinator();
            restarted.recoverRunningInstances();
            assertThat(restarted.recoverRunningInstances()).isZero();
            assertThat(restarted.getScheduler().pending(instance.instanceId())).hasSize(1);

            fixture.clock.advance(Duration.ofHours(3));
            assertThat(restarted.getScheduler().pollDue()).isZero();
            fixture.clock.advance(Duration.ofHours(1));
            assertThat(restarted.getScheduler().pollDue()).isEqualTo(1);
            assertThat(fixture.sink.escalations).hasSize(1);
        }

        @Test
        @DisplayName("Overdue repeats collapse into a single catch-up firing")
        void restart_shouldCollapseMissedRepeats() {
            WorkflowGraph graph = WorkflowGraph.builder()
                .node(StartNode.of("start"))
                .node(TaskNode.builder("review")
                    .assignees(AssigneeRule.users("alice"))
                    .escalation(EscalationRule.repeating(Duration.ofHours(1), Duration.ofHours(1), null,
                        List.of("lead"), Action.escalate("nudge", "still waiting")))
                    .build())
                .node(EndNode.of("done"))
                .edge("start-review", "start", "review")
                .edge("review-done", "review", "done")
                .build();
            WorkflowInstance instance = start(
                WorkflowDefinition.builder().name("nagging-review").graph(graph).build(), BOB);

            WorkflowCoordinator restarted = fixture.coordinator();
            fixture.clock.advance(Duration.ofMinutes(270));
            restarted.recoverRunningInstances();

            assertThat(restarted.getScheduler().pending(instance.instanceId()))
                .singleElement()
                .satisfies(t -> assertThat(t.firing()).isEqualTo(3));
            assertThat(restarted.getScheduler().pollDue()).isEqualTo(1);
            assertThat(fixture.sink.escalations).hasSize(1);

            fixture.clock.advance(Duration.ofMinutes(30));
            assertThat(restarted.getScheduler().pollDue()).isEqualTo(1);
            assertThat(fixture.sink.escalations).hasSize(2);
        }

        @Test
        @DisplayName("A timer node that elapsed while the coordinator was down times out on recovery")
        void restart_shouldRecoverTimeout() {
            WorkflowInstance instance = start(SampleDefinitions.timerWorkflow(Duration.ofHours(1), null), BOB);

            WorkflowCoordinator restarted = fixture.coordinator();
            fixture.clock.advance(Duration.ofHours(2));
            restarted.recoverRunningInstances();
            restarted.getScheduler().pollDue();

            WorkflowInstance done = fixture.instances.load(instance.instanceId());
            assertThat(done.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(done.variable("timedOut").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("Recovered timers of a suspended instance wait for resume")
        void restart_shouldHoldSuspendedTimers() {
            WorkflowInstance instance = start(SampleDefinitions.reviewWorkflow(Duration.ofHours(1)), BOB);
            complete(instance, "draft", BOB, Map.of());
            coordinator.suspend(instance.instanceId(), Actor.system(), "audit");

            WorkflowCoordinator restarted = fixture.coordinator();
            fixture.clock.advance(Duration.ofHours(2));
            assertThat(restarted.recoverRunningInstances()).isEqualTo(1);
            restarted.getScheduler().pollDue();
            assertThat(fixture.sink.escalations).isEmpty();

            restarted.resume(instance.instanceId(), Actor.system());
            restarted.getScheduler().pollDue();
            assertThat(fixture.sink.escalations).hasSize(1);
        }

        @Test
        @DisplayName("An instance whose definition is gone is failed")
        void restart_shouldFailOrphanedInstance() {
            WorkflowDefinition unpublished = SampleDefinitions.reviewWorkflow();
            WorkflowInstance orphan = WorkflowInstance.create(unpublished, DOC, "bob", Map.of(),
                fixture.clock.instant());
            fixture.instances.create(orphan);

            assertThat(coordinator.recoverRunningInstances()).isZero();

            WorkflowInstance failed = fixture.instances.load(orphan.instanceId());
            assertThat(failed.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(failed.failure().errorCode()).isEqualTo("DEFINITION_MISSING");
            assertThat(eventTypes(orphan.instanceId())).containsExactly(WorkflowEventType.WORKFLOW_FAILED);
        }
    }

    // ========== Definitions and queries ==========

    @Nested
    @DisplayName("Definitions and queries")
    class Definitions {

        @Test
        @DisplayName("Invalid definition is not published")
        void publish_shouldRejectInvalidDefinition() {
            WorkflowGraph graph = WorkflowGraph.builder()
                .node(StartNode.of("start"))
                .node(TaskNode.builder("orphan").build())
                .node(EndNode.of("done"))
                .edge("start-done", "start", "done")
                .edge("orphan-done", "orphan", "done")
                .build();
            WorkflowDefinition definition = WorkflowDefinition.builder().name("broken").graph(graph).build();

            assertThatThrownBy(() -> coordinator.publishDefinition(definition))
                .isInstanceOf(WorkflowDefinitionException.class);
            assertThat(coordinator.getLatestDefinition("broken")).isEmpty();
        }

        @Test
        @DisplayName("Definition published from JSON can start instances by name")
        void publishJson_shouldStartLatest() {
            String json = new WorkflowDefinitionCodec().toJson(SampleDefinitions.reviewWorkflow());

            WorkflowDefinition published = coordinator.publishDefinition(json);
            WorkflowInstance instance = coordinator.startWorkflow(
                StartWorkflowRequest.latest("document-review", DOC, BOB, Map.of()));

            assertThat(instance.definitionId()).isEqualTo(published.id());
            assertThat(instance.activeNodes()).containsExactly("draft");
        }

        @Test
        @DisplayName("An entity event starts every definition it triggers")
        void entityEvent_shouldStartTriggeredDefinitions() {
            coordinator.publishDefinition(new WorkflowDefinition.Builder(SampleDefinitions.reviewWorkflow())
                .trigger("document", "uploaded").build());
            coordinator.publishDefinition(new WorkflowDefinition.Builder(SampleDefinitions.parallelWorkflow())
                .trigger("document", "uploaded").build());
            coordinator.publishDefinition(
                new WorkflowDefinition.Builder(SampleDefinitions.timerWorkflow(Duration.ofHours(1), null))
                    .trigger("document", "archived").build());

            List<WorkflowInstance> started = coordinator.onEntityEvent(DOC, "uploaded", Map.of(), BOB);

            assertThat(started).extracting(WorkflowInstance::definitionName)
                .containsExactlyInAnyOrder("document-review", "contract-signoff");
            assertThat(started).allSatisfy(i -> {
                assertThat(i.entity()).isEqualTo(DOC);
                assertThat(i.initiator()).isEqualTo("bob");
                assertThat(eventTypes(i.instanceId())).contains(WorkflowEventType.WORKFLOW_STARTED);
            });
            assertThat(coordinator.onEntityEvent(EntityReference.document("doc-7"), "signed", Map.of(), BOB))
                .isEmpty();
            assertThat(coordinator.onEntityEvent(new EntityReference("invoice", "inv-1"), "uploaded", Map.of(), BOB))
                .isEmpty();
        }

        @Test
        @DisplayName("Only the latest active version of a triggered definition starts")
        void entityEvent_shouldUseLatestActiveVersion() {
            WorkflowDefinition v1 = coordinator.publishDefinition(new WorkflowDefinition.Builder(
                SampleDefinitions.reviewWorkflow()).trigger("document", "uploaded").build());
            WorkflowDefinition v2 = coordinator.publishDefinition(v1.revise().build());

            List<WorkflowInstance> started = coordinator.onEntityEvent(DOC, "uploaded", Map.of(), BOB);
            assertThat(started).singleElement()
                .satisfies(i -> assertThat(i.definitionId()).isEqualTo(v2.id()));

            coordinator.deactivateDefinition(v2.id());
            started = coordinator.onEntityEvent(DOC, "uploaded", Map.of(), BOB);
            assertThat(started).singleElement()
                .satisfies(i -> assertThat(i.definitionId()).isEqualTo(v1.id()));
        }

        @Test
        @DisplayName("A definition with two start nodes starts from the one requested")
        void startNode_shouldBeSelectable() {
            WorkflowGraph graph = WorkflowGraph.builder()
                .node(StartNode.of("start"))
                .node(StartNode.of("express"))
                .node(TaskNode.builder("draft").build())
                .node(TaskNode.builder("review").build())
                .node(EndNode.of("done"))
                .edge("start-draft", "start", "draft")
                .edge("express-review", "express", "review")
                .edge("draft-review", "draft", "review")
                .edge("review-done", "review", "done")
                .build();
            WorkflowDefinition published = coordinator.publishDefinition(
                WorkflowDefinition.builder().name("two-entries").graph(graph).build());

            WorkflowInstance regular = coordinator.startWorkflow(
                StartWorkflowRequest.of(published.id(), DOC, BOB, Map.of()));
            WorkflowInstance express = coordinator.startWorkflow(
                StartWorkflowRequest.of(published.id(), DOC, BOB, Map.of()).fromStartNode("express"));

            assertThat(regular.activeNodes()).containsExactly("draft");
            assertThat(express.activeNodes()).containsExactly("review");
            assertThat(express.history().get(0).fromNode()).isEqualTo("express");
            assertThatThrownBy(() -> coordinator.startWorkflow(
                StartWorkflowRequest.of(published.id(), DOC, BOB, Map.of()).fromStartNode("draft")))
                .isInstanceOf(WorkflowException.class)
                .satisfies(e -> assertThat(((WorkflowException) e).getErrorCode()).isEqualTo("NO_START_NODE"));
        }

        @Test
        @DisplayName("Deactivated definition refuses new instances")
        void deactivated_shouldRefuseStart() {
            WorkflowDefinition published = coordinator.publishDefinition(SampleDefinitions.reviewWorkflow());
            coordinator.deactivateDefinition(published.id());

            assertThatThrownBy(() -> coordinator.startWorkflow(
                StartWorkflowRequest.of(published.id(), DOC, BOB, Map.of())))
                .isInstanceOf(WorkflowException.class)
                .satisfies(e -> assertThat(((WorkflowException) e).getErrorCode()).isEqualTo("DEFINITION_INACTIVE"));
        }

        @Test
        @DisplayName("Unknown entity refuses the start and stores nothing")
        void unknownEntity_shouldRefuseStart() {
            fixture.entityResolver(entity -> false);
            coordinator = fixture.coordinator();
            WorkflowDefinition published = coordinator.publishDefinition(SampleDefinitions.reviewWorkflow());

            assertThatThrownBy(() -> coordinator.startWorkflow(
                StartWorkflowRequest.of(published.id(), DOC, BOB, Map.of())))
                .isInstanceOf(NotFoundException.class);
            assertThat(fixture.instances.findAll()).isEmpty();
        }

        @Test
        @DisplayName("Missing required variable refuses the start")
        void missingVariable_shouldRefuseStart() {
            WorkflowDefinition definition = SampleDefinitions.reviewWorkflow().revise()
                .variable(VariableDefinition.required("title", VariableType.STRING))
                .build();
            WorkflowDefinition published = coordinator.publishDefinition(definition);

            assertThatThrownBy(() -> coordinator.startWorkflow(
                StartWorkflowRequest.of(published.id(), DOC, BOB, Map.of())))
                .isInstanceOf(InvalidVariablesException.class);
            assertThat(fixture.instances.findAll()).isEmpty();
        }

        @Test
        @DisplayName("Instances are found by entity and status")
        void findWorkflows_shouldFilter() {
            WorkflowInstance first = start(SampleDefinitions.reviewWorkflow(), BOB);
            WorkflowInstance other = coordinator.startWorkflow(StartWorkflowRequest.of(
                first.definitionId(), EntityReference.document("doc-7"), BOB, Map.of()));
            coordinator.cancel(other.instanceId(), Actor.system(), "duplicate");

            assertThat(coordinator.findWorkflows(WorkflowQuery.byEntity(DOC)))
                .extracting(WorkflowInstance::instanceId).containsExactly(first.instanceId());
            assertThat(coordinator.findWorkflows(WorkflowQuery.byStatus(WorkflowStatus.CANCELLED)))
                .extracting(WorkflowInstance::instanceId).containsExactly(other.instanceId());
            assertThat(coordinator.findWorkflows(WorkflowQuery.byDefinition(first.definitionId()))).hasSize(2);
        }
    }
}
