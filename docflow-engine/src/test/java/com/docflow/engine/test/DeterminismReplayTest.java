package com.docflow.engine.test;

import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventType;
import com.docflow.core.model.EntityReference;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.guard.Actor;
import com.docflow.core.test.SampleDefinitions;
import com.docflow.engine.coordinator.WorkflowCoordinator;
import com.docflow.engine.history.ExecutionHistoryService;
import com.docflow.engine.history.ExecutionHistoryService.ReplayResult;
import com.docflow.engine.service.WorkflowService.CompleteTaskRequest;
import com.docflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Determinism and replay tests.
 * The same stimuli on the same definition must give the same history, and the event log
 * must be enough to tell where an instance stood at any moment.
 */
@DisplayName("Determinism & Replay Tests")
public class DeterminismReplayTest {

    private static final Actor BOB = Actor.of("bob");
    private static final Actor ALICE = Actor.withRoles("alice", "reviewer");

    /**
     * Draft, reject, redraft, approve. Each step an hour after the previous one.
     */
    private static WorkflowInstance runReviewScenario(EngineFixture fixture, WorkflowDefinition definition) {
        WorkflowCoordinator coordinator = fixture.coordinator();
        coordinator.publishDefinition(definition);
        WorkflowInstance instance = coordinator.startWorkflow(
            StartWorkflowRequest.of(definition.id(), EntityReference.document("doc-1"), BOB, Map.of()));
        UUID id = instance.instanceId();

        List<String> steps = List.of("draft", "review:reject", "draft", "review:approve");
        for (String step : steps) {
            fixture.clock.advance(Duration.ofHours(1));
            String[] parts = step.split(":");
            Map<String, JsonNode> data = parts.length > 1 ? Map.of("decision", TextNode.valueOf(parts[1])) : Map.of();
            Actor actor = parts[0].equals("review") ? ALICE : BOB;
            coordinator.completeTask(CompleteTaskRequest.of(id, parts[0], data, actor));
        }
        return fixture.instances.load(id);
    }

    // ========== Determinism Tests ==========

    @Test
    @DisplayName("Same stimuli on the same definition give the same history")
    void testDeterministicHistory() {
        WorkflowDefinition definition = SampleDefinitions.reviewWorkflow();

        WorkflowInstance first = runReviewScenario(new EngineFixture(), definition);
        WorkflowInstance second = runReviewScenario(new EngineFixture(), definition);

        assertThat(first.status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(second.history()).isEqualTo(first.history());
        assertThat(second.variables()).isEqualTo(first.variables());
        assertThat(second.version()).isEqualTo(first.version());
    }

    @Test
    @DisplayName("Events are recorded in strict sequence order")
    void testEventSequenceOrdering() {
        EngineFixture fixture = new EngineFixture();
        WorkflowInstance instance = runReviewScenario(fixture, SampleDefinitions.reviewWorkflow());

        List<WorkflowEvent> events = fixture.events.findByInstance(instance.instanceId());

        assertThat(events).isNotEmpty();
        for (int i = 0; i < events.size(); i++) {
            assertThat(events.get(i).sequence()).isEqualTo(i + 1L);
        }
        assertThat(events.get(0).type()).isEqualTo(WorkflowEventType.WORKFLOW_STARTED);
        assertThat(events.get(events.size() - 1).type()).isEqualTo(WorkflowEventType.WORKFLOW_COMPLETED);
        // One transition event per history entry
        assertThat(events).filteredOn(e -> e.type() == WorkflowEventType.WORKFLOW_TRANSITIONED)
            .hasSize(instance.history().size());
    }

    // ========== Replay Tests ==========

    @Test
    @DisplayName("Replay to a mid-execution timestamp reconstructs a running instance")
    void testPartialReplay() {
        EngineFixture fixture = new EngineFixture();
        Instant startedAt = fixture.clock.instant();
        WorkflowInstance instance = runReviewScenario(fixture, SampleDefinitions.reviewWorkflow());
        ExecutionHistoryService history = fixture.historyService();

        ReplayResult partial = history.replayToTimestamp(instance.instanceId(), startedAt.plus(Duration.ofMinutes(90)));

        assertThat(partial.reconstructedStatus()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(partial.startedAt()).isEqualTo(startedAt);
        assertThat(partial.completedAt()).isNull();
        assertThat(partial.touchedNodes()).contains("draft", "review");
        assertThat(partial.eventCount()).isLessThan(fixture.events.findByInstance(instance.instanceId()).size());
    }

    @Test
    @DisplayName("Replay to the end reconstructs the final status")
    void testFullReplay() {
        EngineFixture fixture = new EngineFixture();
        WorkflowInstance instance = runReviewScenario(fixture, SampleDefinitions.reviewWorkflow());

        ReplayResult full = fixture.historyService().replayToTimestamp(instance.instanceId(), fixture.clock.instant());

        assertThat(full.reconstructedStatus()).isEqualTo(instance.status());
        assertThat(full.completedAt()).isEqualTo(instance.completedAt());
        assertThat(full.replayedToSequence()).isEqualTo(full.eventCount());
    }

    @Test
    @DisplayName("Replay before the start finds nothing")
    void testReplayBeforeStart() {
        EngineFixture fixture = new EngineFixture();
        Instant before = fixture.clock.instant().minusSeconds(1);
        WorkflowInstance instance = runReviewScenario(fixture, SampleDefinitions.reviewWorkflow());

        ReplayResult empty = fixture.historyService().replayToTimestamp(instance.instanceId(), before);

        assertThat(empty.reconstructedStatus()).isNull();
        assertThat(empty.eventCount()).isZero();
        assertThat(empty.replayedToSequence()).isZero();
    }

    @Test
    @DisplayName("Suspension shows up in the replayed status")
    void testSuspendReplay() {
        EngineFixture fixture = new EngineFixture();
        WorkflowCoordinator coordinator = fixture.coordinator();
        WorkflowDefinition definition = coordinator.publishDefinition(SampleDefinitions.reviewWorkflow());
        WorkflowInstance instance = coordinator.startWorkflow(
            StartWorkflowRequest.of(definition.id(), EntityReference.document("doc-1"), BOB, Map.of()));

        fixture.clock.advance(Duration.ofHours(1));
        coordinator.suspend(instance.instanceId(), Actor.system(), "legal hold");
        Instant suspendedAt = fixture.clock.instant();
        fixture.clock.advance(Duration.ofHours(1));
        coordinator.resume(instance.instanceId(), Actor.system());

        ExecutionHistoryService history = fixture.historyService();
        assertThat(history.replayToTimestamp(instance.instanceId(), suspendedAt).reconstructedStatus())
            .isEqualTo(WorkflowStatus.SUSPENDED);
        assertThat(history.replayToTimestamp(instance.instanceId(), fixture.clock.instant()).reconstructedStatus())
            .isEqualTo(WorkflowStatus.RUNNING);
    }
}
