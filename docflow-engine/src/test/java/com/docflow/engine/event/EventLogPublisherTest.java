package com.docflow.engine.event;

import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventPublisher;
import com.docflow.core.event.WorkflowEventType;
import com.docflow.engine.persistence.InMemoryEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventLogPublisherTest {

    private static final Instant NOW = Instant.parse("2024-01-15T09:00:00Z");

    @Mock
    private WorkflowEventPublisher subscriber;

    private final InMemoryEventRepository repository = new InMemoryEventRepository();

    private static WorkflowEvent event(UUID instanceId, WorkflowEventType type, String key) {
        return WorkflowEvent.create(instanceId, type, NOW, List.of("draft"), "bob", null, key);
    }

    @Test
    @DisplayName("Events are sequenced per instance and forwarded")
    void publish_shouldSequenceAndForward() {
        EventLogPublisher publisher = new EventLogPublisher(repository, List.of(subscriber));
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        publisher.publish(event(first, WorkflowEventType.WORKFLOW_STARTED, "a-1"));
        publisher.publish(event(first, WorkflowEventType.WORKFLOW_TRANSITIONED, "a-2"));
        publisher.publish(event(second, WorkflowEventType.WORKFLOW_STARTED, "b-1"));

        assertThat(repository.findByInstance(first)).extracting(WorkflowEvent::sequence).containsExactly(1L, 2L);
        assertThat(repository.findByInstance(second)).extracting(WorkflowEvent::sequence).containsExactly(1L);

        ArgumentCaptor<WorkflowEvent> forwarded = ArgumentCaptor.forClass(WorkflowEvent.class);
        verify(subscriber, times(3)).publish(forwarded.capture());
        assertThat(forwarded.getAllValues()).allSatisfy(e -> assertThat(e.sequence()).isPositive());
    }

    @Test
    @DisplayName("Re-published event with the same key is dropped")
    void publish_shouldDropDuplicates() {
        EventLogPublisher publisher = new EventLogPublisher(repository, List.of(subscriber));
        UUID instanceId = UUID.randomUUID();

        publisher.publish(event(instanceId, WorkflowEventType.WORKFLOW_STARTED, "a-1"));
        publisher.publish(event(instanceId, WorkflowEventType.WORKFLOW_STARTED, "a-1"));

        assertThat(repository.findByInstance(instanceId)).hasSize(1);
        assertThat(repository.findByIdempotencyKey("a-1")).isPresent();
        verify(subscriber, times(1)).publish(any());
    }

    @Test
    @DisplayName("A failing subscriber does not stop the others")
    void publish_shouldSkipFailingSubscriber() {
        WorkflowEventPublisher failing = event -> {
            throw new IllegalStateException("broker down");
        };
        EventLogPublisher publisher = new EventLogPublisher(repository);
        publisher.subscribe(failing);
        publisher.subscribe(subscriber);

        UUID instanceId = UUID.randomUUID();
        assertThatCode(() -> publisher.publish(event(instanceId, WorkflowEventType.WORKFLOW_STARTED, "a-1")))
            .doesNotThrowAnyException();

        verify(subscriber).publish(any());
        assertThat(repository.findByInstance(instanceId)).hasSize(1);
    }

    @Test
    @DisplayName("Type queries and counts read the log")
    void repository_shouldAnswerTypeQueries() {
        EventLogPublisher publisher = new EventLogPublisher(repository);
        UUID instanceId = UUID.randomUUID();
        publisher.publish(event(instanceId, WorkflowEventType.WORKFLOW_STARTED, "a-1"));
        publisher.publish(event(instanceId, WorkflowEventType.WORKFLOW_TRANSITIONED, "a-2"));
        publisher.publish(event(instanceId, WorkflowEventType.WORKFLOW_TRANSITIONED, "a-3"));

        assertThat(repository.findByInstanceAndTypes(instanceId, List.of(WorkflowEventType.WORKFLOW_TRANSITIONED)))
            .hasSize(2);
        assertThat(repository.countByType(instanceId))
            .containsEntry(WorkflowEventType.WORKFLOW_STARTED, 1L)
            .containsEntry(WorkflowEventType.WORKFLOW_TRANSITIONED, 2L);
        assertThat(repository.findByTimeRange(NOW, NOW, 2)).hasSize(2);
    }
}
