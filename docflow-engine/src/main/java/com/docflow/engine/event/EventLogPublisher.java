package com.docflow.engine.event;

import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventPublisher;
import com.docflow.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publisher that records every event in the event log before handing it to subscribers.
 *
 * The log assigns the per-instance sequence number and drops events whose idempotency key
 * it has already seen, so subscribers receive each event at most once. A subscriber that
 * throws is logged and skipped; the remaining subscribers still receive the event.
 */
public class EventLogPublisher implements WorkflowEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventLogPublisher.class);

    private final EventRepository eventRepository;
    private final List<WorkflowEventPublisher> subscribers = new CopyOnWriteArrayList<>();

    public EventLogPublisher(EventRepository eventRepository) {
        this(eventRepository, List.of());
    }

    public EventLogPublisher(EventRepository eventRepository, List<WorkflowEventPublisher> subscribers) {
        this.eventRepository = eventRepository;
        this.subscribers.addAll(subscribers);
    }

    public void subscribe(WorkflowEventPublisher subscriber) {
        subscribers.add(subscriber);
    }

    @Override
    public void publish(WorkflowEvent event) {
        Optional<WorkflowEvent> stored = eventRepository.append(event);
        if (stored.isEmpty()) {
            log.debug("Skipping duplicate event {} ({})", event.type(), event.idempotencyKey());
            return;
        }

        WorkflowEvent sequenced = stored.get();
        log.debug("Event {} #{} for instance {}", sequenced.type(), sequenced.sequence(), sequenced.instanceId());
        for (WorkflowEventPublisher subscriber : subscribers) {
            try {
                subscriber.publish(sequenced);
            } catch (RuntimeException e) {
                log.warn("Event subscriber failed on {} #{} for instance {}: {}",
                    sequenced.type(), sequenced.sequence(), sequenced.instanceId(), e.getMessage());
            }
        }
    }
}
