package com.docflow.scheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-ordered store of scheduled timers.
 */
public interface TimerQueue {

    void add(ScheduledTimer timer);

    /**
     * Remove and return timers due at or before {@code now}, earliest first.
     */
    List<ScheduledTimer> pollDue(Instant now, int limit);

    int removeForNode(UUID instanceId, String nodeId);

    int removeForInstance(UUID instanceId);

    List<ScheduledTimer> findByInstance(UUID instanceId);

    Optional<Instant> nextFireTime();

    int size();
}
