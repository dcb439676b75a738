package com.docflow.scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TimerQueue backed by a priority heap.
 * For demonstration and testing purposes.
 */
public class InMemoryTimerQueue implements TimerQueue {

    private static final Comparator<ScheduledTimer> ORDER =
        Comparator.comparing(ScheduledTimer::fireAt).thenComparing(ScheduledTimer::timerId);

    private final PriorityQueue<ScheduledTimer> queue = new PriorityQueue<>(ORDER);

    @Override
    public synchronized void add(ScheduledTimer timer) {
        queue.add(timer);
    }

    @Override
    public synchronized List<ScheduledTimer> pollDue(Instant now, int limit) {
        List<ScheduledTimer> due = new ArrayList<>();
        while (due.size() < limit && !queue.isEmpty() && !queue.peek().fireAt().isAfter(now)) {
            due.add(queue.poll());
        }
        return due;
    }

    @Override
    public synchronized int removeForNode(UUID instanceId, String nodeId) {
        int before = queue.size();
        queue.removeIf(t -> t.instanceId().equals(instanceId) && t.nodeId().equals(nodeId));
        return before - queue.size();
    }

    @Override
    public synchronized int removeForInstance(UUID instanceId) {
        int before = queue.size();
        queue.removeIf(t -> t.instanceId().equals(instanceId));
        return before - queue.size();
    }

    @Override
    public synchronized List<ScheduledTimer> findByInstance(UUID instanceId) {
        return queue.stream()
            .filter(t -> t.instanceId().equals(instanceId))
            .sorted(ORDER)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<Instant> nextFireTime() {
        return Optional.ofNullable(queue.peek()).map(ScheduledTimer::fireAt);
    }

    @Override
    public synchronized int size() {
        return queue.size();
    }
}
