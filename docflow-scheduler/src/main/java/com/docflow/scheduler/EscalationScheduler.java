package com.docflow.scheduler;

import com.docflow.core.model.action.EscalationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deadline scheduler for timer nodes and escalation rules.
 *
 * Responsibilities:
 * - Keep per-instance deadlines in a time-ordered queue
 * - Deliver due timers to the engine callback, in fire-time order
 * - Schedule the next firing of a repeating escalation after each firing
 * - Hold timers of suspended instances until they resume
 *
 * {@link #pollDue()} can be driven by hand (tests, single-threaded hosts) or by the
 * background loop started with {@link #start()}.
 */
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private final TimerQueue queue;
    private final TimerCallback callback;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final Map<UUID, List<ScheduledTimer>> deferred = new ConcurrentHashMap<>();

    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public EscalationScheduler(TimerQueue queue, TimerCallback callback, Clock clock, SchedulerSettings settings) {
        this.queue = queue;
        this.callback = callback;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Start background polling.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Escalation scheduler already running");
            return;
        }
        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "docflow-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        long interval = settings.pollInterval().toMillis();
        executor.scheduleWithFixedDelay(this::pollSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Escalation scheduler started (poll every {}ms, batch {})", interval, settings.batchSize());
    }

    /**
     * Stop background polling. Queued timers are kept.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Escalation scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ========== Arming ==========

    /**
     * Arm the timeout of a timer node.
     */
    public ScheduledTimer scheduleTimeout(UUID instanceId, String nodeId, Instant enteredAt, Duration duration,
                                          long armOrdinal) {
        ScheduledTimer timer = ScheduledTimer.timeout(instanceId, nodeId, enteredAt, enteredAt.plus(duration),
            armOrdinal);
        queue.add(timer);
        log.debug("Armed timeout for {}:{} at {}", instanceId, nodeId, timer.fireAt());
        return timer;
    }

    /**
     * Arm the first firing of each escalation rule of a waiting node.
     *
     * @return the armed timers, one per rule that fires at all
     */
    public List<ScheduledTimer> scheduleEscalations(UUID instanceId, String nodeId, List<EscalationRule> rules,
                                                    Instant enteredAt, long armOrdinal) {
        List<ScheduledTimer> armed = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            Optional<ScheduledTimer> timer = ScheduledTimer.escalation(instanceId, nodeId, i, rules.get(i),
                enteredAt, armOrdinal);
            timer.ifPresent(t -> {
                queue.add(t);
                armed.add(t);
                log.debug("Armed escalation {} for {}:{} at {}", t.ruleIndex(), instanceId, nodeId, t.fireAt());
            });
        }
        return armed;
    }

    /**
     * Re-arm the escalation rules of a node after a restart. Firings that fell due while
     * nothing was polling collapse into the latest one, which fires on the next poll; repeats
     * continue from there.
     */
    public List<ScheduledTimer> recoverEscalations(UUID instanceId, String nodeId, List<EscalationRule> rules,
                                                   Instant enteredAt, long armOrdinal) {
        Instant now = clock.instant();
        List<ScheduledTimer> armed = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            EscalationRule rule = rules.get(i);
            int firing = Math.max(0, rule.latestFiringDue(enteredAt, now));
            if (firing > 0) {
                log.info("Skipping {} overdue firing(s) of escalation {} for {}:{}",
                    firing, i, instanceId, nodeId);
            }
            ScheduledTimer.escalation(instanceId, nodeId, i, rule, enteredAt, firing, armOrdinal).ifPresent(t -> {
                queue.add(t);
                armed.add(t);
            });
        }
        return armed;
    }

    /**
     * Whether anything is queued or held for the node.
     */
    public boolean hasPending(UUID instanceId, String nodeId) {
        return pending(instanceId).stream().anyMatch(t -> t.nodeId().equals(nodeId));
    }

    /**
     * Disarm everything queued for a node the instance has left.
     */
    public int cancelForNode(UUID instanceId, String nodeId) {
        int removed = queue.removeForNode(instanceId, nodeId);
        List<ScheduledTimer> held = deferred.get(instanceId);
        if (held != null) {
            synchronized (held) {
                int before = held.size();
                held.removeIf(t -> t.nodeId().equals(nodeId));
                removed += before - held.size();
            }
        }
        if (removed > 0) {
            log.debug("Disarmed {} timer(s) for {}:{}", removed, instanceId, nodeId);
        }
        return removed;
    }

    public int cancelForInstance(UUID instanceId) {
        int removed = queue.removeForInstance(instanceId);
        List<ScheduledTimer> held = deferred.remove(instanceId);
        return held == null ? removed : removed + held.size();
    }

    /**
     * Return timers held while the instance was suspended to the queue. Timers already due
     * fire on the next poll.
     */
    public int resume(UUID instanceId) {
        List<ScheduledTimer> held = deferred.remove(instanceId);
        if (held == null) {
            return 0;
        }
        synchronized (held) {
            held.forEach(queue::add);
            log.info("Released {} deferred timer(s) for instance {}", held.size(), instanceId);
            return held.size();
        }
    }

    public List<ScheduledTimer> pending(UUID instanceId) {
        List<ScheduledTimer> timers = new ArrayList<>(queue.findByInstance(instanceId));
        List<ScheduledTimer> held = deferred.get(instanceId);
        if (held != null) {
            synchronized (held) {
                timers.addAll(held);
            }
        }
        return timers;
    }

    public Optional<Instant> nextFireTime() {
        return queue.nextFireTime();
    }

    // ========== Polling ==========

    /**
     * Deliver every timer due at the clock's current time, up to the batch size.
     *
     * @return number of timers taken off the queue
     */
    public int pollDue() {
        Instant now = clock.instant();
        List<ScheduledTimer> due = queue.pollDue(now, settings.batchSize());
        for (ScheduledTimer timer : due) {
            fire(timer, now);
        }
        return due.size();
    }

    private void pollSafely() {
        if (!running) {
            return;
        }
        try {
            pollDue();
        } catch (Exception e) {
            log.error("Error polling timers", e);
        }
    }

    private void fire(ScheduledTimer timer, Instant now) {
        Duration lateBy = Duration.between(timer.fireAt(), now);
        if (lateBy.compareTo(settings.missThreshold()) > 0) {
            log.warn("Timer missed: {} {} for {}:{} fired {}s late",
                timer.kind(), timer.timerId(), timer.instanceId(), timer.nodeId(), lateBy.toSeconds());
            callback.onTimerMissed(timer, lateBy);
        }

        FireOutcome outcome;
        try {
            outcome = callback.onTimerDue(timer, lateBy);
        } catch (RuntimeException e) {
            if (timer.fireAttempts() + 1 < settings.maxFireAttempts()) {
                log.error("Failed to fire timer {} for {}:{}, retrying on a later poll",
                    timer.timerId(), timer.instanceId(), timer.nodeId(), e);
                queue.add(timer.retryAt(now.plus(settings.pollInterval())));
            } else {
                log.error("Failed to fire timer {} for {}:{} after {} attempts, dropping it",
                    timer.timerId(), timer.instanceId(), timer.nodeId(), timer.fireAttempts() + 1, e);
            }
            return;
        }

        switch (outcome) {
            case FIRED -> timer.nextFiring().ifPresent(next -> {
                queue.add(next);
                log.debug("Next escalation {} firing {} for {}:{} at {}",
                    next.ruleIndex(), next.firing(), next.instanceId(), next.nodeId(), next.fireAt());
            });
            case DEFERRED -> {
                List<ScheduledTimer> held = deferred.computeIfAbsent(timer.instanceId(), k -> new ArrayList<>());
                synchronized (held) {
                    held.add(timer);
                }
                log.debug("Deferred timer {} of suspended instance {}", timer.timerId(), timer.instanceId());
            }
            case DISCARDED -> log.debug("Discarded timer {} for {}:{}",
                timer.timerId(), timer.instanceId(), timer.nodeId());
        }
    }
}
