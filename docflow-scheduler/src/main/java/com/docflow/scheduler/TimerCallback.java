package com.docflow.scheduler;

import java.time.Duration;

/**
 * Receives due timers. Implemented by the engine.
 */
@FunctionalInterface
public interface TimerCallback {

    /**
     * @param lateBy how long after its fire time the timer is being delivered
     */
    FireOutcome onTimerDue(ScheduledTimer timer, Duration lateBy);

    /**
     * Called before delivery when a timer is later than the miss threshold.
     */
    default void onTimerMissed(ScheduledTimer timer, Duration lateBy) {
    }
}
