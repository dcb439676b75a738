package com.docflow.scheduler;

/**
 * What the callback did with a due timer.
 */
public enum FireOutcome {
    /** Timer handled; escalations schedule their next firing */
    FIRED,
    /** Node no longer active or instance finished; timer dropped */
    DISCARDED,
    /** Instance suspended; timer held until the instance resumes */
    DEFERRED
}
