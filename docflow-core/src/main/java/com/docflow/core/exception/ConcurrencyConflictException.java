package com.docflow.core.exception;

import java.util.UUID;

/**
 * Thrown when a save or command names a version that is no longer current.
 * The caller reloads the instance and retries.
 */
public class ConcurrencyConflictException extends WorkflowException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    private final UUID instanceId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID instanceId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Concurrent modification of instance %s: expected version %d, actual version %d",
            instanceId, expectedVersion, actualVersion
        ));
        this.instanceId = instanceId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getInstanceId() {
        return instanceId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
