package com.docflow.core.model;

import java.time.Instant;

/**
 * Why an instance failed.
 */
public record FailureInfo(
    String nodeId,
    String actionId,
    String errorCode,
    String message,
    Instant failedAt
) {}
