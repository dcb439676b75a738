package com.docflow.core.event;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of checking an instance's event hash chain.
 */
public record ChainVerification(UUID instanceId, int eventsChecked, List<Issue> issues) {

    public ChainVerification {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean intact() {
        return issues.isEmpty();
    }

    /**
     * Sequence number of the first event whose link does not hold.
     */
    public Optional<Long> firstBrokenSequence() {
        return issues.stream().map(Issue::sequence).findFirst();
    }

    public enum IssueKind {
        SEQUENCE_GAP,
        BROKEN_LINK,
        HASH_MISMATCH
    }

    public record Issue(long sequence, IssueKind kind, String description) {}
}
