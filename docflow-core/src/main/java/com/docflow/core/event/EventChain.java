package com.docflow.core.event;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Hash chain over an instance's event log.
 *
 * Each stored event carries the SHA-256 of its own content and of its predecessor's hash, so
 * rewriting, dropping or reordering an event breaks every link after it. The first event of
 * an instance links to {@link #GENESIS}.
 */
public final class EventChain {

    public static final String ALGORITHM = "SHA-256";
    public static final String GENESIS = "0".repeat(64);

    private static final char SEPARATOR = '\u001f';

    private EventChain() {
    }

    /**
     * Sequence an event and link it to the hash of the event before it.
     */
    public static WorkflowEvent link(WorkflowEvent event, long sequence, String previousHash) {
        WorkflowEvent unsealed = new WorkflowEvent(event.eventId(), event.instanceId(), sequence, event.type(),
            event.timestamp(), event.nodeIds(), event.actor(), event.payload(), event.idempotencyKey(),
            previousHash, null);
        return new WorkflowEvent(event.eventId(), event.instanceId(), sequence, event.type(),
            event.timestamp(), event.nodeIds(), event.actor(), event.payload(), event.idempotencyKey(),
            previousHash, hashOf(unsealed));
    }

    /**
     * Hash of the event's content and predecessor link. The stored hash itself is not an input.
     */
    public static String hashOf(WorkflowEvent event) {
        StringBuilder content = new StringBuilder()
            .append(event.eventId()).append(SEPARATOR)
            .append(event.instanceId()).append(SEPARATOR)
            .append(event.sequence()).append(SEPARATOR)
            .append(event.type()).append(SEPARATOR)
            .append(event.timestamp()).append(SEPARATOR)
            .append(String.join(",", event.nodeIds())).append(SEPARATOR)
            .append(event.actor()).append(SEPARATOR)
            .append(event.payload() == null ? "" : event.payload().toString()).append(SEPARATOR)
            .append(event.idempotencyKey()).append(SEPARATOR)
            .append(event.previousHash());
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(content.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported hash algorithm: " + ALGORITHM, e);
        }
    }

    /**
     * Walk an instance's events in sequence order and report every link that does not hold.
     */
    public static ChainVerification verify(UUID instanceId, List<WorkflowEvent> events) {
        List<ChainVerification.Issue> issues = new ArrayList<>();
        String expectedPrevious = GENESIS;
        long expectedSequence = 1;

        for (WorkflowEvent event : events) {
            if (event.sequence() != expectedSequence) {
                issues.add(new ChainVerification.Issue(event.sequence(), ChainVerification.IssueKind.SEQUENCE_GAP,
                    "expected sequence " + expectedSequence + ", found " + event.sequence()));
            }
            if (!Objects.equals(event.previousHash(), expectedPrevious)) {
                issues.add(new ChainVerification.Issue(event.sequence(), ChainVerification.IssueKind.BROKEN_LINK,
                    "predecessor hash does not match the event before it"));
            }
            if (!Objects.equals(event.hash(), hashOf(event))) {
                issues.add(new ChainVerification.Issue(event.sequence(), ChainVerification.IssueKind.HASH_MISMATCH,
                    "content does not match its hash"));
            }
            expectedPrevious = event.hash();
            expectedSequence = event.sequence() + 1;
        }
        return new ChainVerification(instanceId, events.size(), issues);
    }
}
