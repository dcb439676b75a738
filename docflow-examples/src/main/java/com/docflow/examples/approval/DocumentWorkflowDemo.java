package com.docflow.examples.approval;

import com.docflow.action.DefaultActionExecutor;
import com.docflow.action.RetryPolicy;
import com.docflow.action.sink.LoggingNotificationSink;
import com.docflow.core.codec.WorkflowDefinitionCodec;
import com.docflow.core.exception.GuardDeniedException;
import com.docflow.core.model.EntityReference;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowTransition;
import com.docflow.core.model.guard.Actor;
import com.docflow.core.model.guard.Permission;
import com.docflow.engine.coordinator.WorkflowCoordinator;
import com.docflow.engine.event.EventLogPublisher;
import com.docflow.engine.history.ExecutionHistoryService;
import com.docflow.engine.history.ExecutionHistoryService.WorkflowAnalytics;
import com.docflow.engine.metrics.WorkflowMetrics;
import com.docflow.engine.persistence.InMemoryEventRepository;
import com.docflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.docflow.engine.persistence.InMemoryWorkflowInstanceStore;
import com.docflow.engine.service.WorkflowService.CompleteTaskRequest;
import com.docflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.docflow.scheduler.SchedulerSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Demonstration runner for the document workflow templates.
 *
 * Shows:
 * 1. Standard approval, including a publish attempt blocked by a guard
 * 2. Contract review with parallel branches, a join and a retried archive call
 * 3. Compliance review with SLA escalation and a signal ending a hold early
 * 4. Cancellation of a running instance
 * 5. Definition export and analytics
 */
public class DocumentWorkflowDemo {

    private static final Logger log = LoggerFactory.getLogger(DocumentWorkflowDemo.class);

    private static final Actor AUTHOR = Actor.of("dana");
    private static final Actor REVIEWER = Actor.withRoles("alex", "reviewer").grant(Permission.APPROVE);
    private static final Actor LEGAL = Actor.withRoles("lee", "legal");
    private static final Actor FINANCE = Actor.withRoles("fran", "finance");
    private static final Actor OFFICER = Actor.withRoles("olga", "compliance");

    private final InMemoryEventRepository events = new InMemoryEventRepository();
    private final InMemoryWorkflowInstanceStore instances = new InMemoryWorkflowInstanceStore();
    private final DocumentIntegrations integrations = new DocumentIntegrations();
    private final WorkflowMetrics metrics = new WorkflowMetrics();
    private final WorkflowCoordinator coordinator;
    private final ExecutionHistoryService history;

    public DocumentWorkflowDemo() {
        DefaultActionExecutor executor = DefaultActionExecutor.builder()
            .notificationSink(new LoggingNotificationSink())
            .integrationGateway(integrations)
            .handler(DocumentWorkflowTemplates.HANDLER_CONTRACT_REFERENCE, integrations.contractReferenceHandler())
            .retryPolicy(RetryPolicy.builder()
                .maxAttempts(4)
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(1))
                .build())
            .listener(metrics)
            .build();

        this.coordinator = WorkflowCoordinator.builder()
            .definitionRepository(new InMemoryWorkflowDefinitionRepository())
            .instanceStore(instances)
            .eventPublisher(new EventLogPublisher(events))
            .actionExecutor(executor)
            .metrics(metrics)
            .schedulerSettings(new SchedulerSettings(Duration.ofMillis(200), 50, Duration.ofSeconds(5), 3))
            .build();
        this.history = new ExecutionHistoryService(events, instances);
    }

    public static void main(String[] args) throws Exception {
        DocumentWorkflowDemo demo = new DocumentWorkflowDemo();

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║          DOCFLOW - DOCUMENT WORKFLOW DEMONSTRATION                   ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");

        try {
            demo.runScenario1_StandardApproval();
            demo.runScenario2_ContractReview();
            demo.runScenario3_ComplianceEscalation();
            demo.runScenario4_Cancellation();
            demo.runScenario5_ExportAndAnalytics();
        } finally {
            demo.coordinator.stop();
        }

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: draft, review, a blocked publish, then approval by two reviewers.
     */
    public WorkflowInstance runScenario1_StandardApproval() {
        banner("SCENARIO 1: Standard Approval");

        WorkflowDefinition definition = coordinator.publishDefinition(DocumentWorkflowTemplates.standardApproval(2));
        WorkflowInstance instance = coordinator.startWorkflow(StartWorkflowRequest.of(definition.id(),
            EntityReference.document("DOC-1001"), AUTHOR,
            DocumentWorkflowTemplates.approvalInput("Travel policy 2025", "alex", "rae")));
        UUID id = instance.instanceId();

        complete(id, DocumentWorkflowTemplates.NODE_DRAFT, Map.of(), AUTHOR);

        try {
            complete(id, DocumentWorkflowTemplates.NODE_REVIEW,
                DocumentWorkflowTemplates.reviewDecision("approve", "alex"), REVIEWER);
        } catch (GuardDeniedException e) {
            log.info("Publish blocked as expected: {}", e.getMessage());
        }

        complete(id, DocumentWorkflowTemplates.NODE_REVIEW,
            DocumentWorkflowTemplates.reviewDecision("approve", "alex", "rae"), REVIEWER);
        instance = complete(id, DocumentWorkflowTemplates.NODE_PUBLISH, Map.of(), REVIEWER);

        logHistory(instance);
        log.info("✓ SCENARIO 1 COMPLETE: {} ({})", instance.status(), instance.completionStatus());
        return instance;
    }

    /**
     * SCENARIO 2: legal and finance in parallel; the archive call survives two DMS outages.
     */
    public WorkflowInstance runScenario2_ContractReview() {
        banner("SCENARIO 2: Contract Review (parallel + join)");

        WorkflowDefinition definition = coordinator.publishDefinition(DocumentWorkflowTemplates.contractReview());
        WorkflowInstance instance = coordinator.startWorkflow(StartWorkflowRequest.of(definition.id(),
            EntityReference.document("CONTRACT-77"), AUTHOR,
            DocumentWorkflowTemplates.contractInput("Acme Corp", 250_000, "sam")));
        UUID id = instance.instanceId();

        instance = complete(id, DocumentWorkflowTemplates.NODE_INTAKE, Map.of(), AUTHOR);
        log.info("Reference {}; active branches: {}", instance.variable("contractRef"), instance.activeNodes());

        complete(id, DocumentWorkflowTemplates.NODE_FINANCE, Map.of("financeApproved", BooleanNode.TRUE), FINANCE);
        instance = complete(id, DocumentWorkflowTemplates.NODE_LEGAL, Map.of("legalApproved", BooleanNode.TRUE), LEGAL);
        log.info("Join released; now at {}", instance.activeNodes());

        integrations.simulateOutage(2);
        instance = complete(id, DocumentWorkflowTemplates.NODE_SIGNATURE, Map.of(), Actor.of("sam"));

        log.info("Archived as {} after {} DMS call(s)", instance.variable("archiveRef"), integrations.getCallCount());
        log.info("✓ SCENARIO 2 COMPLETE: {}", instance.status());
        return instance;
    }

    /**
     * SCENARIO 3: the compliance check overruns its SLA and escalates; the regulator's
     * acknowledgement then ends the hold without waiting for the timeout.
     */
    public WorkflowInstance runScenario3_ComplianceEscalation() throws InterruptedException {
        banner("SCENARIO 3: Compliance Review (SLA escalation + signal)");

        WorkflowDefinition definition = coordinator.publishDefinition(
            DocumentWorkflowTemplates.complianceReview(Duration.ofSeconds(1), Duration.ofMinutes(10)));
        WorkflowInstance instance = coordinator.startWorkflow(StartWorkflowRequest.of(definition.id(),
            EntityReference.document("FILING-9"), AUTHOR,
            DocumentWorkflowTemplates.complianceInput("GDPR", "olga")));
        UUID id = instance.instanceId();

        complete(id, DocumentWorkflowTemplates.NODE_SUBMIT, Map.of(), AUTHOR);

        coordinator.start();
        log.info("Waiting for the compliance SLA to lapse...");
        Thread.sleep(1_500);

        complete(id, DocumentWorkflowTemplates.NODE_COMPLIANCE, Map.of(), OFFICER);
        instance = coordinator.signal(id, DocumentWorkflowTemplates.SIGNAL_REGULATOR_ACK, Map.of(), Actor.of("regulator"));

        long escalations = history.getHistory(id).statistics().escalations();
        log.info("Escalations fired: {}, hold expired: {}", escalations, instance.variable("holdExpired"));
        log.info("✓ SCENARIO 3 COMPLETE: {}", instance.status());
        return instance;
    }

    /**
     * SCENARIO 4: the author withdraws a document under review.
     */
    public WorkflowInstance runScenario4_Cancellation() {
        banner("SCENARIO 4: Cancellation");

        WorkflowInstance instance = coordinator.startWorkflow(StartWorkflowRequest.latest(
            DocumentWorkflowTemplates.STANDARD_APPROVAL, EntityReference.document("DOC-1002"), AUTHOR,
            DocumentWorkflowTemplates.approvalInput("Expense policy", "alex")));
        complete(instance.instanceId(), DocumentWorkflowTemplates.NODE_DRAFT, Map.of(), AUTHOR);

        instance = coordinator.cancel(instance.instanceId(), AUTHOR, "superseded by DOC-1003");
        log.info("✓ SCENARIO 4 COMPLETE: {}", instance.status());
        return instance;
    }

    /**
     * SCENARIO 5: export a definition as JSON and summarise what ran.
     */
    public WorkflowAnalytics runScenario5_ExportAndAnalytics() {
        banner("SCENARIO 5: Export and Analytics");

        WorkflowDefinitionCodec codec = new WorkflowDefinitionCodec();
        WorkflowDefinition latest = coordinator.getLatestDefinition(DocumentWorkflowTemplates.STANDARD_APPROVAL)
            .orElseThrow();
        String json = codec.toJson(latest);
        log.info("Exported {} v{} ({} characters of JSON)", latest.name(), latest.version(), json.length());

        WorkflowAnalytics analytics = history.analyze(DocumentWorkflowTemplates.STANDARD_APPROVAL);
        log.info("{}: total={}, completed={}, cancelled={}, inProgress={}",
            analytics.definitionName(), analytics.totalInstances(), analytics.completed(),
            analytics.cancelled(), analytics.inProgress());
        analytics.bottlenecks().forEach(dwell ->
            log.info("  {} visited {} time(s), average dwell {}", dwell.nodeId(), dwell.visits(), dwell.averageDwell()));
        log.info("✓ SCENARIO 5 COMPLETE");
        return analytics;
    }

    public WorkflowCoordinator getCoordinator() {
        return coordinator;
    }

    public DocumentIntegrations getIntegrations() {
        return integrations;
    }

    // ========== Helpers ==========

    private WorkflowInstance complete(UUID instanceId, String nodeId, Map<String, JsonNode> data, Actor actor) {
        WorkflowInstance instance = coordinator.completeTask(CompleteTaskRequest.of(instanceId, nodeId, data, actor));
        log.info("{} completed {} -> active {}", actor.id(), nodeId, instance.activeNodes());
        return instance;
    }

    private void logHistory(WorkflowInstance instance) {
        for (WorkflowTransition transition : instance.history()) {
            log.info("  {} {} -> {} by {}", transition.kind(), transition.fromNode(), transition.activated(),
                transition.actor());
        }
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }
}
