package com.docflow.examples.approval;

import com.docflow.core.model.VariableDefinition;
import com.docflow.core.model.VariableType;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.action.Action;
import com.docflow.core.model.action.EscalationRule;
import com.docflow.core.model.action.NotificationChannel;
import com.docflow.core.model.graph.AssigneeRule;
import com.docflow.core.model.graph.CompletionStatus;
import com.docflow.core.model.graph.Condition;
import com.docflow.core.model.graph.DecisionNode;
import com.docflow.core.model.graph.EndNode;
import com.docflow.core.model.graph.JoinNode;
import com.docflow.core.model.graph.ParallelNode;
import com.docflow.core.model.graph.StartNode;
import com.docflow.core.model.graph.TaskKind;
import com.docflow.core.model.graph.TaskNode;
import com.docflow.core.model.graph.TimerNode;
import com.docflow.core.model.graph.WorkflowGraph;
import com.docflow.core.model.guard.Guard;
import com.docflow.core.model.guard.Permission;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-made document workflows.
 *
 * <ul>
 *   <li>{@link #standardApproval(int)}: draft, review, decision; publishing needs the
 *       APPROVE permission and a number of distinct approvers</li>
 *   <li>{@link #contractReview()}: intake assigns a contract reference, then legal and finance
 *       review in parallel, joined before signature; the signed contract is archived</li>
 *   <li>{@link #complianceReview(Duration, Duration)}: review under an SLA with repeated
 *       escalation, then a waiting period ended early by the regulator's acknowledgement</li>
 * </ul>
 */
public final class DocumentWorkflowTemplates {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String STANDARD_APPROVAL = "standard-approval";
    public static final String CONTRACT_REVIEW = "contract-review";
    public static final String COMPLIANCE_REVIEW = "compliance-review";

    // Node IDs
    public static final String NODE_DRAFT = "draft";
    public static final String NODE_REVIEW = "review";
    public static final String NODE_PUBLISH = "publish";
    public static final String NODE_INTAKE = "intake";
    public static final String NODE_LEGAL = "legal-review";
    public static final String NODE_FINANCE = "finance-review";
    public static final String NODE_SIGNATURE = "signature";
    public static final String NODE_SUBMIT = "submit";
    public static final String NODE_COMPLIANCE = "compliance-check";
    public static final String NODE_HOLD = "regulator-hold";

    // Signals
    public static final String SIGNAL_REGULATOR_ACK = "regulator-ack";

    // Integrations
    public static final String DMS = "dms";
    public static final String HANDLER_CONTRACT_REFERENCE = "contract-reference";

    private DocumentWorkflowTemplates() {
    }

    /**
     * start -> draft -> review -> decide; approve -> publish -> published,
     * reject -> draft, anything else -> review.
     *
     * @param requiredApprovals distinct entries needed in the {@code approvals} variable to publish
     */
    public static WorkflowDefinition standardApproval(int requiredApprovals) {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node(StartNode.of("start"))
            .node(TaskNode.builder(NODE_DRAFT)
                .name("Draft document")
                .assignees(AssigneeRule.initiator())
                .build())
            .node(TaskNode.builder(NODE_REVIEW)
                .name("Review document")
                .kind(TaskKind.REVIEW)
                .assignees(AssigneeRule.variable("reviewers"))
                .onEntry(Action.notify("notify-reviewers", "review-requested", "${reviewers}"))
                .build())
            .node(DecisionNode.builder("decide")
                .name("Review outcome")
                .branch("approve", Condition.expression("decision == 'approve'"), "decide-publish")
                .branch("reject", Condition.expression("decision == 'reject'"), "decide-draft")
                .otherwise("decide-review")
                .build())
            .node(TaskNode.builder(NODE_PUBLISH)
                .name("Publish document")
                .kind(TaskKind.INTEGRATION)
                .assignees(AssigneeRule.role("publisher"))
                .guard(Guard.allOf(
                    Guard.permission(Permission.APPROVE),
                    new Guard.ApprovalCount(requiredApprovals, "approvals")))
                .onEntry(Action.notify("notify-approved", "document-approved", "${initiator}"))
                .build())
            .node(new EndNode("published", "Published", CompletionStatus.SUCCESS,
                List.of(Action.invoke("publish-document", DMS, "publish"))))
            .edge("start-draft", "start", NODE_DRAFT)
            .edge("draft-review", NODE_DRAFT, NODE_REVIEW)
            .edge("review-decide", NODE_REVIEW, "decide")
            .edge("decide-publish", "decide", NODE_PUBLISH)
            .edge("decide-draft", "decide", NODE_DRAFT)
            .edge("decide-review", "decide", NODE_REVIEW)
            .edge("publish-published", NODE_PUBLISH, "published")
            .build();

        return WorkflowDefinition.builder()
            .name(STANDARD_APPROVAL)
            .description("Draft, review and publish a document")
            .graph(graph)
            .variable(VariableDefinition.required("title", VariableType.STRING))
            .variable(VariableDefinition.required("reviewers", VariableType.ARRAY))
            .variable(VariableDefinition.optional("decision", VariableType.STRING, null))
            .variable(VariableDefinition.optional("approvals", VariableType.ARRAY, mapper.createArrayNode()))
            .cancellationAction(Action.notify("notify-withdrawn", "document-withdrawn", "${initiator}"))
            .build();
    }

    /**
     * start -> intake -> split -> (legal-review, finance-review) -> join -> check;
     * both approved -> signature -> signed, otherwise -> returned.
     */
    public static WorkflowDefinition contractReview() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node(StartNode.of("start"))
            .node(TaskNode.builder(NODE_INTAKE)
                .name("Contract intake")
                .assignees(AssigneeRule.initiator())
                .onExit(new Action.Custom("assign-reference", HANDLER_CONTRACT_REFERENCE, null))
                .build())
            .node(ParallelNode.of("split"))
            .node(TaskNode.builder(NODE_LEGAL)
                .name("Legal review")
                .kind(TaskKind.REVIEW)
                .assignees(AssigneeRule.role("legal"))
                .sla(Duration.ofDays(3))
                .build())
            .node(TaskNode.builder(NODE_FINANCE)
                .name("Finance review")
                .kind(TaskKind.REVIEW)
                .assignees(AssigneeRule.role("finance"))
                .sla(Duration.ofDays(2))
                .build())
            .node(JoinNode.of("join", 2))
            .node(DecisionNode.builder("check")
                .branch("approved", Condition.expression("legalApproved == true && financeApproved == true"),
                    "check-signature")
                .otherwise("check-returned")
                .build())
            .node(TaskNode.builder(NODE_SIGNATURE)
                .name("Sign contract")
                .assignees(AssigneeRule.variable("signatory"))
                .onEntry(new Action.Notify("request-signature", "signature-requested",
                    NotificationChannel.IN_APP, List.of("${signatory}")))
                .onExit(new Action.InvokeExternal("archive-contract", DMS, "archive", null, "archiveRef"))
                .build())
            .node(EndNode.of("signed"))
            .node(new EndNode("returned", "Returned to requester", CompletionStatus.WARNING,
                List.of(Action.notify("notify-returned", "contract-returned", "${initiator}"))))
            .edge("start-intake", "start", NODE_INTAKE)
            .edge("intake-split", NODE_INTAKE, "split")
            .edge("split-legal", "split", NODE_LEGAL)
            .edge("split-finance", "split", NODE_FINANCE)
            .edge("legal-join", NODE_LEGAL, "join")
            .edge("finance-join", NODE_FINANCE, "join")
            .edge("join-check", "join", "check")
            .edge("check-signature", "check", NODE_SIGNATURE)
            .edge("check-returned", "check", "returned")
            .edge("signature-signed", NODE_SIGNATURE, "signed")
            .build();

        return WorkflowDefinition.builder()
            .name(CONTRACT_REVIEW)
            .description("Parallel legal and finance review of a contract before signature")
            .graph(graph)
            .variable(VariableDefinition.required("counterparty", VariableType.STRING))
            .variable(VariableDefinition.required("contractValue", VariableType.NUMBER))
            .variable(VariableDefinition.required("signatory", VariableType.STRING))
            .variable(VariableDefinition.optional("legalApproved", VariableType.BOOLEAN, BooleanNode.FALSE))
            .variable(VariableDefinition.optional("financeApproved", VariableType.BOOLEAN, BooleanNode.FALSE))
            .build();
    }

    /**
     * start -> submit -> compliance-check -> regulator-hold -> cleared.
     *
     * The check escalates to the compliance lead once {@code sla} elapses and again every
     * {@code sla} after that, twice at most. The hold ends after {@code holdPeriod}, or earlier
     * on the {@value #SIGNAL_REGULATOR_ACK} signal; a timeout marks {@code holdExpired}.
     */
    public static WorkflowDefinition complianceReview(Duration sla, Duration holdPeriod) {
        EscalationRule escalation = EscalationRule.repeating(sla, sla, 2, List.of("compliance-lead"),
            new Action.Escalate("escalate-check", List.of(), "Compliance check overdue"),
            Action.notify("notify-officer", "compliance-overdue", "${complianceOfficer}"));

        TimerNode hold = new TimerNode(NODE_HOLD, "Regulator hold", holdPeriod, SIGNAL_REGULATOR_ACK,
            List.of(Action.setVariable("mark-expired", "holdExpired", BooleanNode.TRUE)),
            List.of());

        WorkflowGraph graph = WorkflowGraph.builder()
            .node(StartNode.of("start"))
            .node(TaskNode.builder(NODE_SUBMIT)
                .name("Submit for compliance")
                .assignees(AssigneeRule.initiator())
                .build())
            .node(TaskNode.builder(NODE_COMPLIANCE)
                .name("Compliance check")
                .kind(TaskKind.REVIEW)
                .assignees(AssigneeRule.variable("complianceOfficer"))
                .escalation(escalation)
                .build())
            .node(hold)
            .node(EndNode.of("cleared"))
            .edge("start-submit", "start", NODE_SUBMIT)
            .edge("submit-check", NODE_SUBMIT, NODE_COMPLIANCE)
            .edge("check-hold", NODE_COMPLIANCE, NODE_HOLD)
            .edge("hold-cleared", NODE_HOLD, "cleared")
            .build();

        return WorkflowDefinition.builder()
            .name(COMPLIANCE_REVIEW)
            .description("Compliance review with escalation and a regulator hold period")
            .graph(graph)
            .variable(VariableDefinition.required("regulation", VariableType.STRING))
            .variable(VariableDefinition.required("complianceOfficer", VariableType.STRING))
            .variable(VariableDefinition.optional("holdExpired", VariableType.BOOLEAN, BooleanNode.FALSE))
            .build();
    }

    // ========== Sample inputs ==========

    public static Map<String, JsonNode> approvalInput(String title, String... reviewers) {
        ArrayNode reviewerList = mapper.createArrayNode();
        for (String reviewer : reviewers) {
            reviewerList.add(reviewer);
        }
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        variables.put("title", TextNode.valueOf(title));
        variables.put("reviewers", reviewerList);
        return variables;
    }

    public static Map<String, JsonNode> reviewDecision(String decision, String... approvers) {
        ArrayNode approvals = mapper.createArrayNode();
        for (String approver : approvers) {
            approvals.add(approver);
        }
        Map<String, JsonNode> data = new LinkedHashMap<>();
        data.put("decision", TextNode.valueOf(decision));
        data.put("approvals", approvals);
        return data;
    }

    public static Map<String, JsonNode> contractInput(String counterparty, long value, String signatory) {
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        variables.put("counterparty", TextNode.valueOf(counterparty));
        variables.put("contractValue", mapper.getNodeFactory().numberNode(value));
        variables.put("signatory", TextNode.valueOf(signatory));
        return variables;
    }

    public static Map<String, JsonNode> complianceInput(String regulation, String officer) {
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        variables.put("regulation", TextNode.valueOf(regulation));
        variables.put("complianceOfficer", TextNode.valueOf(officer));
        return variables;
    }
}
