package com.docflow.core.codec;

import com.docflow.core.exception.WorkflowDefinitionException;
import com.docflow.core.model.DefinitionTrigger;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.action.Action;
import com.docflow.core.model.graph.Condition;
import com.docflow.core.model.graph.DecisionNode;
import com.docflow.core.model.graph.NodeType;
import com.docflow.core.model.graph.TaskNode;
import com.docflow.core.model.guard.Guard;
import com.docflow.core.test.SampleDefinitions;
import com.docflow.core.validation.DefinitionProblem;
import com.docflow.core.validation.DefinitionValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class WorkflowDefinitionCodecTest {

    private static final String INVOICE_APPROVAL = """
        {
          "id": "c6a1f0e2-invoice",
          "name": "invoice-approval",
          "version": "2.1.0",
          "triggers": [
            { "entityType": "invoice", "event": "uploaded" }
          ],
          "variables": [
            { "name": "amount", "type": "NUMBER", "required": true }
          ],
          "graph": {
            "nodes": [
              { "type": "start", "id": "start" },
              { "type": "task", "id": "check", "name": "Check invoice",
                "kind": "REVIEW",
                "assignees": { "type": "ROLE", "values": ["accounts"] },
                "sla": "PT8H",
                "entryGuards": [
                  { "type": "allOf", "guards": [
                    { "type": "role", "role": "clerk" },
                    { "type": "permission", "permission": "REVIEW" }
                  ] }
                ],
                "exitActions": [
                  { "type": "notify", "id": "tell-finance", "template": "invoice-checked",
                    "channel": "CHAT", "recipients": ["finance"] }
                ] },
              { "type": "decision", "id": "size",
                "branches": [
                  { "name": "large", "condition": { "type": "expression", "expression": "amount > 10000" },
                    "edgeId": "size-cfo" }
                ],
                "defaultEdgeId": "size-done" },
              { "type": "task", "id": "cfo", "assignees": { "type": "FIXED", "values": ["carol"] } },
              { "type": "end", "id": "done", "status": "SUCCESS" }
            ],
            "edges": [
              { "id": "start-check", "source": "start", "target": "check" },
              { "id": "check-size", "source": "check", "target": "size" },
              { "id": "size-cfo", "source": "size", "target": "cfo" },
              { "id": "size-done", "source": "size", "target": "done" },
              { "id": "cfo-done", "source": "cfo", "target": "done" }
            ]
          }
        }
        """;

    private final WorkflowDefinitionCodec codec = new WorkflowDefinitionCodec();

    @Test
    @DisplayName("Typed nodes, guards and actions are read from their discriminators")
    void fromJson_shouldReadPolymorphicGraph() {
        WorkflowDefinition definition = codec.fromJson(INVOICE_APPROVAL);

        assertThat(definition.key()).isEqualTo("invoice-approval@2.1.0");
        assertThat(definition.graph().nodes()).hasSize(5);
        assertThat(definition.graph().node("size").nodeType()).isEqualTo(NodeType.DECISION);
        assertThat(definition.triggers()).containsExactly(DefinitionTrigger.on("invoice", "uploaded"));

        TaskNode check = (TaskNode) definition.graph().node("check");
        assertThat(check.sla()).isEqualTo(Duration.ofHours(8));
        assertThat(check.entryGuards()).hasSize(1);
        assertThat(check.entryGuards().get(0)).isInstanceOf(Guard.AllOf.class);
        assertThat(check.exitActions().get(0)).isInstanceOf(Action.Notify.class);

        DecisionNode size = (DecisionNode) definition.graph().node("size");
        assertThat(size.branches().get(0).condition())
            .isEqualTo(Condition.expression("amount > 10000"));

        assertThat(new DefinitionValidator().validate(definition).valid()).isTrue();
    }

    @Test
    void toJson_thenFromJson_shouldPreserveDefinition() {
        WorkflowDefinition original = SampleDefinitions.reviewWorkflow(Duration.ofHours(2));

        WorkflowDefinition copy = codec.fromJson(codec.toJson(original));

        assertThat(copy.graph()).isEqualTo(original.graph());
        assertThat(copy.variables()).isEqualTo(original.variables());
        assertThat(copy.cancellationActions()).isEqualTo(original.cancellationActions());
        assertThat(copy.version()).isEqualTo(original.version());
    }

    @Test
    void unknownNodeType_shouldBeParseError() {
        String json = INVOICE_APPROVAL.replace("\"type\": \"decision\"", "\"type\": \"lottery\"");

        assertThatThrownBy(() -> codec.fromJson(json))
            .isInstanceOf(WorkflowDefinitionException.class)
            .satisfies(e -> assertThat(((WorkflowDefinitionException) e)
                .hasProblem(DefinitionProblem.PARSE_ERROR)).isTrue());
    }

    @Test
    void duplicateNodeIds_shouldSurfaceGraphProblem() {
        String json = INVOICE_APPROVAL.replace("\"id\": \"cfo\"", "\"id\": \"check\"");

        assertThatThrownBy(() -> codec.fromJson(json))
            .isInstanceOf(WorkflowDefinitionException.class)
            .satisfies(e -> assertThat(((WorkflowDefinitionException) e)
                .hasProblem(DefinitionProblem.DUPLICATE_ID)).isTrue());
    }
}
