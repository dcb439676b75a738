package com.docflow.core.codec;

import com.docflow.core.exception.WorkflowDefinitionException;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.validation.DefinitionProblem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Portable JSON form of workflow definitions.
 *
 * Nodes, guards, actions and conditions are written with a {@code "type"} discriminator, e.g.
 * <pre>
 * { "type": "task", "id": "review", "sla": "PT1H", "entryGuards": [ { "type": "role", "role": "reviewer" } ] }
 * </pre>
 * Parsing does not validate structure; run the result through the validator before publishing.
 */
public class WorkflowDefinitionCodec {

    private final ObjectMapper objectMapper;

    public WorkflowDefinitionCodec() {
        this(JsonSupport.newObjectMapper());
    }

    public WorkflowDefinitionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(WorkflowDefinition definition) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize definition " + definition.key(), e);
        }
    }

    /**
     * @throws WorkflowDefinitionException with a PARSE_ERROR problem if the document is malformed
     */
    public WorkflowDefinition fromJson(String json) {
        try {
            return objectMapper.readValue(json, WorkflowDefinition.class);
        } catch (WorkflowDefinitionException e) {
            throw e;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw parseError(e);
        }
    }

    public WorkflowDefinition fromJson(InputStream json) {
        try {
            return objectMapper.readValue(json, WorkflowDefinition.class);
        } catch (WorkflowDefinitionException e) {
            throw e;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw parseError(e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow definition", e);
        }
    }

    private WorkflowDefinitionException parseError(Exception e) {
        // Constructor failures from records arrive wrapped; surface the graph's own problem list.
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof WorkflowDefinitionException) {
                return (WorkflowDefinitionException) cause;
            }
            cause = cause.getCause();
        }
        return new WorkflowDefinitionException("<json>",
            new DefinitionProblem(DefinitionProblem.PARSE_ERROR, null, e.getMessage()), e);
    }
}
