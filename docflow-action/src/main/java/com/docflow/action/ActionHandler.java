package com.docflow.action;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of a {@code custom} action, registered by handler name.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Run the action.
     *
     * @return null, or an object whose fields are written back as instance variables
     * @throws ActionException if the action fails
     */
    JsonNode handle(ActionContext context) throws ActionException;
}
