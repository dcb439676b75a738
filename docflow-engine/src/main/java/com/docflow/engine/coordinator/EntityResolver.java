package com.docflow.engine.coordinator;

import com.docflow.core.model.EntityReference;

/**
 * Answers whether the entity a workflow is started for exists. The engine never reads the
 * entity's content.
 */
@FunctionalInterface
public interface EntityResolver {

    EntityResolver ACCEPT_ALL = entity -> true;

    boolean exists(EntityReference entity);
}
