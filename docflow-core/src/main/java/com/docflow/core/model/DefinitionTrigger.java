package com.docflow.core.model;

/**
 * Entity event that starts an instance of the owning definition, e.g. a document of type
 * {@code invoice} being {@code uploaded}.
 */
public record DefinitionTrigger(String entityType, String event) {

    public DefinitionTrigger {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("Trigger entity type cannot be empty");
        }
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("Trigger event cannot be empty");
        }
    }

    public static DefinitionTrigger on(String entityType, String event) {
        return new DefinitionTrigger(entityType, event);
    }

    public boolean matches(EntityReference entity, String eventName) {
        return entityType.equals(entity.type()) && event.equals(eventName);
    }
}
