package com.docflow.core.model;

/**
 * Opaque pointer to the content-bearing entity a workflow instance governs.
 * The engine never dereferences it beyond asking the resolver whether it exists.
 */
public record EntityReference(String type, String id) {

    public EntityReference {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id cannot be empty");
        }
        type = type == null ? "document" : type;
    }

    public static EntityReference document(String id) {
        return new EntityReference("document", id);
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
