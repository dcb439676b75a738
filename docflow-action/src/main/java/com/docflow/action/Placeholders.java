package com.docflow.action;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@code ${name}} recipient entries against instance variables.
 *
 * A string variable yields one recipient, an array variable one per element.
 * {@code ${initiator}} falls back to the instance initiator when no variable of that name
 * exists. Unresolvable placeholders are dropped.
 */
final class Placeholders {

    static final String INITIATOR = "initiator";

    private Placeholders() {
    }

    static List<String> resolve(List<String> entries, Map<String, JsonNode> variables, String initiator) {
        List<String> resolved = new ArrayList<>();
        for (String entry : entries) {
            if (!isPlaceholder(entry)) {
                resolved.add(entry);
                continue;
            }
            String name = entry.substring(2, entry.length() - 1);
            JsonNode value = variables.get(name);
            if (value != null && value.isArray()) {
                value.forEach(element -> {
                    if (element.isValueNode() && !element.isNull()) {
                        resolved.add(element.asText());
                    }
                });
            } else if (value != null && value.isValueNode() && !value.isNull()) {
                resolved.add(value.asText());
            } else if (INITIATOR.equals(name) && initiator != null) {
                resolved.add(initiator);
            }
        }
        return resolved.stream().distinct().toList();
    }

    static boolean isPlaceholder(String entry) {
        return entry.startsWith("${") && entry.endsWith("}") && entry.length() > 3;
    }
}
