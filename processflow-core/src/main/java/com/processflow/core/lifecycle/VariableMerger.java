package com.processflow.core.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shallow last-write-wins merge of instance variables.
 * Keys absent from the update are kept; nested values are replaced whole.
 */
public final class VariableMerger {

    private VariableMerger() {
    }

    public static Map<String, JsonNode> merge(Map<String, JsonNode> current, Map<String, JsonNode> updates) {
        Map<String, JsonNode> merged = new LinkedHashMap<>(current);
        if (updates != null) {
            merged.putAll(updates);
        }
        return merged;
    }

    /**
     * Keys of the update whose value differs from the current one, in update order.
     */
    public static List<String> changedKeys(Map<String, JsonNode> current, Map<String, JsonNode> updates) {
        if (updates == null) {
            return List.of();
        }
        return updates.entrySet().stream()
            .filter(e -> !current.containsKey(e.getKey()) || !Objects.equals(current.get(e.getKey()), e.getValue()))
            .map(Map.Entry::getKey)
            .toList();
    }
}
