package com.processflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A typed step within a process definition.
 *
 * Invariants:
 * - id is unique within the definition
 * - connections are ordered; the first one is the edge taken on completion
 * - an END node needs no connections; any other node without connections terminates the process
 */
public record ProcessNode(
    String id,
    NodeType type,
    String name,
    Position position,
    JsonNode config,
    List<String> connections
) {
    public ProcessNode {
        connections = connections == null ? List.of() : List.copyOf(connections);
        position = position == null ? Position.origin() : position;
    }

    public static ProcessNode of(String id, NodeType type, String name, String... connections) {
        return new ProcessNode(id, type, name, Position.origin(), null, List.of(connections));
    }

    /**
     * Typed interpretation of {@link #config()}.
     */
    @JsonIgnore
    public NodeConfig typedConfig() {
        return NodeConfig.of(type, config);
    }

    @JsonIgnore
    public boolean isStart() {
        return type == NodeType.START;
    }

    @JsonIgnore
    public boolean isEnd() {
        return type == NodeType.END;
    }

    @JsonIgnore
    public boolean hasConnections() {
        return !connections.isEmpty();
    }
}
