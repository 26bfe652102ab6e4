package com.processflow.core.graph;

import com.processflow.core.exception.NodeNotFoundException;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessNode;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookups over a definition's nodes and connections.
 * When ids are duplicated (an invalid definition) the first node wins.
 */
public final class ProcessGraph {

    private final String definitionName;
    private final List<ProcessNode> nodes;
    private final Map<String, ProcessNode> nodesById;

    private ProcessGraph(String definitionName, List<ProcessNode> nodes) {
        this.definitionName = definitionName;
        this.nodes = nodes;
        Map<String, ProcessNode> byId = new LinkedHashMap<>();
        for (ProcessNode node : nodes) {
            byId.putIfAbsent(node.id(), node);
        }
        this.nodesById = Collections.unmodifiableMap(byId);
    }

    public static ProcessGraph of(ProcessDefinition definition) {
        return new ProcessGraph(definition.name(), definition.nodes());
    }

    /**
     * Nodes in definition order.
     */
    public List<ProcessNode> nodes() {
        return nodes;
    }

    public boolean containsNode(String nodeId) {
        return nodeId != null && nodesById.containsKey(nodeId);
    }

    public Optional<ProcessNode> lookup(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodesById.get(nodeId));
    }

    /**
     * @throws NodeNotFoundException if no node has the given id
     */
    public ProcessNode findNode(String nodeId) {
        return lookup(nodeId).orElseThrow(() -> new NodeNotFoundException(definitionName, nodeId));
    }

    public Optional<ProcessNode> findStartNode() {
        return nodes.stream().filter(ProcessNode::isStart).findFirst();
    }

    /**
     * Ordered connection targets of a node.
     */
    public List<String> outgoingEdges(String nodeId) {
        return findNode(nodeId).connections();
    }

    /**
     * Ids of all nodes reachable from the given node, including itself.
     * Connections to unknown ids are ignored.
     */
    public Set<String> reachableFrom(String nodeId) {
        Set<String> visited = new LinkedHashSet<>();
        if (!containsNode(nodeId)) {
            return visited;
        }
        Deque<String> pending = new ArrayDeque<>();
        pending.push(nodeId);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (String target : nodesById.get(current).connections()) {
                if (containsNode(target) && !visited.contains(target)) {
                    pending.push(target);
                }
            }
        }
        return visited;
    }
}
