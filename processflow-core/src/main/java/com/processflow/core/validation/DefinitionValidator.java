package com.processflow.core.validation;

import com.processflow.core.exception.DefinitionValidationException;
import com.processflow.core.graph.ProcessGraph;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks over a definition graph.
 * Run when a definition is activated and again when an instance is started.
 *
 * Errors:
 * - at least one node
 * - exactly one start node
 * - unique node ids
 * - every connection targets an existing node
 *
 * Warnings:
 * - non-end node without connections (terminates the process implicitly)
 * - node not reachable from the start node
 * - end node with outgoing connections (never followed)
 */
public class DefinitionValidator {

    public ValidationResult validate(ProcessDefinition definition) {
        List<ProcessNode> nodes = definition.nodes();
        List<Violation> findings = new ArrayList<>();

        if (nodes.isEmpty()) {
            findings.add(Violation.of(ViolationType.EMPTY_DEFINITION,
                "Process definition has no nodes"));
            return ValidationResult.of(findings);
        }

        Set<String> ids = new HashSet<>();
        Set<String> reportedDuplicates = new HashSet<>();
        for (ProcessNode node : nodes) {
            if (!ids.add(node.id()) && reportedDuplicates.add(node.id())) {
                findings.add(Violation.atNode(ViolationType.DUPLICATE_NODE_ID, node.id(),
                    String.format("Node id '%s' is used more than once", node.id())));
            }
        }

        List<ProcessNode> startNodes = nodes.stream().filter(ProcessNode::isStart).toList();
        if (startNodes.isEmpty()) {
            findings.add(Violation.of(ViolationType.NO_START_NODE,
                "Process definition has no start node"));
        } else if (startNodes.size() > 1) {
            findings.add(Violation.of(ViolationType.MULTIPLE_START_NODES, String.format(
                "Process definition has %d start nodes: %s",
                startNodes.size(), startNodes.stream().map(ProcessNode::id).toList())));
        }

        for (ProcessNode node : nodes) {
            for (String target : node.connections()) {
                if (!ids.contains(target)) {
                    findings.add(Violation.atNode(ViolationType.DANGLING_EDGE, node.id(), String.format(
                        "Node '%s' connects to unknown node '%s'", node.id(), target)));
                }
            }
            if (node.isEnd() && node.hasConnections()) {
                findings.add(Violation.atNode(ViolationType.END_NODE_WITH_CONNECTIONS, node.id(), String.format(
                    "End node '%s' has outgoing connections that are never followed", node.id())));
            } else if (!node.isEnd() && !node.hasConnections()) {
                findings.add(Violation.atNode(ViolationType.IMPLICIT_TERMINATOR, node.id(), String.format(
                    "Node '%s' has no connections and will complete the process", node.id())));
            }
        }

        if (startNodes.size() == 1) {
            Set<String> reachable = ProcessGraph.of(definition).reachableFrom(startNodes.get(0).id());
            Set<String> reported = new LinkedHashSet<>();
            for (ProcessNode node : nodes) {
                if (!reachable.contains(node.id()) && reported.add(node.id())) {
                    findings.add(Violation.atNode(ViolationType.UNREACHABLE_NODE, node.id(), String.format(
                        "Node '%s' is not reachable from the start node", node.id())));
                }
            }
        }

        return ValidationResult.of(findings);
    }

    /**
     * Validate and throw if the definition has errors.
     */
    public ValidationResult requireValid(ProcessDefinition definition) {
        ValidationResult result = validate(definition);
        if (!result.isValid()) {
            throw new DefinitionValidationException(definition.name(), result.errors());
        }
        return result;
    }
}
