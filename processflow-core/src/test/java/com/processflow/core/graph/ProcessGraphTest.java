package com.processflow.core.graph;

import com.processflow.core.exception.NodeNotFoundException;
import com.processflow.core.model.NodeType;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.test.TestDefinitions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessGraphTest {

    @Test
    void findStartNode_shouldReturnStartNode() {
        ProcessGraph graph = ProcessGraph.of(TestDefinitions.linear());

        assertThat(graph.findStartNode()).map(ProcessNode::id).contains("start");
    }

    @Test
    void findNode_withUnknownId_shouldThrow() {
        ProcessGraph graph = ProcessGraph.of(TestDefinitions.linear());

        assertThat(graph.findNode("A").type()).isEqualTo(NodeType.TASK);
        assertThatThrownBy(() -> graph.findNode("Z"))
            .isInstanceOf(NodeNotFoundException.class)
            .hasMessageContaining("Z");
    }

    @Test
    void outgoingEdges_shouldPreserveOrder() {
        ProcessDefinition definition = ProcessDefinition.builder()
            .name("Fork")
            .nodes(List.of(
                ProcessNode.of("start", NodeType.START, "Start", "gw"),
                ProcessNode.of("gw", NodeType.GATEWAY, "Gateway", "right", "left"),
                ProcessNode.of("left", NodeType.END, "Left"),
                ProcessNode.of("right", NodeType.END, "Right")
            ))
            .build();

        assertThat(ProcessGraph.of(definition).outgoingEdges("gw")).containsExactly("right", "left");
    }

    @Test
    void reachableFrom_shouldIgnoreDanglingAndCycles() {
        ProcessDefinition definition = ProcessDefinition.builder()
            .name("Loop")
            .nodes(List.of(
                ProcessNode.of("start", NodeType.START, "Start", "A"),
                ProcessNode.of("A", NodeType.TASK, "A", "B", "missing"),
                ProcessNode.of("B", NodeType.TASK, "B", "A"),
                ProcessNode.of("orphan", NodeType.TASK, "Orphan", "B")
            ))
            .build();

        ProcessGraph graph = ProcessGraph.of(definition);

        assertThat(graph.reachableFrom("start")).containsExactlyInAnyOrder("start", "A", "B");
        assertThat(graph.reachableFrom("missing")).isEmpty();
        assertThat(graph.containsNode("missing")).isFalse();
        assertThat(graph.containsNode(null)).isFalse();
    }
}
