package com.processflow.core.lifecycle;

import com.processflow.core.exception.CurrentStepNotFoundException;
import com.processflow.core.exception.DefinitionIntegrityException;
import com.processflow.core.model.NodeType;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.test.TestDefinitions;
import com.processflow.core.test.TimeController;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepAdvancerTest {

    private final StepAdvancer advancer = new StepAdvancer();
    private final LifecycleStateMachine machine = new LifecycleStateMachine(new TimeController());

    @Test
    void advance_shouldFollowFirstConnection() {
        ProcessDefinition definition = ProcessDefinition.builder()
            .name("Fork")
            .nodes(List.of(
                ProcessNode.of("start", NodeType.START, "Start", "gw"),
                ProcessNode.of("gw", NodeType.GATEWAY, "Gateway", "second", "first"),
                ProcessNode.of("first", NodeType.END, "First"),
                ProcessNode.of("second", NodeType.TASK, "Second", "first")
            ))
            .build();
        ProcessInstance atGateway = at(definition, "gw");

        StepAdvancer.Advance advance = advancer.advance(atGateway, definition);

        assertThat(advance.completedStep().id()).isEqualTo("gw");
        assertThat(advance.nextStep()).isEqualTo("second");
        assertThat(advance.completes()).isFalse();
    }

    @Test
    void advance_intoEndNode_shouldComplete() {
        ProcessDefinition definition = TestDefinitions.linear();

        StepAdvancer.Advance advance = advancer.advance(at(definition, "B"), definition);

        assertThat(advance.nextStep()).isEqualTo("end");
        assertThat(advance.completes()).isTrue();
    }

    @Test
    void advance_currentStepRemovedFromDefinition_shouldRaiseDrift() {
        ProcessDefinition original = TestDefinitions.linear();
        ProcessInstance atA = at(original, "A");
        ProcessDefinition edited = original.toBuilder()
            .nodes(List.of(
                ProcessNode.of("start", NodeType.START, "Start", "B"),
                ProcessNode.of("B", NodeType.TASK, "Task B", "end"),
                ProcessNode.of("end", NodeType.END, "End")
            ))
            .build();

        assertThatThrownBy(() -> advancer.advance(atA, edited))
            .isInstanceOf(CurrentStepNotFoundException.class)
            .isInstanceOf(DefinitionIntegrityException.class)
            .hasMessageContaining("'A'");
    }

    @Test
    void advance_nextTargetMissing_shouldRaiseIntegrityError() {
        ProcessDefinition original = TestDefinitions.linear();
        ProcessInstance atA = at(original, "A");
        ProcessDefinition edited = original.toBuilder()
            .nodes(List.of(
                ProcessNode.of("start", NodeType.START, "Start", "A"),
                ProcessNode.of("A", NodeType.TASK, "Task A", "gone")
            ))
            .build();

        assertThatThrownBy(() -> advancer.advance(atA, edited))
            .isInstanceOf(DefinitionIntegrityException.class)
            .isNotInstanceOf(CurrentStepNotFoundException.class)
            .hasMessageContaining("gone");
    }

    private ProcessInstance at(ProcessDefinition definition, String step) {
        ProcessInstance started = machine.start(
            definition.toBuilder().nodes(TestDefinitions.linear().nodes()).build(),
            TestDefinitions.startCommand("BK")).updated();
        return started.toBuilder().definitionId(definition.definitionId()).currentStep(step).build();
    }
}
