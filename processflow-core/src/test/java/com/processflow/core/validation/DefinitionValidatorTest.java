package com.processflow.core.validation;

import com.processflow.core.exception.DefinitionValidationException;
import com.processflow.core.model.NodeType;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.test.TestDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefinitionValidatorTest {

    private final DefinitionValidator validator = new DefinitionValidator();

    @Test
    void validate_wellFormedDefinition_shouldHaveNoFindings() {
        ValidationResult result = validator.validate(TestDefinitions.invoiceApproval());

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void validate_emptyDefinition_shouldBeInvalid() {
        ValidationResult result = validator.validate(definitionOf());

        assertThat(result.hasError(ViolationType.EMPTY_DEFINITION)).isTrue();
        assertThat(result.errors()).hasSize(1);
    }

    @Test
    void validate_withoutStartNode_shouldBeInvalid() {
        ValidationResult result = validator.validate(definitionOf(
            ProcessNode.of("A", NodeType.TASK, "A", "end"),
            ProcessNode.of("end", NodeType.END, "End")
        ));

        assertThat(result.hasError(ViolationType.NO_START_NODE)).isTrue();
    }

    @Test
    void validate_withTwoStartNodes_shouldBeInvalid() {
        ValidationResult result = validator.validate(definitionOf(
            ProcessNode.of("s1", NodeType.START, "S1", "end"),
            ProcessNode.of("s2", NodeType.START, "S2", "end"),
            ProcessNode.of("end", NodeType.END, "End")
        ));

        assertThat(result.hasError(ViolationType.MULTIPLE_START_NODES)).isTrue();
    }

    @Test
    void validate_withDuplicateIds_shouldReportOncePerId() {
        ValidationResult result = validator.validate(definitionOf(
            ProcessNode.of("start", NodeType.START, "Start", "A"),
            ProcessNode.of("A", NodeType.TASK, "A", "end"),
            ProcessNode.of("A", NodeType.TASK, "A again", "end"),
            ProcessNode.of("A", NodeType.TASK, "A third", "end"),
            ProcessNode.of("end", NodeType.END, "End")
        ));

        assertThat(result.errors())
            .filteredOn(v -> v.type() == ViolationType.DUPLICATE_NODE_ID)
            .singleElement()
            .extracting(Violation::nodeId)
            .isEqualTo("A");
    }

    @Test
    @DisplayName("start -> A where A connects to missing X is rejected")
    void validate_withDanglingEdge_shouldBeInvalid() {
        ValidationResult result = validator.validate(definitionOf(
            ProcessNode.of("start", NodeType.START, "Start", "A"),
            ProcessNode.of("A", NodeType.TASK, "A", "X")
        ));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.type()).isEqualTo(ViolationType.DANGLING_EDGE);
                assertThat(v.nodeId()).isEqualTo("A");
                assertThat(v.message()).contains("X");
            });
    }

    @Test
    void validate_shouldWarnButAccept() {
        ValidationResult result = validator.validate(definitionOf(
            ProcessNode.of("start", NodeType.START, "Start", "A"),
            ProcessNode.of("A", NodeType.TASK, "A"),
            ProcessNode.of("orphan", NodeType.TASK, "Orphan", "end"),
            ProcessNode.of("end", NodeType.END, "End", "A")
        ));

        assertThat(result.isValid()).isTrue();
        assertThat(result.hasWarning(ViolationType.IMPLICIT_TERMINATOR)).isTrue();
        assertThat(result.hasWarning(ViolationType.UNREACHABLE_NODE)).isTrue();
        assertThat(result.hasWarning(ViolationType.END_NODE_WITH_CONNECTIONS)).isTrue();
    }

    @Test
    void requireValid_invalidDefinition_shouldThrowWithViolations() {
        ProcessDefinition invalid = definitionOf();

        assertThatThrownBy(() -> validator.requireValid(invalid))
            .isInstanceOf(DefinitionValidationException.class)
            .satisfies(e -> assertThat(((DefinitionValidationException) e).getViolations())
                .extracting(Violation::type)
                .containsExactly(ViolationType.EMPTY_DEFINITION));
    }

    private static ProcessDefinition definitionOf(ProcessNode... nodes) {
        return ProcessDefinition.builder()
            .name("Under test")
            .nodes(List.of(nodes))
            .build();
    }
}
