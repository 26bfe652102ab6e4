package com.processflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessInstanceTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void duration_shouldBeNullUntilTerminal() {
        ProcessInstance running = base().build();

        assertThat(running.duration()).isNull();
        assertThat(running.isTerminal()).isFalse();
    }

    @Test
    void duration_shouldBeDerivedFromStartAndEnd() {
        ProcessInstance completed = base()
            .status(ProcessStatus.COMPLETED)
            .endTime(START.plus(Duration.ofHours(3)))
            .build();

        assertThat(completed.duration()).isEqualTo(Duration.ofHours(3));
    }

    @Test
    void constructor_shouldRejectEndTimeOnActiveStatus() {
        assertThatThrownBy(() -> base().endTime(START).build())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> base().status(ProcessStatus.CANCELLED).build())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructor_shouldDefaultPriority() {
        assertThat(base().priority(null).build().priority()).isEqualTo(Priority.MEDIUM);
    }

    private ProcessInstance.Builder base() {
        return ProcessInstance.builder()
            .definitionId(UUID.randomUUID())
            .definitionName("Linear")
            .definitionVersion("1.0.0")
            .businessKey("BK-1")
            .currentStep("A")
            .startTime(START)
            .sequenceNumber(1)
            .updatedAt(START);
    }
}
