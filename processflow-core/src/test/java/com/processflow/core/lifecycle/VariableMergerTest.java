package com.processflow.core.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.processflow.core.test.TestDefinitions.json;
import static com.processflow.core.test.TestDefinitions.number;
import static com.processflow.core.test.TestDefinitions.text;
import static org.assertj.core.api.Assertions.assertThat;

class VariableMergerTest {

    @Test
    void merge_shouldBeShallowLastWriteWins() {
        Map<String, JsonNode> current = Map.of(
            "a", number(1),
            "nested", json("{\"x\":1,\"y\":2}"));

        Map<String, JsonNode> merged = VariableMerger.merge(current, Map.of(
            "b", text("new"),
            "nested", json("{\"x\":9}")));

        assertThat(merged)
            .containsEntry("a", number(1))
            .containsEntry("b", text("new"))
            .containsEntry("nested", json("{\"x\":9}"));
    }

    @Test
    void merge_withNullUpdate_shouldKeepCurrent() {
        assertThat(VariableMerger.merge(Map.of("a", number(1)), null)).containsOnlyKeys("a");
    }

    @Test
    void changedKeys_shouldIgnoreEqualValues() {
        Map<String, JsonNode> current = Map.of("a", number(1), "b", text("x"));

        assertThat(VariableMerger.changedKeys(current, Map.of("a", number(1)))).isEmpty();
        assertThat(VariableMerger.changedKeys(current, Map.of("a", number(2), "c", text("new"))))
            .containsExactlyInAnyOrder("a", "c");
    }
}
