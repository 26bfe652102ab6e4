package com.processflow.engine.metrics;

import com.processflow.core.test.TestDefinitions;
import com.processflow.engine.service.ProcessService.StartProcessRequest;
import com.processflow.engine.test.InMemoryEngine;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.processflow.engine.test.InMemoryEngine.ALICE;
import static org.assertj.core.api.Assertions.assertThat;

class InstanceStatusGaugesTest {

    @Test
    void gauges_shouldTrackStatusCountsAndCompletionTimer() {
        InMemoryEngine engine = new InMemoryEngine();
        new InstanceStatusGauges(engine.instanceRepository).bindTo(engine.meterRegistry);
        var definition = engine.definitions.register(TestDefinitions.implicitTerminator(), ALICE);
        var instance = engine.processes.start(StartProcessRequest.of(definition.definitionId()), ALICE);

        assertThat(gauge(engine, "running")).isEqualTo(1.0);

        engine.time.advanceMinutes(2);
        engine.processes.completeTask(instance.instanceId(), Map.of(), ALICE);
        engine.processes.completeTask(instance.instanceId(), Map.of(), ALICE);

        assertThat(gauge(engine, "running")).isZero();
        assertThat(gauge(engine, "completed")).isEqualTo(1.0);
        assertThat(engine.meterRegistry.get(ProcessMetrics.INSTANCE_DURATION)
            .tag("outcome", "completed")
            .timer()
            .count()).isEqualTo(1);
    }

    private static double gauge(InMemoryEngine engine, String status) {
        return engine.meterRegistry.get(InstanceStatusGauges.INSTANCE_COUNT).tag("status", status).gauge().value();
    }
}
