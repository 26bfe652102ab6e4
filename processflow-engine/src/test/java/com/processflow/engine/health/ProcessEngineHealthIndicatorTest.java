package com.processflow.engine.health;

import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.InstanceQuery;
import com.processflow.core.repository.ProcessInstanceRepository;
import com.processflow.core.test.TestDefinitions;
import com.processflow.engine.service.ProcessService.StartProcessRequest;
import com.processflow.engine.test.InMemoryEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.processflow.engine.test.InMemoryEngine.ALICE;
import static org.assertj.core.api.Assertions.assertThat;

class ProcessEngineHealthIndicatorTest {

    @Test
    void reachableStore_shouldReportUpWithCounts() {
        InMemoryEngine engine = new InMemoryEngine();
        var definition = engine.definitions.register(TestDefinitions.linear(), ALICE);
        var instance = engine.processes.start(StartProcessRequest.of(definition.definitionId()), ALICE);
        engine.processes.suspend(instance.instanceId(), ALICE);
        engine.processes.start(StartProcessRequest.of(definition.definitionId()), ALICE);

        Health health = new ProcessEngineHealthIndicator(engine.instanceRepository).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("running", 1L)
            .containsEntry("suspended", 1L)
            .containsEntry("completed", 0L);
    }

    @Test
    void failingStore_shouldReportDown() {
        Health health = new ProcessEngineHealthIndicator(new UnreachableRepository()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("repository", "unreachable");
        assertThat(health.getDetails().get("error").toString()).contains("connection refused");
    }

    private static class UnreachableRepository implements ProcessInstanceRepository {

        @Override
        public void create(ProcessInstance instance, AuditEntry firstEntry) {
            throw failure();
        }

        @Override
        public void commit(ProcessInstance updated, AuditEntry entry, long expectedSequence) {
            throw failure();
        }

        @Override
        public Optional<ProcessInstance> findById(UUID instanceId) {
            throw failure();
        }

        @Override
        public List<ProcessInstance> query(InstanceQuery query) {
            throw failure();
        }

        @Override
        public long countActiveByDefinition(UUID definitionId) {
            throw failure();
        }

        @Override
        public Map<ProcessStatus, Long> countByStatus() {
            throw failure();
        }

        private static IllegalStateException failure() {
            return new IllegalStateException("connection refused");
        }
    }
}
