package com.processflow.engine.coordinator;

import com.processflow.core.exception.OptimisticLockException;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.InstanceQuery;
import com.processflow.core.repository.ProcessInstanceRepository;
import com.processflow.core.test.TestDefinitions;
import com.processflow.engine.metrics.ProcessMetrics;
import com.processflow.engine.service.ProcessService.StartProcessRequest;
import com.processflow.engine.test.InMemoryEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.processflow.engine.test.InMemoryEngine.ALICE;
import static com.processflow.engine.test.InMemoryEngine.BOB;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two writers read the same instance version before either commits.
 */
class ConcurrentCompletionTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @Timeout(10)
    void racingCompletions_shouldAdmitExactlyOneWriter() throws Exception {
        BarrierRepository.Holder holder = new BarrierRepository.Holder();
        InMemoryEngine engine = new InMemoryEngine(repository -> holder.wrap(repository));
        ProcessDefinition definition = engine.definitions.register(TestDefinitions.linear(), ALICE);
        ProcessInstance instance = engine.processes.start(StartProcessRequest.of(definition.definitionId()), ALICE);

        holder.repository.arm(2);
        Future<ProcessInstance> first = executor.submit(
            () -> engine.processes.completeTask(instance.instanceId(), Map.of(), ALICE));
        Future<ProcessInstance> second = executor.submit(
            () -> engine.processes.completeTask(instance.instanceId(), Map.of(), BOB));

        List<ProcessInstance> winners = new ArrayList<>();
        List<Throwable> losers = new ArrayList<>();
        for (Future<ProcessInstance> outcome : List.of(first, second)) {
            try {
                winners.add(outcome.get(5, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                losers.add(e.getCause());
            }
        }

        assertThat(winners).hasSize(1);
        assertThat(losers).singleElement().isInstanceOf(OptimisticLockException.class);

        ProcessInstance stored = engine.instanceRepository.findById(instance.instanceId()).orElseThrow();
        assertThat(stored.sequenceNumber()).isEqualTo(2);
        assertThat(stored.currentStep()).isEqualTo("A");
        assertThat(stored.status()).isEqualTo(ProcessStatus.RUNNING);
        assertThat(engine.auditRepository.findByInstance(instance.instanceId()))
            .extracting(AuditEntry::sequenceNumber)
            .containsExactly(1L, 2L);
        assertThat(engine.meterRegistry.counter(ProcessMetrics.CONFLICTS, "operation", "task_completed").count())
            .isEqualTo(1.0);
    }

    /**
     * Holds readers at a barrier once armed so that every party sees the same version.
     */
    static class BarrierRepository implements ProcessInstanceRepository {

        private final ProcessInstanceRepository delegate;
        private volatile CyclicBarrier barrier;

        BarrierRepository(ProcessInstanceRepository delegate) {
            this.delegate = delegate;
        }

        void arm(int parties) {
            this.barrier = new CyclicBarrier(parties);
        }

        @Override
        public Optional<ProcessInstance> findById(UUID instanceId) {
            Optional<ProcessInstance> found = delegate.findById(instanceId);
            CyclicBarrier current = barrier;
            if (current != null) {
                try {
                    current.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("Readers did not meet at the barrier", e);
                }
            }
            return found;
        }

        @Override
        public void create(ProcessInstance instance, AuditEntry firstEntry) {
            delegate.create(instance, firstEntry);
        }

        @Override
        public void commit(ProcessInstance updated, AuditEntry entry, long expectedSequence) {
            delegate.commit(updated, entry, expectedSequence);
        }

        @Override
        public List<ProcessInstance> query(InstanceQuery query) {
            return delegate.query(query);
        }

        @Override
        public long countActiveByDefinition(UUID definitionId) {
            return delegate.countActiveByDefinition(definitionId);
        }

        @Override
        public Map<ProcessStatus, Long> countByStatus() {
            return delegate.countByStatus();
        }

        static class Holder {
            BarrierRepository repository;

            ProcessInstanceRepository wrap(ProcessInstanceRepository delegate) {
                repository = new BarrierRepository(delegate);
                return repository;
            }
        }
    }
}
