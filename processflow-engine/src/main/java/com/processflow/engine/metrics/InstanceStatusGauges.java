package com.processflow.engine.metrics;

import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.ProcessInstanceRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Gauge per instance status, read from the instance repository at scrape time.
 */
public class InstanceStatusGauges implements MeterBinder {

    public static final String INSTANCE_COUNT = "processflow.instances";

    private final ProcessInstanceRepository instanceRepository;

    public InstanceStatusGauges(ProcessInstanceRepository instanceRepository) {
        this.instanceRepository = instanceRepository;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (ProcessStatus status : ProcessStatus.values()) {
            Gauge.builder(INSTANCE_COUNT, instanceRepository,
                    repo -> repo.countByStatus().getOrDefault(status, 0L))
                .tag("status", status.wireName())
                .description("Number of process instances in " + status.wireName() + " status")
                .register(registry);
        }
    }
}
