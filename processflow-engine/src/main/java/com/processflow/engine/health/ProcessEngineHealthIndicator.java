package com.processflow.engine.health;

import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.ProcessInstanceRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether the instance store answers, with instance counts by status.
 */
@Component
public class ProcessEngineHealthIndicator implements HealthIndicator {

    private final ProcessInstanceRepository instanceRepository;

    public ProcessEngineHealthIndicator(ProcessInstanceRepository instanceRepository) {
        this.instanceRepository = instanceRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            Map<ProcessStatus, Long> counts = instanceRepository.countByStatus();
            details.put("repository", "reachable");
            for (ProcessStatus status : ProcessStatus.values()) {
                details.put(status.wireName(), counts.getOrDefault(status, 0L));
            }
            return Health.up()
                .withDetails(details)
                .build();
        } catch (Exception e) {
            details.put("repository", "unreachable");
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
