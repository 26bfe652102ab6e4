package com.processflow.engine.metrics;

import com.processflow.core.repository.ProcessInstanceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration for the process engine.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "processflow");
    }

    @Bean
    public ProcessMetrics processMetrics(MeterRegistry registry) {
        return new ProcessMetrics(registry);
    }

    @Bean
    public InstanceStatusGauges instanceStatusGauges(ProcessInstanceRepository instanceRepository) {
        return new InstanceStatusGauges(instanceRepository);
    }
}
