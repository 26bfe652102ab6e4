package com.processflow.engine.config;

import com.processflow.core.lifecycle.BusinessKeyGenerator;
import com.processflow.core.lifecycle.LifecycleStateMachine;
import com.processflow.core.lifecycle.StepAdvancer;
import com.processflow.core.repository.ProcessDefinitionRepository;
import com.processflow.core.repository.ProcessInstanceRepository;
import com.processflow.core.validation.DefinitionValidator;
import com.processflow.engine.coordinator.DefinitionCoordinator;
import com.processflow.engine.coordinator.DefinitionLocks;
import com.processflow.engine.coordinator.ProcessCoordinator;
import com.processflow.engine.history.ProcessHistoryService;
import com.processflow.engine.metrics.ProcessMetrics;
import com.processflow.engine.security.AccessPolicy;
import com.processflow.engine.security.TenantAccessPolicy;
import com.processflow.engine.service.DefinitionService;
import com.processflow.engine.service.ProcessService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pure core components and the coordinators.
 * Repositories come from component scanning, selected by {@code processflow.persistence.mode}.
 */
@Configuration
@EnableConfigurationProperties(ProcessFlowProperties.class)
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessPolicy accessPolicy() {
        return new TenantAccessPolicy();
    }

    @Bean
    public DefinitionValidator definitionValidator() {
        return new DefinitionValidator();
    }

    @Bean
    public LifecycleStateMachine lifecycleStateMachine(Clock clock, DefinitionValidator validator) {
        return new LifecycleStateMachine(clock, validator, new StepAdvancer());
    }

    @Bean
    public BusinessKeyGenerator businessKeyGenerator(ProcessFlowProperties properties, Clock clock) {
        return new BusinessKeyGenerator(properties.getBusinessKeyPrefix(), clock);
    }

    @Bean
    public DefinitionLocks definitionLocks() {
        return new DefinitionLocks();
    }

    @Bean
    public ProcessService processService(
            ProcessDefinitionRepository definitionRepository,
            ProcessInstanceRepository instanceRepository,
            ProcessHistoryService historyService,
            LifecycleStateMachine stateMachine,
            BusinessKeyGenerator businessKeyGenerator,
            AccessPolicy accessPolicy,
            DefinitionLocks definitionLocks,
            ProcessMetrics metrics,
            ProcessFlowProperties properties) {
        return new ProcessCoordinator(
            definitionRepository,
            instanceRepository,
            historyService,
            stateMachine,
            businessKeyGenerator,
            accessPolicy,
            definitionLocks,
            metrics,
            properties.getDefaultPriority(),
            properties.getQuery().getMaxLimit()
        );
    }

    @Bean
    public DefinitionService definitionService(
            ProcessDefinitionRepository definitionRepository,
            ProcessInstanceRepository instanceRepository,
            DefinitionValidator validator,
            AccessPolicy accessPolicy,
            DefinitionLocks definitionLocks,
            Clock clock,
            ProcessFlowProperties properties) {
        return new DefinitionCoordinator(
            definitionRepository,
            instanceRepository,
            validator,
            accessPolicy,
            definitionLocks,
            clock,
            properties.getQuery().getMaxLimit()
        );
    }
}
