package com.processflow.api.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.processflow.core.model.Actor;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.repository.ProcessDefinitionRepository;
import com.processflow.engine.config.ProcessFlowProperties;
import com.processflow.engine.service.DefinitionService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TemplateCatalogLoaderTest {

    private final DefinitionService definitionService = mock(DefinitionService.class);
    private final ProcessDefinitionRepository definitionRepository = mock(ProcessDefinitionRepository.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withBean(DefinitionService.class, () -> definitionService)
        .withBean(ProcessDefinitionRepository.class, () -> definitionRepository)
        .withBean(ObjectMapper.class, () -> Jackson2ObjectMapperBuilder.json().build())
        .withBean(ProcessFlowProperties.class, ProcessFlowProperties::new)
        .withUserConfiguration(TemplateCatalogLoader.class);

    @Test
    void withoutEnabledFlag_shouldNotCreateLoader() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(TemplateCatalogLoader.class));
    }

    @Test
    void disabledFlag_shouldNotCreateLoader() {
        contextRunner.withPropertyValues("processflow.catalog.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(TemplateCatalogLoader.class));
    }

    @Test
    void enabledFlag_shouldRegisterOnlyAbsentTemplates() {
        when(definitionRepository.findByNameAndVersion(anyString(), anyString())).thenReturn(Optional.empty());
        when(definitionRepository.findByNameAndVersion("Invoice Approval Process", "1.2"))
            .thenReturn(Optional.of(ProcessDefinition.builder().name("Invoice Approval Process").version("1.2").build()));

        contextRunner.withPropertyValues("processflow.catalog.enabled=true")
            .run(context -> {
                assertThat(context).hasSingleBean(TemplateCatalogLoader.class);
                context.getBean(TemplateCatalogLoader.class).run(new DefaultApplicationArguments());
            });

        verify(definitionService, times(4)).register(any(ProcessDefinition.class), eq(Actor.system(null)));
        verify(definitionService, never()).register(
            argThat(template -> "Invoice Approval Process".equals(template.name())), any(Actor.class));
    }
}
