package com.processflow.api.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.processflow.core.model.Actor;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.repository.ProcessDefinitionRepository;
import com.processflow.engine.config.ProcessFlowProperties;
import com.processflow.engine.service.DefinitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Registers the bundled process templates at startup.
 * Templates are shared (no tenant) and a template whose name and version
 * already exist is left untouched.
 */
@Component
@ConditionalOnProperty(prefix = "processflow.catalog", name = "enabled", havingValue = "true")
public class TemplateCatalogLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalogLoader.class);

    private static final TypeReference<List<ProcessDefinition>> TEMPLATES = new TypeReference<>() {};

    private final DefinitionService definitionService;
    private final ProcessDefinitionRepository definitionRepository;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ProcessFlowProperties properties;

    public TemplateCatalogLoader(
            DefinitionService definitionService,
            ProcessDefinitionRepository definitionRepository,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            ProcessFlowProperties properties) {
        this.definitionService = definitionService;
        this.definitionRepository = definitionRepository;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String location = properties.getCatalog().getLocation();
        List<ProcessDefinition> templates = readTemplates(resourceLoader.getResource(location));

        int registered = 0;
        for (ProcessDefinition template : templates) {
            if (definitionRepository.findByNameAndVersion(template.name(), template.version()).isPresent()) {
                log.debug("Template {} already registered", template.key());
                continue;
            }
            definitionService.register(template, Actor.system(null));
            registered++;
        }
        log.info("Template catalog {}: {} templates, {} newly registered", location, templates.size(), registered);
    }

    private List<ProcessDefinition> readTemplates(Resource resource) {
        if (!resource.exists()) {
            throw new IllegalStateException("Template catalog not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, TEMPLATES);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template catalog " + resource.getDescription(), e);
        }
    }
}
