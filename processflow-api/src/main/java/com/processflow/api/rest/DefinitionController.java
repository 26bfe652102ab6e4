package com.processflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.processflow.api.rest.InstanceController.InstanceResponse;
import com.processflow.api.web.RequestActor;
import com.processflow.core.model.Actor;
import com.processflow.core.model.Priority;
import com.processflow.core.model.ProcessCategory;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.validation.ValidationResult;
import com.processflow.core.validation.Violation;
import com.processflow.engine.service.DefinitionService;
import com.processflow.engine.service.DefinitionService.DefinitionQueryRequest;
import com.processflow.engine.service.ProcessService;
import com.processflow.engine.service.ProcessService.StartProcessRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for process definition authoring and instantiation.
 */
@RestController
@RequestMapping("/api/v1/process-definitions")
public class DefinitionController {

    private final DefinitionService definitionService;
    private final ProcessService processService;

    public DefinitionController(DefinitionService definitionService, ProcessService processService) {
        this.definitionService = definitionService;
        this.processService = processService;
    }

    /**
     * Query definitions visible to the caller.
     */
    @GetMapping
    public ResponseEntity<List<DefinitionResponse>> queryDefinitions(
            @RequestActor Actor actor,
            @RequestParam(required = false) ProcessCategory category,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {

        List<DefinitionResponse> responses = definitionService
            .query(new DefinitionQueryRequest(category, active, search, limit, offset), actor)
            .stream()
            .map(DefinitionResponse::from)
            .toList();

        return ResponseEntity.ok(responses);
    }

    @PostMapping
    public ResponseEntity<DefinitionResponse> registerDefinition(
            @RequestActor Actor actor,
            @RequestBody DefinitionRequest request) {

        ProcessDefinition registered = definitionService.register(request.toDefinition(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(DefinitionResponse.from(registered));
    }

    @GetMapping("/{definitionId}")
    public ResponseEntity<DefinitionResponse> getDefinition(
            @RequestActor Actor actor,
            @PathVariable UUID definitionId) {

        return ResponseEntity.ok(DefinitionResponse.from(definitionService.get(definitionId, actor)));
    }

    /**
     * Replace the authored content of a definition.
     */
    @PutMapping("/{definitionId}")
    public ResponseEntity<DefinitionResponse> updateDefinition(
            @RequestActor Actor actor,
            @PathVariable UUID definitionId,
            @RequestBody DefinitionRequest request) {

        ProcessDefinition updated = definitionService.update(definitionId, request.toDefinition(), actor);
        return ResponseEntity.ok(DefinitionResponse.from(updated));
    }

    @DeleteMapping("/{definitionId}")
    public ResponseEntity<Void> deleteDefinition(
            @RequestActor Actor actor,
            @PathVariable UUID definitionId) {

        definitionService.delete(definitionId, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{definitionId}/activate")
    public ResponseEntity<DefinitionResponse> activateDefinition(
            @RequestActor Actor actor,
            @PathVariable UUID definitionId) {

        return ResponseEntity.ok(DefinitionResponse.from(definitionService.activate(definitionId, actor)));
    }

    @PostMapping("/{definitionId}/deactivate")
    public ResponseEntity<DefinitionResponse> deactivateDefinition(
            @RequestActor Actor actor,
            @PathVariable UUID definitionId) {

        return ResponseEntity.ok(DefinitionResponse.from(definitionService.deactivate(definitionId, actor)));
    }

    /**
     * Validate a definition without storing it.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validateDefinition(@RequestBody DefinitionRequest request) {
        return ResponseEntity.ok(ValidationResponse.from(definitionService.validate(request.toDefinition())));
    }

    /**
     * Start a new instance of the definition.
     */
    @PostMapping("/{definitionId}/start")
    public ResponseEntity<InstanceResponse> startProcess(
            @RequestActor Actor actor,
            @PathVariable UUID definitionId,
            @RequestBody(required = false) StartRequest request) {

        StartRequest body = request != null ? request : new StartRequest(null, null, null, null, null);
        ProcessInstance instance = processService.start(new StartProcessRequest(
            definitionId,
            body.businessKey(),
            body.departmentId(),
            body.variables(),
            body.priority(),
            body.assignedTo()
        ), actor);

        return ResponseEntity.status(HttpStatus.CREATED).body(InstanceResponse.from(instance));
    }

    // ========== DTOs ==========

    public record DefinitionRequest(
        String name,
        String version,
        String description,
        ProcessCategory category,
        List<ProcessNode> nodes,
        Map<String, JsonNode> variables,
        Boolean active,
        Set<String> permissions,
        List<String> tags
    ) {
        public ProcessDefinition toDefinition() {
            ProcessDefinition.Builder builder = ProcessDefinition.builder()
                .name(name)
                .description(description)
                .nodes(nodes)
                .variables(variables)
                .permissions(permissions)
                .tags(tags);
            if (version != null) {
                builder.version(version);
            }
            if (category != null) {
                builder.category(category);
            }
            if (active != null) {
                builder.active(active);
            }
            return builder.build();
        }
    }

    public record StartRequest(
        String businessKey,
        String departmentId,
        Map<String, JsonNode> variables,
        Priority priority,
        Set<String> assignedTo
    ) {}

    public record DefinitionResponse(
        UUID definitionId,
        String name,
        String version,
        String description,
        ProcessCategory category,
        List<ProcessNode> nodes,
        Map<String, JsonNode> variables,
        boolean active,
        Set<String> permissions,
        List<String> tags,
        String tenantId,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static DefinitionResponse from(ProcessDefinition definition) {
            return new DefinitionResponse(
                definition.definitionId(),
                definition.name(),
                definition.version(),
                definition.description(),
                definition.category(),
                definition.nodes(),
                definition.variables(),
                definition.active(),
                definition.permissions(),
                definition.tags(),
                definition.tenantId(),
                definition.createdBy(),
                definition.updatedBy(),
                definition.createdAt(),
                definition.updatedAt()
            );
        }
    }

    public record ValidationResponse(boolean valid, List<Violation> errors, List<Violation> warnings) {
        public static ValidationResponse from(ValidationResult result) {
            return new ValidationResponse(result.isValid(), result.errors(), result.warnings());
        }
    }
}
