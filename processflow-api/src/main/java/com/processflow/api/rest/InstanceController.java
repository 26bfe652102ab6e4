package com.processflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.processflow.api.web.RequestActor;
import com.processflow.core.model.Actor;
import com.processflow.core.model.Priority;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.engine.history.StepView;
import com.processflow.engine.service.ProcessService;
import com.processflow.engine.service.ProcessService.InstanceQueryRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for process instance lifecycle.
 */
@RestController
@RequestMapping("/api/v1/process-instances")
public class InstanceController {

    private final ProcessService processService;

    public InstanceController(ProcessService processService) {
        this.processService = processService;
    }

    /**
     * Query instances of the caller's tenant, newest first.
     */
    @GetMapping
    public ResponseEntity<List<InstanceResponse>> queryInstances(
            @RequestActor Actor actor,
            @RequestParam(required = false) ProcessStatus status,
            @RequestParam(required = false) UUID definitionId,
            @RequestParam(required = false) String businessKey,
            @RequestParam(required = false) Priority priority,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {

        List<InstanceResponse> responses = processService.queryInstances(
                new InstanceQueryRequest(status, definitionId, businessKey, priority, limit, offset), actor)
            .stream()
            .map(InstanceResponse::from)
            .toList();

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{instanceId}")
    public ResponseEntity<InstanceResponse> getInstance(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(InstanceResponse.from(processService.getInstance(instanceId, actor)));
    }

    /**
     * Complete the current step, optionally submitting variables.
     */
    @PostMapping("/{instanceId}/complete")
    public ResponseEntity<InstanceResponse> completeTask(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId,
            @RequestBody(required = false) CompleteTaskRequest request) {

        Map<String, JsonNode> variables = request != null && request.variables() != null
            ? request.variables()
            : Map.of();
        return ResponseEntity.ok(InstanceResponse.from(processService.completeTask(instanceId, variables, actor)));
    }

    @PatchMapping("/{instanceId}/suspend")
    public ResponseEntity<InstanceResponse> suspend(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(InstanceResponse.from(processService.suspend(instanceId, actor)));
    }

    @PatchMapping("/{instanceId}/resume")
    public ResponseEntity<InstanceResponse> resume(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(InstanceResponse.from(processService.resume(instanceId, actor)));
    }

    @PatchMapping("/{instanceId}/cancel")
    public ResponseEntity<InstanceResponse> cancel(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(InstanceResponse.from(processService.cancel(instanceId, reason, actor)));
    }

    @PatchMapping("/{instanceId}/retry")
    public ResponseEntity<InstanceResponse> retry(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(InstanceResponse.from(processService.retry(instanceId, actor)));
    }

    /**
     * Record a failure reported by an external collaborator.
     */
    @PostMapping("/{instanceId}/fail")
    public ResponseEntity<InstanceResponse> fail(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId,
            @RequestBody FailRequest request) {

        return ResponseEntity.ok(InstanceResponse.from(processService.fail(instanceId, request.cause(), actor)));
    }

    @GetMapping("/{instanceId}/variables")
    public ResponseEntity<Map<String, JsonNode>> getVariables(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(processService.getVariables(instanceId, actor));
    }

    /**
     * Shallow-merge variables; returns the full map afterwards.
     */
    @PutMapping("/{instanceId}/variables")
    public ResponseEntity<Map<String, JsonNode>> updateVariables(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId,
            @RequestBody Map<String, JsonNode> variables) {

        return ResponseEntity.ok(processService.updateVariables(instanceId, variables, actor));
    }

    @GetMapping("/{instanceId}/steps")
    public ResponseEntity<List<StepView>> getSteps(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(processService.getSteps(instanceId, actor));
    }

    // ========== DTOs ==========

    public record CompleteTaskRequest(Map<String, JsonNode> variables) {}

    public record CancelRequest(String reason) {}

    public record FailRequest(String cause) {}

    public record InstanceResponse(
        UUID instanceId,
        UUID definitionId,
        String definitionName,
        String definitionVersion,
        String businessKey,
        String tenantId,
        String departmentId,
        ProcessStatus status,
        String currentStep,
        Map<String, JsonNode> variables,
        Instant startTime,
        Instant endTime,
        Long durationMillis,
        String initiatedBy,
        Set<String> assignedTo,
        Priority priority,
        long sequenceNumber,
        Instant updatedAt
    ) {
        public static InstanceResponse from(ProcessInstance instance) {
            Duration duration = instance.duration();
            return new InstanceResponse(
                instance.instanceId(),
                instance.definitionId(),
                instance.definitionName(),
                instance.definitionVersion(),
                instance.businessKey(),
                instance.tenantId(),
                instance.departmentId(),
                instance.status(),
                instance.currentStep(),
                instance.variables(),
                instance.startTime(),
                instance.endTime(),
                duration != null ? duration.toMillis() : null,
                instance.initiatedBy(),
                instance.assignedTo(),
                instance.priority(),
                instance.sequenceNumber(),
                instance.updatedAt()
            );
        }
    }
}
