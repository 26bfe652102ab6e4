package com.processflow.api.rest;

import com.processflow.api.web.RequestActor;
import com.processflow.core.model.Actor;
import com.processflow.core.model.AuditEntry;
import com.processflow.engine.history.ReplayedState;
import com.processflow.engine.service.ProcessService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the audit trail of an instance and state replay.
 */
@RestController
@RequestMapping("/api/v1/process-instances/{instanceId}/history")
public class HistoryController {

    private final ProcessService processService;

    public HistoryController(ProcessService processService) {
        this.processService = processService;
    }

    /**
     * Audit entries in sequence order.
     */
    @GetMapping
    public ResponseEntity<List<AuditEntry>> getHistory(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId) {

        return ResponseEntity.ok(processService.getHistory(instanceId, actor));
    }

    /**
     * Replay state up to a sequence number, or the whole trail when none is given.
     */
    @GetMapping("/replay")
    public ResponseEntity<ReplayedState> replay(
            @RequestActor Actor actor,
            @PathVariable UUID instanceId,
            @RequestParam(required = false) Long sequence) {

        return ResponseEntity.ok(processService.replay(instanceId, sequence, actor));
    }
}
