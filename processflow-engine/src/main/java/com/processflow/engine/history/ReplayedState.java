package com.processflow.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.processflow.core.model.ProcessStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Instance state reconstructed by folding its audit trail up to a sequence number.
 */
public record ReplayedState(
    UUID instanceId,
    long sequenceNumber,
    ProcessStatus status,
    String currentStep,
    Map<String, JsonNode> variables,
    Instant endTime
) {}
