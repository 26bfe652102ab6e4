package com.processflow.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.processflow.core.lifecycle.VariableMerger;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.LifecycleOperation;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.AuditEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the audit trail.
 *
 * Provides:
 * - Ordered history retrieval
 * - State reconstruction by folding entries
 * - Per-node progress view of an instance
 */
@Service
public class ProcessHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ProcessHistoryService.class);

    private final AuditEntryRepository auditRepository;

    public ProcessHistoryService(AuditEntryRepository auditRepository) {
        this.auditRepository = auditRepository;
    }

    public List<AuditEntry> history(UUID instanceId) {
        return auditRepository.findByInstance(instanceId);
    }

    public long retryCount(UUID instanceId) {
        return auditRepository.countByAction(instanceId, LifecycleOperation.RETRY);
    }

    /**
     * Fold the audit trail of an instance. Folding the whole trail reproduces the stored instance's
     * status, current step, variables and end time.
     *
     * @param toSequence last entry to fold, or null for all entries
     */
    public ReplayedState replay(UUID instanceId, Long toSequence) {
        List<AuditEntry> entries = toSequence == null
            ? auditRepository.findByInstance(instanceId)
            : auditRepository.findByInstanceUpTo(instanceId, toSequence);

        log.debug("Replaying {} audit entries for instance {}", entries.size(), instanceId);

        ProcessStatus status = null;
        String currentStep = null;
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        Instant endTime = null;
        long sequence = 0;

        for (AuditEntry entry : entries) {
            variables = applyVariables(entry, variables);
            JsonNode newState = entry.newState();
            if (newState != null) {
                status = ProcessStatus.fromValue(newState.get("status").asText());
                JsonNode step = newState.get("currentStep");
                currentStep = step == null || step.isNull() ? null : step.asText();
            }
            endTime = status != null && status.isTerminal() ? entry.timestamp() : null;
            sequence = entry.sequenceNumber();
        }

        return new ReplayedState(instanceId, sequence, status, currentStep, variables, endTime);
    }

    private Map<String, JsonNode> applyVariables(AuditEntry entry, Map<String, JsonNode> variables) {
        return switch (entry.action()) {
            case START, UPDATE_VARIABLES -> VariableMerger.merge(variables, fields(entry.details(), "variables"));
            case COMPLETE_TASK -> {
                Map<String, JsonNode> merged = VariableMerger.merge(variables, fields(entry.details(), "variables"));
                String completed = entry.detail("completedStep");
                merged.put(completed + "_completed", BooleanNode.TRUE);
                merged.put(completed + "_completedAt", TextNode.valueOf(entry.timestamp().toString()));
                merged.put(completed + "_completedBy", TextNode.valueOf(entry.actor()));
                yield merged;
            }
            case SUSPEND, RESUME, CANCEL, FAIL, RETRY -> variables;
        };
    }

    /**
     * Progress of every node of the definition, in definition order.
     */
    public List<StepView> steps(ProcessInstance instance, ProcessDefinition definition) {
        List<StepView> steps = new ArrayList<>();
        for (ProcessNode node : definition.nodes()) {
            steps.add(new StepView(
                node.id(),
                node.name(),
                node.type(),
                stepStatus(instance, node),
                node.typedConfig().responsibleParty().orElse(null),
                text(instance.variables().get(node.id() + "_completedAt")),
                text(instance.variables().get(node.id() + "_completedBy"))
            ));
        }
        return steps;
    }

    private StepStatus stepStatus(ProcessInstance instance, ProcessNode node) {
        boolean current = node.id().equals(instance.currentStep());
        if (current) {
            switch (instance.status()) {
                case RUNNING, SUSPENDED:
                    return StepStatus.ACTIVE;
                case FAILED:
                    return StepStatus.FAILED;
                case COMPLETED:
                    return StepStatus.COMPLETED;
                case CANCELLED:
                    break;
            }
        }
        JsonNode completed = instance.variables().get(node.id() + "_completed");
        return completed != null && completed.asBoolean() ? StepStatus.COMPLETED : StepStatus.PENDING;
    }

    private static Map<String, JsonNode> fields(JsonNode details, String field) {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        if (details == null || !details.has(field)) {
            return values;
        }
        Iterator<Map.Entry<String, JsonNode>> it = details.get(field).fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            values.put(e.getKey(), e.getValue());
        }
        return values;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
