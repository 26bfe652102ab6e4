package com.processflow.core.lifecycle;

import com.processflow.core.exception.CurrentStepNotFoundException;
import com.processflow.core.exception.DefinitionIntegrityException;
import com.processflow.core.graph.ProcessGraph;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessNode;

/**
 * Decides where an instance goes when its current step is completed.
 * The first connection of the current node is followed; conditions are not evaluated.
 */
public class StepAdvancer {

    /**
     * @param completedStep the node being completed
     * @param nextStep      the node the instance moves to, or null when the completed node has no connections
     * @param completes     whether the instance reaches a terminal COMPLETED status
     */
    public record Advance(ProcessNode completedStep, String nextStep, boolean completes) {}

    /**
     * Resolve the advance for the instance's current step. Performs no mutation.
     *
     * @throws CurrentStepNotFoundException if the current step is not in the definition
     * @throws DefinitionIntegrityException if the first connection targets an unknown node
     */
    public Advance advance(ProcessInstance instance, ProcessDefinition definition) {
        ProcessGraph graph = ProcessGraph.of(definition);
        ProcessNode current = graph.lookup(instance.currentStep())
            .orElseThrow(() -> new CurrentStepNotFoundException(
                instance.instanceId(), definition.definitionId(), instance.currentStep()));

        if (!current.hasConnections()) {
            return new Advance(current, null, true);
        }

        String nextStep = current.connections().get(0);
        ProcessNode next = graph.lookup(nextStep)
            .orElseThrow(() -> new DefinitionIntegrityException(String.format(
                "Node '%s' of process definition %s connects to unknown node '%s'",
                current.id(), definition.definitionId(), nextStep)));

        return new Advance(current, next.id(), next.isEnd());
    }
}
