package com.processflow.core.exception;

/**
 * Thrown by graph lookups when a node id is absent.
 */
public class NodeNotFoundException extends ProcessEngineException {

    public static final String ERROR_CODE = "NODE_NOT_FOUND";

    private final String nodeId;

    public NodeNotFoundException(String definitionName, String nodeId) {
        super(ERROR_CODE, String.format(
            "Node '%s' not found in process definition '%s'",
            nodeId, definitionName
        ));
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
