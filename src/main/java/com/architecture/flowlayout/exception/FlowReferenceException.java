package com.architecture.flowlayout.exception;

import lombok.Getter;

/**
 * Thrown when a transition names a node id that is neither an activity nor a gateway.
 * The layout is aborted; no partial model is produced.
 */
@Getter
public class FlowReferenceException extends RuntimeException {

    private final String transitionId;
    private final String missingNodeId;

    public FlowReferenceException(String transitionId, String missingNodeId) {
        super("Transition '" + transitionId + "' references unknown node '" + missingNodeId + "'");
        this.transitionId = transitionId;
        this.missingNodeId = missingNodeId;
    }
}
