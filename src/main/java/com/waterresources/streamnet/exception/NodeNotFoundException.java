package com.waterresources.streamnet.exception;

import lombok.Getter;

/**
 * Thrown when a referenced node id or anchor is not present in the network.
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public NodeNotFoundException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }
}
