package com.waterresources.streamnet.exception;

import lombok.Getter;

/**
 * Thrown when the node graph is malformed: a traversal stops making progress or
 * revisits a node, or bulk input references an id that does not exist.
 * Never recovered from silently.
 */
@Getter
public class NetworkStructureException extends RuntimeException {

    private final String nodeId;

    public NetworkStructureException(String message) {
        super(message);
        this.nodeId = null;
    }

    public NetworkStructureException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }
}
