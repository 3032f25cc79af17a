package com.waterresources.streamnet.dto.network;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single problem found by the network integrity check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityViolation {

    public enum Severity {
        WARNING,  // bookkeeping drift, traversal still works
        ERROR     // topology is broken
    }

    public enum Rule {
        HEAD_NOT_END,
        NOT_A_TREE,
        MISSING_DOWNSTREAM,
        ADJACENCY_MISMATCH,
        DUPLICATE_ID,
        SERIAL_ORDER,
        COMPUTATIONAL_ORDER,
        TRIBUTARY_NUMBER,
        NODE_COUNT
    }

    private Severity severity;
    private Rule rule;
    private String nodeId;
    private String description;
}
