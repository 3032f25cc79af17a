package com.waterresources.streamnet.dto.network;

import com.waterresources.streamnet.model.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat, id-only view of one node: what a serialization layer reads and writes to
 * round-trip a network without knowing the ordering algorithms.
 * Ordering metadata is filled on export and ignored on rebuild.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeLink {

    private String id;
    private NodeType type;
    private String description;
    private long link;
    private boolean naturalFlow;
    private boolean importNode;
    private boolean dryRiver;

    private Double x; // null when unset
    private Double y;

    private String downstreamId;

    @Builder.Default
    private List<String> upstreamIds = new ArrayList<>();

    private Integer serial;
    private Integer computationalOrder;
    private Integer reachCounter;
    private Integer nodeInReachNumber;
    private Integer tributaryNumber;
}
