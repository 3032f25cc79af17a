package com.waterresources.streamnet.model;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A stream network: owns the head (End) node and the node count. Everything
 * reachable upstream of the head belongs to the network.
 *
 * The network is a plain holder; traversal, editing and queries live in the
 * network services so that the tributary convention is passed explicitly.
 */
@Getter
@Setter
public class HydrologyNodeNetwork {

    private String networkId;

    private String networkName;

    private HydrologyNode nodeHead;

    private int nodeCount;

    private TributaryOrder tributaryOrder = TributaryOrder.ADDED_FIRST;

    private boolean treatDryAsNaturalFlow;

    public HydrologyNodeNetwork(String networkId, String networkName) {
        this.networkId = networkId;
        this.networkName = networkName;
    }

    /**
     * Reset the head and the node count from a node list. The head is the first node
     * without a downstream node; when every node has one, the first End node.
     */
    public void setNetworkFromNodes(List<HydrologyNode> nodes) {
        nodeCount = nodes.size();
        nodeHead = nodes.stream()
                .filter(node -> node.getDownstreamNode() == null)
                .findFirst()
                .orElseGet(() -> nodes.stream().filter(HydrologyNode::isEnd).findFirst().orElse(null));
    }

    @Override
    public String toString() {
        return "HydrologyNodeNetwork{id='" + networkId + "', name='" + networkName
                + "', nodes=" + nodeCount + ", order=" + tributaryOrder + "}";
    }
}
