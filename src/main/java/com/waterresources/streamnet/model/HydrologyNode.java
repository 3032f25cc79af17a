package com.waterresources.streamnet.model;

import com.waterresources.streamnet.exception.NodeNotFoundException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single hydrologic element in a stream network: a gauge, diversion, reservoir,
 * confluence, well and so on.
 *
 * Ordering metadata (serial, computational order, reach bookkeeping) is written only
 * by the network services. The live links are {@code downstreamNode} and
 * {@code upstreamNodes}; {@code downstreamNodeId} and {@code upstreamNodeIds} are the
 * id-valued form used by bulk rebuild and by relinking after a delete.
 *
 * Equality is identity: two nodes are the same only if they are the same object.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HydrologyNode {

    private String commonId;

    @Builder.Default
    private NodeType type = NodeType.UNKNOWN;

    private String description;

    private long link;

    private boolean naturalFlow;

    private boolean importNode;

    private boolean dryRiver;

    private int serial;

    private int computationalOrder;

    private int reachCounter;

    private int nodeInReachNumber;

    private int tributaryNumber;

    @Builder.Default
    private double x = Double.NaN;

    @Builder.Default
    private double y = Double.NaN;

    private HydrologyNode downstreamNode;

    @Builder.Default
    private List<HydrologyNode> upstreamNodes = new ArrayList<>();

    private String downstreamNodeId;

    @Builder.Default
    private List<String> upstreamNodeIds = new ArrayList<>();

    public HydrologyNode(String commonId, NodeType type) {
        this();
        this.commonId = commonId;
        this.type = type;
        this.x = Double.NaN;
        this.y = Double.NaN;
        this.upstreamNodes = new ArrayList<>();
        this.upstreamNodeIds = new ArrayList<>();
    }

    public boolean isEnd() {
        return type == NodeType.END;
    }

    public int getNumUpstreamNodes() {
        return upstreamNodes.size();
    }

    /**
     * First upstream node, or null when nothing is upstream.
     */
    public HydrologyNode getUpstreamNode() {
        return upstreamNodes.isEmpty() ? null : upstreamNodes.get(0);
    }

    /**
     * Upstream node at the given position.
     *
     * @throws NodeNotFoundException if the position is outside the upstream list
     */
    public HydrologyNode getUpstreamNode(int position) {
        if (position < 0 || position >= upstreamNodes.size()) {
            throw new NodeNotFoundException(commonId,
                    "Upstream position [" + position + "] of node \"" + commonId
                            + "\" not found (count " + upstreamNodes.size() + ")");
        }
        return upstreamNodes.get(position);
    }

    /**
     * Position of the upstream node with the given id (case-insensitive), or -1.
     */
    public int getUpstreamNodePosition(String id) {
        for (int i = 0; i < upstreamNodes.size(); i++) {
            if (upstreamNodes.get(i).getCommonId().equalsIgnoreCase(id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Position of the given node object in the upstream list, or -1.
     */
    public int indexOfUpstream(HydrologyNode node) {
        for (int i = 0; i < upstreamNodes.size(); i++) {
            if (upstreamNodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Ids of the live upstream nodes, in list order.
     */
    public List<String> getUpstreamNodeIdsFromLinks() {
        return upstreamNodes.stream()
                .map(HydrologyNode::getCommonId)
                .collect(Collectors.toList());
    }

    /**
     * Append a node to the upstream list and point its downstream link at this node.
     */
    public void addUpstreamNode(HydrologyNode upstream) {
        upstreamNodes.add(upstream);
        upstream.setDownstreamNode(this);
    }

    /**
     * Splice {@code downstream} between this node and its current downstream node.
     * The old downstream node's upstream entry for this node is re-homed to
     * {@code downstream}.
     */
    public void addDownstreamNode(HydrologyNode downstream) {
        HydrologyNode oldDownstream = downstreamNode;
        if (oldDownstream != null) {
            int pos = oldDownstream.indexOfUpstream(this);
            if (pos >= 0) {
                oldDownstream.getUpstreamNodes().set(pos, downstream);
            } else {
                oldDownstream.getUpstreamNodes().add(downstream);
            }
            downstream.setDownstreamNode(oldDownstream);
            downstream.setTributaryNumber(tributaryNumber);
        }
        downstream.addUpstreamNode(this);
        tributaryNumber = downstream.getNumUpstreamNodes();
    }

    public void replaceUpstreamNode(HydrologyNode node, int position) {
        upstreamNodes.set(position, node);
    }

    /**
     * Remove the given node object from the upstream list.
     *
     * @return true if it was present
     */
    public boolean deleteUpstreamNode(HydrologyNode node) {
        int pos = indexOfUpstream(node);
        if (pos < 0) return false;
        upstreamNodes.remove(pos);
        return true;
    }

    public void clearLinks() {
        downstreamNode = null;
        upstreamNodes = new ArrayList<>();
    }

    public boolean hasLocation() {
        return !Double.isNaN(x) && !Double.isNaN(y);
    }

    public void setLocation(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void clearLocation() {
        this.x = Double.NaN;
        this.y = Double.NaN;
    }

    @Override
    public String toString() {
        StringBuilder up = new StringBuilder();
        for (int i = 0; i < upstreamNodes.size(); i++) {
            up.append(" [").append(i).append("]:\"").append(upstreamNodes.get(i).getCommonId()).append("\"");
        }
        return "\"" + commonId + "\" T=" + (type != null ? type.getAbbreviation() : "null")
                + " T#=" + tributaryNumber
                + " RC=" + reachCounter
                + " #=" + serial
                + " #inR=" + nodeInReachNumber
                + " CO=" + computationalOrder
                + " DWN=\"" + (downstreamNode != null ? downstreamNode.getCommonId() : "null") + "\""
                + " #up=" + upstreamNodes.size()
                + " UP=" + up;
    }
}
