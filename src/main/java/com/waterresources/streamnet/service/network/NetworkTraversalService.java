package com.waterresources.streamnet.service.network;

import com.waterresources.streamnet.exception.NetworkStructureException;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.Position;
import com.waterresources.streamnet.model.TributaryOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Traversal primitives over the node tree.
 *
 * Every primitive maps (node, position) to a node. When there is nowhere to go the
 * starting node itself is returned, so callers detect the end of a walk by
 * "next == current". Walks that revisit a node throw {@link NetworkStructureException}
 * instead of looping.
 *
 * The computational order is a depth-first, tributary-major order: every branch
 * above a node is walked completely before the node itself, and the tributary
 * convention decides which sibling branch is walked first.
 */
@Service
@Slf4j
public class NetworkTraversalService {

    // ========================= DOWNSTREAM =========================

    public HydrologyNode getDownstreamNode(HydrologyNode node, Position position, TributaryOrder order) {
        if (node == null) {
            throw new IllegalArgumentException("Cannot traverse downstream from a null node");
        }
        if (node.getDownstreamNode() == null) {
            return node;
        }
        switch (position) {
            case RELATIVE:
                return node.getDownstreamNode();
            case ABSOLUTE:
                return absoluteDownstream(node);
            case REACH:
                return reachDownstream(node);
            case COMPUTATIONAL:
                return computationalDownstream(node, order);
            default:
                throw new IllegalArgumentException("Unsupported position: " + position);
        }
    }

    /**
     * Follow downstream links to the terminal node.
     */
    private HydrologyNode absoluteDownstream(HydrologyNode node) {
        Set<HydrologyNode> visited = identitySet();
        HydrologyNode nodePt = node;
        while (nodePt.getDownstreamNode() != null) {
            if (!visited.add(nodePt)) {
                throw cycle(nodePt, "absolute downstream");
            }
            nodePt = nodePt.getDownstreamNode();
        }
        return nodePt;
    }

    /**
     * Walk down to the first node of the current reach (node in reach number 1).
     */
    private HydrologyNode reachDownstream(HydrologyNode node) {
        Set<HydrologyNode> visited = identitySet();
        HydrologyNode nodePt = node;
        while (nodePt.getNodeInReachNumber() != 1 && nodePt.getDownstreamNode() != null) {
            if (!visited.add(nodePt)) {
                throw cycle(nodePt, "reach downstream");
            }
            nodePt = nodePt.getDownstreamNode();
        }
        return nodePt;
    }

    private HydrologyNode computationalDownstream(HydrologyNode node, TributaryOrder order) {
        HydrologyNode nodeDown = node.getDownstreamNode();
        int count = nodeDown.getNumUpstreamNodes();
        int index = nodeDown.indexOfUpstream(node);
        if (index < 0) {
            log.error("Node \"{}\" is not in the upstream list of its downstream node \"{}\"",
                    node.getCommonId(), nodeDown.getCommonId());
            throw new NetworkStructureException(node.getCommonId(),
                    "Node \"" + node.getCommonId() + "\" is not listed upstream of \""
                            + nodeDown.getCommonId() + "\"");
        }
        int next = order.nextComputedIndex(index, count);
        if (next < 0) {
            // Only branch, or the last branch to process above the downstream node
            return nodeDown;
        }
        HydrologyNode nextBranchTop = absoluteUpstream(nodeDown.getUpstreamNode(next), order);
        log.debug("Computational downstream of \"{}\" jumps to top of branch {} at \"{}\"",
                node.getCommonId(), next + 1, nextBranchTop.getCommonId());
        return nextBranchTop;
    }

    // ========================= UPSTREAM =========================

    public HydrologyNode getUpstreamNode(HydrologyNode node, Position position, TributaryOrder order) {
        if (node == null) {
            throw new IllegalArgumentException("Cannot traverse upstream from a null node");
        }
        switch (position) {
            case RELATIVE:
                return node.getNumUpstreamNodes() == 0
                        ? node
                        : node.getUpstreamNode(order.continuationIndex(node.getNumUpstreamNodes()));
            case ABSOLUTE:
                return absoluteUpstream(node, order);
            case REACH:
                return reachUpstream(node);
            case COMPUTATIONAL:
                if (node.getNumUpstreamNodes() == 0) {
                    return findReachConfluenceNext(node, order);
                }
                return node.getUpstreamNode(order.lastComputedIndex(node.getNumUpstreamNodes()));
            default:
                throw new IllegalArgumentException("Unsupported position: " + position);
        }
    }

    /**
     * Follow the continuing branch of every node up to a leaf.
     */
    private HydrologyNode absoluteUpstream(HydrologyNode node, TributaryOrder order) {
        Set<HydrologyNode> visited = identitySet();
        HydrologyNode nodePt = node;
        while (nodePt.getNumUpstreamNodes() > 0) {
            if (!visited.add(nodePt)) {
                throw cycle(nodePt, "absolute upstream");
            }
            nodePt = nodePt.getUpstreamNode(order.continuationIndex(nodePt.getNumUpstreamNodes()));
        }
        return nodePt;
    }

    /**
     * Climb to the top of the current reach. A confluence with a single upstream
     * node is the top of its reach.
     */
    private HydrologyNode reachUpstream(HydrologyNode node) {
        Set<HydrologyNode> visited = identitySet();
        HydrologyNode nodePt = node;
        while (true) {
            if (!visited.add(nodePt)) {
                throw cycle(nodePt, "reach upstream");
            }
            if (nodePt.getNumUpstreamNodes() == 0) {
                return nodePt;
            }
            if (nodePt.getNumUpstreamNodes() == 1 && nodePt.getType() != null && nodePt.getType().isConfluence()) {
                return nodePt;
            }
            HydrologyNode next = nextUpstreamInReach(nodePt);
            if (next == null) {
                return nodePt;
            }
            nodePt = next;
        }
    }

    /**
     * Upstream node on the same reach (same reach counter), or null.
     */
    public HydrologyNode nextUpstreamInReach(HydrologyNode node) {
        for (HydrologyNode upstream : node.getUpstreamNodes()) {
            if (upstream.getReachCounter() == node.getReachCounter()) {
                return upstream;
            }
        }
        return null;
    }

    /**
     * Computational predecessor of a node with nothing upstream: the bottom node of
     * the sibling branch processed just before the branch holding {@code node}.
     * Returns {@code node} when it is the first node in computational order.
     */
    public HydrologyNode findReachConfluenceNext(HydrologyNode node, TributaryOrder order) {
        Set<HydrologyNode> visited = identitySet();
        HydrologyNode current = node;
        while (true) {
            if (!visited.add(current)) {
                throw cycle(current, "computational upstream");
            }
            HydrologyNode nodeDown = current.getDownstreamNode();
            if (nodeDown == null) {
                return node;
            }
            int index = nodeDown.indexOfUpstream(current);
            if (index < 0) {
                throw new NetworkStructureException(current.getCommonId(),
                        "Node \"" + current.getCommonId() + "\" is not listed upstream of \""
                                + nodeDown.getCommonId() + "\"");
            }
            int previous = order.previousComputedIndex(index, nodeDown.getNumUpstreamNodes());
            if (previous >= 0) {
                return nodeDown.getUpstreamNode(previous);
            }
            current = nodeDown;
        }
    }

    // ========================= WHOLE NETWORK =========================

    /**
     * First node in computational order.
     */
    public HydrologyNode getMostUpstreamNode(HydrologyNodeNetwork network) {
        HydrologyNode head = network.getNodeHead();
        if (head == null) {
            throw new NetworkStructureException("Network \"" + network.getNetworkId() + "\" has no head node");
        }
        TributaryOrder order = network.getTributaryOrder();
        return getUpstreamNode(getDownstreamNode(head, Position.ABSOLUTE, order), Position.ABSOLUTE, order);
    }

    /**
     * All nodes in computational order, ending with the End node.
     *
     * @throws NetworkStructureException if the walk stalls or revisits a node
     */
    public List<HydrologyNode> getNodeList(HydrologyNodeNetwork network) {
        TributaryOrder order = network.getTributaryOrder();
        List<HydrologyNode> nodes = new ArrayList<>();
        Set<HydrologyNode> visited = identitySet();

        HydrologyNode nodePt = getMostUpstreamNode(network);
        while (true) {
            if (!visited.add(nodePt)) {
                throw cycle(nodePt, "computational walk");
            }
            nodes.add(nodePt);
            if (nodePt.getDownstreamNode() == null) {
                return nodes;
            }
            HydrologyNode next = getDownstreamNode(nodePt, Position.COMPUTATIONAL, order);
            if (next == nodePt) {
                log.error("Computational walk made no progress at \"{}\"", nodePt.getCommonId());
                throw new NetworkStructureException(nodePt.getCommonId(),
                        "Computational walk made no progress at \"" + nodePt.getCommonId() + "\"");
            }
            nodePt = next;
        }
    }

    public int size(HydrologyNodeNetwork network) {
        return getNodeList(network).size();
    }

    private static Set<HydrologyNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private NetworkStructureException cycle(HydrologyNode node, String walk) {
        log.error("Cycle detected at \"{}\" during {} walk", node.getCommonId(), walk);
        return new NetworkStructureException(node.getCommonId(),
                "Cycle detected at \"" + node.getCommonId() + "\" during " + walk + " walk");
    }
}
