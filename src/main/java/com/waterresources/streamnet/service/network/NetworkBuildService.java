package com.waterresources.streamnet.service.network;

import com.waterresources.streamnet.config.NetworkSettings;
import com.waterresources.streamnet.dto.network.NodeLink;
import com.waterresources.streamnet.exception.NetworkStructureException;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.NodeType;
import com.waterresources.streamnet.model.TributaryOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds networks: creation, bulk rebuild from unordered id-only input, the full
 * renumbering pass, and export to flat {@link NodeLink} records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkBuildService {

    private final NetworkTraversalService traversalService;
    private final NetworkSettings settings;

    // ========================= CREATION =========================

    /**
     * Create a network holding only its End node, using the configured convention.
     */
    public HydrologyNodeNetwork createNetwork(String networkId, String networkName) {
        return createNetwork(networkId, networkName, settings.getTributaryOrder());
    }

    public HydrologyNodeNetwork createNetwork(String networkId, String networkName, TributaryOrder order) {
        HydrologyNodeNetwork network = emptyNetwork(networkId, networkName, order);

        HydrologyNode endNode = new HydrologyNode(settings.getEndNodeId(), NodeType.END);
        endNode.setSerial(1);
        endNode.setComputationalOrder(1);
        endNode.setReachCounter(1);
        endNode.setNodeInReachNumber(1);
        endNode.setTributaryNumber(1);

        network.setNodeHead(endNode);
        network.setNodeCount(1);
        log.info("Created network \"{}\" with end node \"{}\" ({})", networkId, endNode.getCommonId(), order);
        return network;
    }

    private HydrologyNodeNetwork emptyNetwork(String networkId, String networkName, TributaryOrder order) {
        HydrologyNodeNetwork network = new HydrologyNodeNetwork(networkId, networkName);
        network.setTributaryOrder(order);
        network.setTreatDryAsNaturalFlow(settings.isTreatDryAsNaturalFlow());
        return network;
    }

    // ========================= BULK REBUILD =========================

    /**
     * Rebuild a network from links exported by {@link #exportNodeLinks}, or written by
     * any other producer of id-only adjacency.
     */
    public HydrologyNodeNetwork rebuildFromLinks(String networkId, String networkName,
                                                 List<NodeLink> links, boolean endFirst) {
        return rebuildFromLinks(networkId, networkName, links, endFirst, settings.getTributaryOrder());
    }

    public HydrologyNodeNetwork rebuildFromLinks(String networkId, String networkName,
                                                 List<NodeLink> links, boolean endFirst, TributaryOrder order) {
        List<HydrologyNode> nodes = links.stream()
                .map(this::toNode)
                .collect(Collectors.toList());
        HydrologyNodeNetwork network = emptyNetwork(networkId, networkName, order);
        rebuildNetwork(network, nodes, endFirst);
        return network;
    }

    /**
     * Rebuild links and all ordering metadata from nodes whose only populated
     * adjacency is {@code downstreamNodeId} / {@code upstreamNodeIds}.
     *
     * Every id is resolved and the tree shape verified before any node is touched.
     *
     * @param endFirst true when the End node is at the start of the list, false when
     *                 the list runs from the top of the network down to End
     * @throws NetworkStructureException on duplicate ids, an unresolved downstream id,
     *                                   more than one terminal node, or nodes that are
     *                                   not connected to the End node
     */
    public void rebuildNetwork(HydrologyNodeNetwork network, List<HydrologyNode> nodeList, boolean endFirst) {
        if (nodeList == null || nodeList.isEmpty()) {
            throw new IllegalArgumentException("Cannot rebuild a network from an empty node list");
        }
        log.info("Rebuilding network \"{}\" from {} nodes (end first: {})",
                network.getNetworkId(), nodeList.size(), endFirst);

        List<HydrologyNode> nodes = new ArrayList<>(nodeList);
        if (!endFirst) {
            Collections.reverse(nodes);
        }
        int size = nodes.size();
        Map<String, Integer> indexById = indexById(nodes);

        int head = findHead(nodes, indexById);
        int[] downstream = resolveDownstream(nodes, indexById, head);
        List<List<Integer>> upstream = resolveUpstream(nodes, indexById, downstream);

        int reached = countConnected(head, upstream);
        if (reached != size) {
            log.error("Only {} of {} nodes are connected to \"{}\"", reached, size, nodes.get(head).getCommonId());
            throw new NetworkStructureException(nodes.get(head).getCommonId(),
                    "Only " + reached + " of " + size + " nodes are connected to the end node \""
                            + nodes.get(head).getCommonId() + "\"");
        }

        // Validation done, apply
        for (int i = 0; i < size; i++) {
            HydrologyNode node = nodes.get(i);
            node.setDownstreamNodeId(downstream[i] >= 0 ? nodes.get(downstream[i]).getCommonId() : null);
            node.setUpstreamNodeIds(upstream.get(i).stream()
                    .map(u -> nodes.get(u).getCommonId())
                    .collect(Collectors.toCollection(ArrayList::new)));
        }
        relinkFromIds(nodes);

        network.setNetworkFromNodes(nodes);
        int reaches = renumber(network);
        log.info("Rebuilt network \"{}\": {} nodes, {} reaches", network.getNetworkId(), size, reaches);
    }

    private Map<String, Integer> indexById(List<HydrologyNode> nodes) {
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getCommonId();
            if (isBlankId(id)) {
                throw new NetworkStructureException("Node at position " + i + " has no id");
            }
            if (indexById.put(key(id), i) != null) {
                log.error("Duplicate node id \"{}\" in rebuild input", id);
                throw new NetworkStructureException(id, "Duplicate node id \"" + id + "\"");
            }
        }
        return indexById;
    }

    private int findHead(List<HydrologyNode> nodes, Map<String, Integer> indexById) {
        if (isBlankId(nodes.get(0).getDownstreamNodeId())) {
            return 0;
        }
        int head = -1;
        for (int i = 0; i < nodes.size(); i++) {
            if (isBlankId(nodes.get(i).getDownstreamNodeId())) {
                if (head >= 0) {
                    throw new NetworkStructureException(nodes.get(i).getCommonId(),
                            "More than one node without a downstream node: \"" + nodes.get(head).getCommonId()
                                    + "\" and \"" + nodes.get(i).getCommonId() + "\"");
                }
                head = i;
            }
        }
        if (head < 0) {
            throw new NetworkStructureException("No node without a downstream node, cannot find the end node");
        }
        log.warn("End node \"{}\" is not at the expected end of the input list", nodes.get(head).getCommonId());
        return head;
    }

    private int[] resolveDownstream(List<HydrologyNode> nodes, Map<String, Integer> indexById, int head) {
        int[] downstream = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            HydrologyNode node = nodes.get(i);
            String dsId = node.getDownstreamNodeId();
            if (i == head) {
                downstream[i] = -1;
                continue;
            }
            if (isBlankId(dsId)) {
                throw new NetworkStructureException(node.getCommonId(),
                        "More than one node without a downstream node: \"" + nodes.get(head).getCommonId()
                                + "\" and \"" + node.getCommonId() + "\"");
            }
            Integer ds = indexById.get(key(dsId));
            if (ds == null) {
                log.error("Processing node \"{}\" - downstream ID \"{}\" not found", node.getCommonId(), dsId);
                throw new NetworkStructureException(node.getCommonId(),
                        "Processing node \"" + node.getCommonId() + "\" - downstream ID \"" + dsId + "\" not found");
            }
            downstream[i] = ds;
        }
        return downstream;
    }

    /**
     * Upstream index lists in the order given by each node's upstream ids. The
     * downstream id is authoritative: listed ids that point elsewhere are dropped and
     * unlisted children are appended.
     */
    private List<List<Integer>> resolveUpstream(List<HydrologyNode> nodes, Map<String, Integer> indexById,
                                                int[] downstream) {
        List<List<Integer>> upstream = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            upstream.add(new ArrayList<>());
        }
        for (int i = 0; i < nodes.size(); i++) {
            List<String> usIds = nodes.get(i).getUpstreamNodeIds();
            if (usIds == null) continue;
            for (String usId : usIds) {
                if (isBlankId(usId)) continue;
                Integer us = indexById.get(key(usId));
                if (us == null) {
                    log.warn("Node \"{}\" lists upstream ID \"{}\" that is not in the network, skipping",
                            nodes.get(i).getCommonId(), usId);
                } else if (downstream[us] != i) {
                    log.warn("Node \"{}\" lists upstream ID \"{}\" whose downstream node is different, skipping",
                            nodes.get(i).getCommonId(), usId);
                } else if (!upstream.get(i).contains(us)) {
                    upstream.get(i).add(us);
                }
            }
        }
        for (int i = 0; i < nodes.size(); i++) {
            int ds = downstream[i];
            if (ds >= 0 && !upstream.get(ds).contains(i)) {
                log.warn("Node \"{}\" is not listed upstream of \"{}\", appending",
                        nodes.get(i).getCommonId(), nodes.get(ds).getCommonId());
                upstream.get(ds).add(i);
            }
        }
        return upstream;
    }

    /**
     * Number of nodes reachable from the head through the resolved upstream lists.
     * Uses an explicit stack so long unbranched reaches cannot overflow the call stack.
     */
    private int countConnected(int head, List<List<Integer>> upstream) {
        int reached = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(head);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (reached++ > upstream.size()) {
                throw new NetworkStructureException("Rebuild visited more nodes than the input holds");
            }
            upstream.get(node).forEach(stack::push);
        }
        return reached;
    }

    // ========================= RELINK / RENUMBER =========================

    /**
     * Replace every live link with the one named by the node's id fields. All
     * downstream ids are resolved before any link is changed.
     *
     * @throws NetworkStructureException if a downstream id does not match a node
     */
    public void relinkFromIds(List<HydrologyNode> nodes) {
        Map<String, HydrologyNode> byId = new HashMap<>();
        for (HydrologyNode node : nodes) {
            if (byId.put(key(node.getCommonId()), node) != null) {
                throw new NetworkStructureException(node.getCommonId(),
                        "Duplicate node id \"" + node.getCommonId() + "\"");
            }
        }
        Map<HydrologyNode, HydrologyNode> downstreamOf = new HashMap<>();
        for (HydrologyNode node : nodes) {
            String dsId = node.getDownstreamNodeId();
            if (isBlankId(dsId)) continue;
            HydrologyNode ds = byId.get(key(dsId));
            if (ds == null) {
                log.error("Downstream ID \"{}\" of node \"{}\" not found", dsId, node.getCommonId());
                throw new NetworkStructureException(node.getCommonId(),
                        "Downstream ID \"" + dsId + "\" of node \"" + node.getCommonId() + "\" not found");
            }
            downstreamOf.put(node, ds);
        }

        for (HydrologyNode node : nodes) {
            node.clearLinks();
        }
        for (HydrologyNode node : nodes) {
            node.setDownstreamNode(downstreamOf.get(node));
            for (String usId : node.getUpstreamNodeIds()) {
                HydrologyNode us = byId.get(key(usId));
                if (us == null) {
                    log.warn("Upstream ID \"{}\" of node \"{}\" not found, skipping", usId, node.getCommonId());
                    continue;
                }
                node.getUpstreamNodes().add(us);
            }
        }
    }

    /**
     * Full renumbering pass: reaches from the upstream lists, then computational
     * order 1..N and serial N..1 along the computational walk.
     *
     * @return number of reaches
     */
    public int renumber(HydrologyNodeNetwork network) {
        int reaches = assignReaches(network);
        List<HydrologyNode> nodes = traversalService.getNodeList(network);
        int size = nodes.size();
        for (int i = 0; i < size; i++) {
            HydrologyNode node = nodes.get(i);
            node.setComputationalOrder(i + 1);
            node.setSerial(size - i);
        }
        network.setNodeCount(size);
        log.debug("Renumbered {} nodes in {} reaches in network \"{}\"", size, reaches, network.getNetworkId());
        return reaches;
    }

    /**
     * Depth-first reach assignment from the head. The first upstream node of every
     * node is the branch that was there before any tributary joined, so it keeps the
     * downstream node's reach; every other branch opens a new reach numbered in
     * discovery order. Tributary numbers follow upstream list positions.
     *
     * @return highest reach number
     */
    private int assignReaches(HydrologyNodeNetwork network) {
        HydrologyNode head = network.getNodeHead();
        head.setReachCounter(1);
        head.setNodeInReachNumber(1);
        head.setTributaryNumber(1);
        int highestReach = 1;

        Set<HydrologyNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(head);
        Deque<HydrologyNode> stack = new ArrayDeque<>();
        pushUpstream(stack, head);
        while (!stack.isEmpty()) {
            HydrologyNode node = stack.pop();
            if (!visited.add(node)) {
                log.error("Node \"{}\" is reached twice while numbering reaches", node.getCommonId());
                throw new NetworkStructureException(node.getCommonId(),
                        "Node \"" + node.getCommonId() + "\" is reached twice while numbering reaches");
            }
            HydrologyNode ds = node.getDownstreamNode();
            int position = ds.indexOfUpstream(node);
            if (position == 0) {
                node.setReachCounter(ds.getReachCounter());
                node.setNodeInReachNumber(ds.getNodeInReachNumber() + 1);
            } else {
                node.setReachCounter(++highestReach);
                node.setNodeInReachNumber(1);
            }
            node.setTributaryNumber(position + 1);
            pushUpstream(stack, node);
        }
        return highestReach;
    }

    private void pushUpstream(Deque<HydrologyNode> stack, HydrologyNode node) {
        List<HydrologyNode> upstream = node.getUpstreamNodes();
        for (int i = upstream.size() - 1; i >= 0; i--) {
            stack.push(upstream.get(i));
        }
    }

    // ========================= EXPORT =========================

    /**
     * Flat id-only view of every node in computational order.
     */
    public List<NodeLink> exportNodeLinks(HydrologyNodeNetwork network) {
        return traversalService.getNodeList(network).stream()
                .map(this::toLink)
                .collect(Collectors.toList());
    }

    private NodeLink toLink(HydrologyNode node) {
        return NodeLink.builder()
                .id(node.getCommonId())
                .type(node.getType())
                .description(node.getDescription())
                .link(node.getLink())
                .naturalFlow(node.isNaturalFlow())
                .importNode(node.isImportNode())
                .dryRiver(node.isDryRiver())
                .x(node.hasLocation() ? node.getX() : null)
                .y(node.hasLocation() ? node.getY() : null)
                .downstreamId(node.getDownstreamNode() != null ? node.getDownstreamNode().getCommonId() : null)
                .upstreamIds(node.getUpstreamNodeIdsFromLinks())
                .serial(node.getSerial())
                .computationalOrder(node.getComputationalOrder())
                .reachCounter(node.getReachCounter())
                .nodeInReachNumber(node.getNodeInReachNumber())
                .tributaryNumber(node.getTributaryNumber())
                .build();
    }

    private HydrologyNode toNode(NodeLink link) {
        HydrologyNode node = new HydrologyNode(link.getId(), link.getType() != null ? link.getType() : NodeType.UNKNOWN);
        node.setDescription(link.getDescription());
        node.setLink(link.getLink());
        node.setNaturalFlow(link.isNaturalFlow());
        node.setImportNode(link.isImportNode());
        node.setDryRiver(link.isDryRiver());
        if (link.getX() != null && link.getY() != null) {
            node.setLocation(link.getX(), link.getY());
        }
        node.setDownstreamNodeId(link.getDownstreamId());
        node.setUpstreamNodeIds(link.getUpstreamIds() != null
                ? new ArrayList<>(link.getUpstreamIds())
                : new ArrayList<>());
        return node;
    }

    static String key(String id) {
        return id.trim().toUpperCase(Locale.ROOT);
    }

    static boolean isBlankId(String id) {
        return id == null || id.isBlank() || id.equalsIgnoreCase("null");
    }
}
