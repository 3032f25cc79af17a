package com.waterresources.streamnet.service.network;

import com.waterresources.streamnet.dto.network.NetworkLimits;
import com.waterresources.streamnet.exception.NodeNotFoundException;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.NodeDataType;
import com.waterresources.streamnet.model.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read-only queries over a network. Results that are lists are in computational
 * order (upstream to downstream) unless stated otherwise.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkQueryService {

    /**
     * Types reported by {@link #getNodeCounts}, in report order.
     */
    private static final List<NodeType> COUNTED_TYPES = List.of(
            NodeType.BASEFLOW, NodeType.CONFLUENCE, NodeType.DIVERSION, NodeType.DIVERSION_AND_WELL,
            NodeType.END, NodeType.IMPORT, NodeType.INSTREAM_FLOW, NodeType.OTHER,
            NodeType.PLAN, NodeType.RESERVOIR, NodeType.STREAMFLOW, NodeType.WELL);

    /**
     * Station types whose ids may carry a {@code .suffix} for modified structures.
     */
    private static final Set<NodeType> SUFFIXED_ID_TYPES = EnumSet.of(
            NodeType.DIVERSION, NodeType.DIVERSION_AND_WELL, NodeType.INSTREAM_FLOW,
            NodeType.RESERVOIR, NodeType.WELL, NodeType.IMPORT);

    private final NetworkTraversalService traversalService;

    // ========================= FIND =========================

    /**
     * First node, in computational order, whose id matches ignoring case.
     */
    public Optional<HydrologyNode> findNode(HydrologyNodeNetwork network, String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim();
        return traversalService.getNodeList(network).stream()
                .filter(node -> node.getCommonId().equalsIgnoreCase(wanted))
                .findFirst();
    }

    /**
     * Same as {@link #findNode(HydrologyNodeNetwork, String)} but fails when missing.
     *
     * @throws NodeNotFoundException if no node has the id
     */
    public HydrologyNode getNode(HydrologyNodeNetwork network, String id) {
        return findNode(network, id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    /**
     * First node of the given type (any type when null) whose secondary attribute
     * matches the value, ignoring case.
     */
    public Optional<HydrologyNode> findNode(HydrologyNodeNetwork network, NodeDataType dataType,
                                            NodeType nodeType, String value) {
        if (dataType == null || value == null) {
            return Optional.empty();
        }
        log.debug("Finding {} node with {} \"{}\"", nodeType != null ? nodeType : "any", dataType, value);
        return traversalService.getNodeList(network).stream()
                .filter(node -> nodeType == null || node.getType() == nodeType)
                .filter(node -> value.trim().equalsIgnoreCase(dataType.valueOf(node)))
                .findFirst();
    }

    // ========================= BY TYPE =========================

    /**
     * Nodes of a type. A null type selects every real (modeled) node, leaving out
     * the types that only shape the drawn network.
     */
    public List<HydrologyNode> getNodesForType(HydrologyNodeNetwork network, NodeType type) {
        Predicate<HydrologyNode> filter = type == null
                ? node -> node.getType() != null && node.getType().isReal()
                : node -> node.getType() == type;
        return traversalService.getNodeList(network).stream()
                .filter(filter)
                .collect(Collectors.toList());
    }

    public List<HydrologyNode> getRealNodes(HydrologyNodeNetwork network) {
        return getNodesForType(network, null);
    }

    public List<HydrologyNode> getNaturalFlowNodes(HydrologyNodeNetwork network) {
        return traversalService.getNodeList(network).stream()
                .filter(HydrologyNode::isNaturalFlow)
                .collect(Collectors.toList());
    }

    /**
     * Node count per station type, zero counts included.
     */
    public Map<NodeType, Integer> getNodeCounts(HydrologyNodeNetwork network) {
        Map<NodeType, Integer> counts = new LinkedHashMap<>();
        COUNTED_TYPES.forEach(type -> counts.put(type, 0));
        for (HydrologyNode node : traversalService.getNodeList(network)) {
            counts.computeIfPresent(node.getType(), (type, count) -> count + 1);
        }
        return counts;
    }

    /**
     * Ids of the nodes whose type is in the set. Structure ids are cut at the first
     * {@code .} so modified structures report the base structure id.
     */
    public List<String> getNodeIdentifiersByType(HydrologyNodeNetwork network, Collection<NodeType> types) {
        List<String> ids = new ArrayList<>();
        if (types == null || types.isEmpty()) {
            return ids;
        }
        for (HydrologyNode node : traversalService.getNodeList(network)) {
            if (!types.contains(node.getType())) continue;
            String id = node.getCommonId();
            int dot = id.indexOf('.');
            if (SUFFIXED_ID_TYPES.contains(node.getType()) && dot >= 0) {
                ids.add(id.substring(0, dot));
            } else {
                ids.add(id);
            }
        }
        return ids;
    }

    // ========================= NATURAL FLOW =========================

    /**
     * Nearest node downstream that is a natural-flow stream gauge, or null.
     */
    public HydrologyNode findDownstreamFlowNode(HydrologyNodeNetwork network, HydrologyNode node) {
        HydrologyNode nodePt = node.getDownstreamNode();
        while (nodePt != null) {
            if (nodePt.getType() == NodeType.STREAMFLOW && isNaturalFlow(network, nodePt)) {
                log.debug("Downstream flow node for \"{}\" is \"{}\"", node.getCommonId(), nodePt.getCommonId());
                return nodePt;
            }
            nodePt = nodePt.getDownstreamNode();
        }
        log.debug("Node \"{}\" has no downstream flow node", node.getCommonId());
        return null;
    }

    /**
     * Nearest natural-flow node downstream without leaving the node's reach, or null.
     */
    public HydrologyNode findDownstreamNaturalFlowNodeInReach(HydrologyNodeNetwork network, HydrologyNode node) {
        for (HydrologyNode nodePt = node.getDownstreamNode();
             nodePt != null && nodePt.getReachCounter() == node.getReachCounter();
             nodePt = nodePt.getDownstreamNode()) {
            if (isNaturalFlow(network, nodePt)) {
                return nodePt;
            }
        }
        return null;
    }

    /**
     * Nearest natural-flow node upstream without leaving the node's reach, or null.
     */
    public HydrologyNode findUpstreamNaturalFlowNodeInReach(HydrologyNodeNetwork network, HydrologyNode node) {
        for (HydrologyNode nodePt = traversalService.nextUpstreamInReach(node);
             nodePt != null;
             nodePt = traversalService.nextUpstreamInReach(nodePt)) {
            if (isNaturalFlow(network, nodePt)) {
                return nodePt;
            }
        }
        return null;
    }

    public List<HydrologyNode> findUpstreamFlowNodes(HydrologyNodeNetwork network, HydrologyNode node) {
        return findUpstreamFlowNodes(network, node, n -> false);
    }

    /**
     * Nearest upstream gauge on every branch above {@code node}: a natural-flow stream
     * gauge (dry river gauges count when the network treats them as natural flow), or
     * any node accepted by {@code extraTarget}. The search does not continue
     * past a gauge, so each path contributes at most one node.
     */
    public List<HydrologyNode> findUpstreamFlowNodes(HydrologyNodeNetwork network, HydrologyNode node,
                                                     Predicate<HydrologyNode> extraTarget) {
        List<HydrologyNode> found = new ArrayList<>();
        Set<HydrologyNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<HydrologyNode> stack = new ArrayDeque<>(node.getUpstreamNodes());
        while (!stack.isEmpty()) {
            HydrologyNode nodePt = stack.pop();
            if (!visited.add(nodePt)) continue;
            if ((nodePt.getType() == NodeType.STREAMFLOW && isNaturalFlow(network, nodePt)) || extraTarget.test(nodePt)) {
                log.debug("Found upstream tributary gage \"{}\" above \"{}\"", nodePt.getCommonId(), node.getCommonId());
                found.add(nodePt);
                continue;
            }
            nodePt.getUpstreamNodes().forEach(stack::push);
        }
        found.sort(Comparator.comparingInt(HydrologyNode::getComputationalOrder));
        return found;
    }

    private boolean isNaturalFlow(HydrologyNodeNetwork network, HydrologyNode node) {
        return node.isNaturalFlow() || (network.isTreatDryAsNaturalFlow() && node.isDryRiver());
    }

    // ========================= UPSTREAM / SEQUENCES =========================

    /**
     * Every node upstream of {@code node} on all branches, depth first.
     *
     * @param addFirstNode include {@code node} itself
     * @param stopIds      ids to include but not search past; a leading {@code -}
     *                     means stop there without including the node
     */
    public List<HydrologyNode> findUpstreamNodes(HydrologyNode node, boolean addFirstNode, List<String> stopIds) {
        List<HydrologyNode> found = new ArrayList<>();
        if (node == null) {
            return found;
        }
        if (addFirstNode) {
            found.add(node);
        }
        Deque<HydrologyNode> stack = new ArrayDeque<>();
        pushReversed(stack, node.getUpstreamNodes());
        while (!stack.isEmpty()) {
            HydrologyNode nodePt = stack.pop();
            String stopId = matchStopId(nodePt, stopIds);
            if (stopId != null) {
                if (!stopId.startsWith("-")) {
                    found.add(nodePt);
                }
                continue;
            }
            found.add(nodePt);
            pushReversed(stack, nodePt.getUpstreamNodes());
        }
        return found;
    }

    private static String matchStopId(HydrologyNode node, List<String> stopIds) {
        if (stopIds == null) return null;
        for (String stopId : stopIds) {
            String id = stopId.startsWith("-") ? stopId.substring(1) : stopId;
            if (id.equalsIgnoreCase(node.getCommonId())) {
                return stopId;
            }
        }
        return null;
    }

    private static void pushReversed(Deque<HydrologyNode> stack, List<HydrologyNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(nodes.get(i));
        }
    }

    /**
     * Nodes on the path from {@code node1} to {@code node2}: down from {@code node1} to
     * the nearest node downstream of both, then up to {@code node2}. Empty when the
     * nodes are not connected.
     */
    public List<HydrologyNode> getNodeSequence(HydrologyNode node1, HydrologyNode node2) {
        if (node1 == null || node2 == null) {
            return new ArrayList<>();
        }
        List<HydrologyNode> pathA = pathToEnd(node1);
        List<HydrologyNode> pathB = pathToEnd(node2);
        Map<HydrologyNode, Integer> indexInB = new IdentityHashMap<>();
        for (int i = 0; i < pathB.size(); i++) {
            indexInB.put(pathB.get(i), i);
        }
        for (int i = 0; i < pathA.size(); i++) {
            Integer j = indexInB.get(pathA.get(i));
            if (j != null) {
                List<HydrologyNode> sequence = new ArrayList<>(pathA.subList(0, i + 1));
                List<HydrologyNode> up = new ArrayList<>(pathB.subList(0, j));
                Collections.reverse(up);
                sequence.addAll(up);
                return sequence;
            }
        }
        return new ArrayList<>();
    }

    private static List<HydrologyNode> pathToEnd(HydrologyNode node) {
        List<HydrologyNode> path = new ArrayList<>();
        Set<HydrologyNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (HydrologyNode nodePt = node; nodePt != null && seen.add(nodePt); nodePt = nodePt.getDownstreamNode()) {
            path.add(nodePt);
        }
        return path;
    }

    /**
     * True when no real node sits above {@code node} on its reach.
     */
    public boolean isMostUpstreamNodeInReach(HydrologyNode node) {
        for (HydrologyNode nodePt = traversalService.nextUpstreamInReach(node);
             nodePt != null;
             nodePt = traversalService.nextUpstreamInReach(nodePt)) {
            if (nodePt.getType() != null && nodePt.getType().isReal()) {
                return false;
            }
        }
        return true;
    }

    // ========================= NEXT DOWNSTREAM =========================

    /**
     * Next downstream node that is not a drawing-only node, or null at the end.
     */
    public HydrologyNode findNextRealDownstreamNode(HydrologyNode node) {
        return nextDownstreamMatching(node, type -> !type.isDecorative());
    }

    public HydrologyNode findNextRealOrXConfluenceDownstreamNode(HydrologyNode node) {
        return nextDownstreamMatching(node, type -> !type.isDecorative() || type == NodeType.XCONFLUENCE);
    }

    public HydrologyNode findNextXConfluenceDownstreamNode(HydrologyNode node) {
        return nextDownstreamMatching(node, type -> type == NodeType.XCONFLUENCE);
    }

    private HydrologyNode nextDownstreamMatching(HydrologyNode node, Predicate<NodeType> accept) {
        Set<HydrologyNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (HydrologyNode nodePt = node.getDownstreamNode(); nodePt != null; nodePt = nodePt.getDownstreamNode()) {
            if (!seen.add(nodePt)) {
                return null;
            }
            if (nodePt.getType() != null && accept.test(nodePt.getType())) {
                return nodePt;
            }
        }
        return null;
    }

    // ========================= EXTENT =========================

    /**
     * Bounding box of all located nodes; (0, 0, 1, 1) when no node has a location.
     */
    public NetworkLimits determineExtent(HydrologyNodeNetwork network) {
        double lx = Double.NaN;
        double rx = Double.NaN;
        double by = Double.NaN;
        double ty = Double.NaN;
        for (HydrologyNode node : traversalService.getNodeList(network)) {
            if (!node.hasLocation()) continue;
            lx = Double.isNaN(lx) ? node.getX() : Math.min(lx, node.getX());
            rx = Double.isNaN(rx) ? node.getX() : Math.max(rx, node.getX());
            by = Double.isNaN(by) ? node.getY() : Math.min(by, node.getY());
            ty = Double.isNaN(ty) ? node.getY() : Math.max(ty, node.getY());
        }
        if (Double.isNaN(lx)) {
            log.debug("No located nodes in network \"{}\", using unit extent", network.getNetworkId());
            return new NetworkLimits(0, 0, 1, 1);
        }
        return new NetworkLimits(lx, by, rx, ty);
    }
}
