package com.waterresources.streamnet.service.network;

import com.waterresources.streamnet.config.NetworkSettings;
import com.waterresources.streamnet.dto.network.InsertNodeRequest;
import com.waterresources.streamnet.dto.network.InsertResult;
import com.waterresources.streamnet.dto.network.NetworkAdvisory;
import com.waterresources.streamnet.exception.NodeNotFoundException;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.NodeType;
import com.waterresources.streamnet.model.TributaryOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Interactive edits: insert, delete and legacy type conversion.
 *
 * Anchors are resolved and new values computed before the network is touched, so a
 * {@link NodeNotFoundException} leaves the network as it was. After each edit the
 * reach, tributary, serial and computational numbers are rebuilt by a full
 * renumber pass.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkEditService {

    private final NetworkTraversalService traversalService;
    private final NetworkBuildService buildService;
    private final NetworkSettings settings;

    // ========================= INSERT =========================

    /**
     * Insert a node directly upstream of {@code request.downstreamId}. If
     * {@code request.upstreamId} names one of that node's upstream nodes the new node
     * is placed between the two; otherwise it starts a new tributary.
     *
     * @throws NodeNotFoundException if the downstream node is missing, or the upstream
     *                               node is missing or not directly upstream of it
     */
    public InsertResult insertNode(HydrologyNodeNetwork network, InsertNodeRequest request) {
        if (request.getId() == null || request.getId().isBlank()) {
            throw new IllegalArgumentException("Node id is required");
        }
        if (request.getDownstreamId() == null || request.getDownstreamId().isBlank()) {
            throw new IllegalArgumentException("Downstream node id is required for \"" + request.getId() + "\"");
        }

        List<HydrologyNode> nodes = traversalService.getNodeList(network);
        HydrologyNode downstream = findIn(nodes, request.getDownstreamId());
        if (downstream == null) {
            throw new NodeNotFoundException(request.getDownstreamId(),
                    "Downstream node \"" + request.getDownstreamId() + "\" not found");
        }

        HydrologyNode upstream = null;
        int position = -1;
        if (request.getUpstreamId() != null && !request.getUpstreamId().isBlank()) {
            upstream = findIn(nodes, request.getUpstreamId());
            if (upstream == null) {
                throw new NodeNotFoundException(request.getUpstreamId(),
                        "Upstream node \"" + request.getUpstreamId() + "\" not found");
            }
            position = downstream.indexOfUpstream(upstream);
            if (position < 0) {
                throw new NodeNotFoundException(request.getUpstreamId(),
                        "Node \"" + upstream.getCommonId() + "\" is not directly upstream of \""
                                + downstream.getCommonId() + "\"");
            }
        }

        List<NetworkAdvisory> advisories = new ArrayList<>();
        String nodeId = checkUniqueId(nodes, request.getId().trim());
        if (!nodeId.equals(request.getId().trim())) {
            log.warn("Node id \"{}\" already exists, inserting as \"{}\"", request.getId(), nodeId);
            advisories.add(NetworkAdvisory.builder()
                    .type(NetworkAdvisory.AdvisoryType.DUPLICATE_ID)
                    .nodeId(nodeId)
                    .message("Node id \"" + request.getId() + "\" already exists, node renamed to \"" + nodeId + "\"")
                    .build());
        }

        HydrologyNode node = new HydrologyNode(nodeId, request.getType() != null ? request.getType() : NodeType.UNKNOWN);
        node.setDescription(request.getDescription());
        node.setNaturalFlow(request.isNaturalFlow());
        node.setImportNode(request.isImportNode());
        node.setDryRiver(request.isDryRiver());
        placeNewNode(node, downstream, upstream);

        if (upstream != null) {
            // Between the downstream node and an existing branch: take over the upstream node's slot
            downstream.replaceUpstreamNode(node, position);
            node.setDownstreamNode(downstream);
            node.addUpstreamNode(upstream);
        } else {
            downstream.addUpstreamNode(node);
        }

        buildService.renumber(network);
        log.info("Inserted node \"{}\" upstream of \"{}\"{} in network \"{}\"", nodeId, downstream.getCommonId(),
                upstream != null ? " and downstream of \"" + upstream.getCommonId() + "\"" : "",
                network.getNetworkId());
        return InsertResult.builder()
                .node(node)
                .requestedId(request.getId().trim())
                .advisories(advisories)
                .build();
    }

    /**
     * Initial location for an inserted node: midpoint when it is placed between two
     * nodes, otherwise the downstream node's own step repeated upstream, otherwise a
     * small nudge off the downstream node. Left unset when the downstream node has no
     * location.
     */
    private void placeNewNode(HydrologyNode node, HydrologyNode downstream, HydrologyNode upstream) {
        if (!downstream.hasLocation()) {
            return;
        }
        double x1 = downstream.getX();
        double y1 = downstream.getY();
        if (upstream != null && upstream.hasLocation()) {
            node.setLocation((x1 + upstream.getX()) / 2, (y1 + upstream.getY()) / 2);
            return;
        }
        HydrologyNode downstreamOfDownstream = downstream.getDownstreamNode();
        if (downstreamOfDownstream != null && downstreamOfDownstream.hasLocation()) {
            double dx = x1 - downstreamOfDownstream.getX();
            double dy = y1 - downstreamOfDownstream.getY();
            node.setLocation(x1 + dx, y1 + dy);
        } else {
            node.setLocation(x1 + settings.getInsertEpsilon(), y1 + settings.getInsertEpsilon());
        }
    }

    /**
     * The id itself when unused, otherwise the first free {@code id_<n>}.
     */
    public String checkUniqueId(HydrologyNodeNetwork network, String id) {
        return checkUniqueId(traversalService.getNodeList(network), id);
    }

    private String checkUniqueId(List<HydrologyNode> nodes, String id) {
        if (findIn(nodes, id) == null) {
            return id;
        }
        int count = 1;
        while (findIn(nodes, id + "_" + count) != null) {
            count++;
        }
        return id + "_" + count;
    }

    // ========================= DELETE =========================

    /**
     * Delete a node, attaching its upstream nodes directly to its downstream node.
     * The merged upstream list keeps computational order: it is sorted by serial
     * and tributary numbers are reassigned from 1.
     *
     * @return false when the node is the End node, which is never deleted
     * @throws NodeNotFoundException if no node has the id
     */
    public boolean deleteNode(HydrologyNodeNetwork network, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id is required to delete a node");
        }
        List<HydrologyNode> nodes = traversalService.getNodeList(network);
        HydrologyNode target = findIn(nodes, id);
        if (target == null) {
            throw new NodeNotFoundException(id);
        }
        if (target.isEnd() || target.getDownstreamNode() == null) {
            log.warn("Node \"{}\" is the end node of network \"{}\" and cannot be deleted",
                    target.getCommonId(), network.getNetworkId());
            return false;
        }

        HydrologyNode downstream = target.getDownstreamNode();
        List<HydrologyNode> children = new ArrayList<>(target.getUpstreamNodes());

        // Externalize every remaining link to ids
        for (HydrologyNode node : nodes) {
            if (node == target) continue;
            node.setDownstreamNodeId(node.getDownstreamNode() == null ? null : node.getDownstreamNode().getCommonId());
            node.setUpstreamNodeIds(new ArrayList<>(node.getUpstreamNodeIdsFromLinks()));
        }
        for (HydrologyNode child : children) {
            child.setDownstreamNodeId(downstream.getCommonId());
        }

        Map<String, Integer> serialById = new HashMap<>();
        for (HydrologyNode node : nodes) {
            serialById.put(NetworkBuildService.key(node.getCommonId()), node.getSerial());
        }
        Comparator<String> bySerial = Comparator.comparingInt(s -> serialById.get(NetworkBuildService.key(s)));
        if (network.getTributaryOrder() == TributaryOrder.ADDED_LAST) {
            bySerial = bySerial.reversed();
        }
        List<String> merged = downstream.getUpstreamNodeIds().stream()
                .filter(s -> !s.equalsIgnoreCase(target.getCommonId()))
                .collect(Collectors.toCollection(ArrayList::new));
        children.forEach(child -> merged.add(child.getCommonId()));
        merged.sort(bySerial);
        downstream.setUpstreamNodeIds(merged);

        List<HydrologyNode> remaining = nodes.stream()
                .filter(node -> node != target)
                .collect(Collectors.toList());
        buildService.relinkFromIds(remaining);
        target.clearLinks();
        target.setDownstreamNodeId(null);
        target.setUpstreamNodeIds(new ArrayList<>());

        buildService.renumber(network);
        log.info("Deleted node \"{}\" from network \"{}\", {} upstream node(s) moved to \"{}\"",
                target.getCommonId(), network.getNetworkId(), children.size(), downstream.getCommonId());
        return true;
    }

    // ========================= TYPE CONVERSION =========================

    /**
     * Convert legacy node types: baseflow nodes become natural-flow "other" nodes and
     * import nodes become "other" nodes flagged as imports.
     */
    public List<NetworkAdvisory> convertNodeTypes(HydrologyNodeNetwork network) {
        List<NetworkAdvisory> advisories = new ArrayList<>();
        for (HydrologyNode node : traversalService.getNodeList(network)) {
            NodeType old = node.getType();
            if (old == NodeType.BASEFLOW) {
                node.setType(NodeType.OTHER);
                node.setNaturalFlow(true);
            } else if (old == NodeType.IMPORT) {
                node.setType(NodeType.OTHER);
                node.setImportNode(true);
            } else {
                continue;
            }
            log.warn("Converted node \"{}\" from {} to {}", node.getCommonId(), old, node.getType());
            advisories.add(NetworkAdvisory.builder()
                    .type(NetworkAdvisory.AdvisoryType.TYPE_CONVERTED)
                    .nodeId(node.getCommonId())
                    .message("Node \"" + node.getCommonId() + "\" converted from " + old.getDisplayName()
                            + " to " + node.getType().getDisplayName())
                    .build());
        }
        return advisories;
    }

    private static HydrologyNode findIn(List<HydrologyNode> nodes, String id) {
        for (HydrologyNode node : nodes) {
            if (node.getCommonId().equalsIgnoreCase(id.trim())) {
                return node;
            }
        }
        return null;
    }
}
