package com.waterresources.streamnet.service.network;

import com.waterresources.streamnet.dto.network.IntegrityViolation;
import com.waterresources.streamnet.dto.network.IntegrityViolation.Rule;
import com.waterresources.streamnet.dto.network.IntegrityViolation.Severity;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
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

/**
 * Checks a network for broken topology and numbering drift. Problems are reported,
 * never thrown, so a damaged network can still be inspected.
 *
 * Two passes:
 * 1. Structure: depth-first over upstream links from the head, checking that the
 *    graph is a tree with mutual links and unique ids.
 * 2. Numbering: only when the structure is sound, walks the computational order
 *    and checks serial, computational order, tributary numbers and the node count.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkIntegrityChecker {

    private final NetworkTraversalService traversalService;

    public List<IntegrityViolation> checkNetwork(HydrologyNodeNetwork network) {
        log.info("Checking integrity of network \"{}\"", network.getNetworkId());
        List<IntegrityViolation> violations = new ArrayList<>();

        HydrologyNode head = network.getNodeHead();
        if (head == null) {
            violations.add(violation(Severity.ERROR, Rule.HEAD_NOT_END, null, "Network has no head node"));
            return violations;
        }

        List<HydrologyNode> nodes = checkStructure(head, violations);
        boolean structureOk = violations.stream().noneMatch(v -> v.getSeverity() == Severity.ERROR);
        if (structureOk) {
            checkNumbering(network, nodes.size(), violations);
        }

        if (violations.isEmpty()) {
            log.info("Network \"{}\" passed the integrity check ({} nodes)", network.getNetworkId(), nodes.size());
        } else {
            log.warn("Network \"{}\" has {} integrity problem(s)", network.getNetworkId(), violations.size());
        }
        return violations;
    }

    public boolean isValid(HydrologyNodeNetwork network) {
        return checkNetwork(network).isEmpty();
    }

    // ========================= STRUCTURE =========================

    private List<HydrologyNode> checkStructure(HydrologyNode head, List<IntegrityViolation> violations) {
        if (!head.isEnd()) {
            violations.add(violation(Severity.ERROR, Rule.HEAD_NOT_END, head.getCommonId(),
                    "Bottom-most node \"" + head.getCommonId() + "\" is not an END node"));
        }
        if (head.getDownstreamNode() != null) {
            violations.add(violation(Severity.ERROR, Rule.HEAD_NOT_END, head.getCommonId(),
                    "Head node \"" + head.getCommonId() + "\" has downstream node \""
                            + head.getDownstreamNode().getCommonId() + "\""));
        }

        List<HydrologyNode> nodes = new ArrayList<>();
        Set<HydrologyNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Map<String, HydrologyNode> byId = new HashMap<>();
        Deque<HydrologyNode> stack = new ArrayDeque<>();
        stack.push(head);
        visited.add(head);

        while (!stack.isEmpty()) {
            HydrologyNode node = stack.pop();
            nodes.add(node);

            String key = node.getCommonId() == null ? "" : node.getCommonId().toUpperCase(Locale.ROOT);
            if (byId.putIfAbsent(key, node) != null) {
                violations.add(violation(Severity.ERROR, Rule.DUPLICATE_ID, node.getCommonId(),
                        "Node id \"" + node.getCommonId() + "\" is used more than once"));
            }
            if (node != head && node.getDownstreamNode() == null) {
                violations.add(violation(Severity.ERROR, Rule.MISSING_DOWNSTREAM, node.getCommonId(),
                        "Node \"" + node.getCommonId() + "\" has no downstream node"));
            }

            for (HydrologyNode upstream : node.getUpstreamNodes()) {
                if (upstream.getDownstreamNode() != node) {
                    violations.add(violation(Severity.ERROR, Rule.ADJACENCY_MISMATCH, upstream.getCommonId(),
                            "Node \"" + upstream.getCommonId() + "\" is listed upstream of \"" + node.getCommonId()
                                    + "\" but its downstream node is \""
                                    + (upstream.getDownstreamNode() == null ? "null"
                                    : upstream.getDownstreamNode().getCommonId()) + "\""));
                }
                if (!visited.add(upstream)) {
                    violations.add(violation(Severity.ERROR, Rule.NOT_A_TREE, upstream.getCommonId(),
                            "Node \"" + upstream.getCommonId() + "\" is reached more than once from the head"));
                    continue;
                }
                stack.push(upstream);
            }
        }
        return nodes;
    }

    // ========================= NUMBERING =========================

    private void checkNumbering(HydrologyNodeNetwork network, int reachable, List<IntegrityViolation> violations) {
        List<HydrologyNode> walk = traversalService.getNodeList(network);
        int size = walk.size();
        if (size != reachable) {
            violations.add(violation(Severity.ERROR, Rule.NOT_A_TREE, null,
                    "Computational walk visits " + size + " of " + reachable + " nodes"));
            return;
        }

        boolean[] serialSeen = new boolean[size + 1];
        for (int i = 0; i < size; i++) {
            HydrologyNode node = walk.get(i);
            if (node.getComputationalOrder() != i + 1) {
                violations.add(violation(Severity.WARNING, Rule.COMPUTATIONAL_ORDER, node.getCommonId(),
                        "Node \"" + node.getCommonId() + "\" is computed at position " + (i + 1)
                                + " but has computational order " + node.getComputationalOrder()));
            }

            int serial = node.getSerial();
            if (serial < 1 || serial > size || serialSeen[serial]) {
                violations.add(violation(Severity.WARNING, Rule.SERIAL_ORDER, node.getCommonId(),
                        "Node \"" + node.getCommonId() + "\" has serial " + serial + " outside 1.." + size
                                + " or already used"));
            } else {
                serialSeen[serial] = true;
            }

            HydrologyNode ds = node.getDownstreamNode();
            if (ds != null && serial <= ds.getSerial()) {
                violations.add(violation(Severity.WARNING, Rule.SERIAL_ORDER, node.getCommonId(),
                        "Serial of \"" + node.getCommonId() + "\" (" + serial + ") is not above its downstream node \""
                                + ds.getCommonId() + "\" (" + ds.getSerial() + ")"));
            }
            int expectedTributary = ds == null ? 1 : ds.indexOfUpstream(node) + 1;
            if (node.getTributaryNumber() != expectedTributary) {
                violations.add(violation(Severity.WARNING, Rule.TRIBUTARY_NUMBER, node.getCommonId(),
                        "Node \"" + node.getCommonId() + "\" has tributary number " + node.getTributaryNumber()
                                + ", expected " + expectedTributary));
            }
        }

        if (network.getNodeCount() != size) {
            violations.add(violation(Severity.WARNING, Rule.NODE_COUNT, null,
                    "Network node count is " + network.getNodeCount() + " but " + size + " nodes are reachable"));
        }
    }

    private IntegrityViolation violation(Severity severity, Rule rule, String nodeId, String description) {
        log.debug("{} {}: {}", severity, rule, description);
        return IntegrityViolation.builder()
                .severity(severity)
                .rule(rule)
                .nodeId(nodeId)
                .description(description)
                .build();
    }
}
