package com.waterresources.streamnet.service.geometry;

import com.waterresources.streamnet.config.NetworkSettings;
import com.waterresources.streamnet.dto.network.InterpolationResult;
import com.waterresources.streamnet.dto.network.Location;
import com.waterresources.streamnet.dto.network.NetworkAdvisory;
import com.waterresources.streamnet.dto.network.NetworkLimits;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.Position;
import com.waterresources.streamnet.service.network.NetworkQueryService;
import com.waterresources.streamnet.service.network.NetworkTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fills in missing node coordinates.
 *
 * Order of work:
 * 1. Unset coordinates are looked up from a {@link NodeLocationProvider}.
 * 2. Main stem (reach 1): gaps between located nodes are interpolated, the ends
 *    are extrapolated with the nearest known step.
 * 3. Side reaches: gaps between located nodes are interpolated, then every node still
 *    unset is stepped upstream from its downstream node using that node's own step.
 * 4. Points outside the layout bounds are moved back inside by a margin.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GeometryInterpolationService {

    private final NetworkTraversalService traversalService;
    private final NetworkQueryService queryService;
    private final NetworkSettings settings;

    /**
     * Set coordinates for the listed node ids, replacing any existing location.
     *
     * @return number of nodes updated
     */
    public int applyLocationOverrides(HydrologyNodeNetwork network, Map<String, Location> overrides) {
        Map<String, Location> byKey = new HashMap<>();
        overrides.forEach((id, location) -> byKey.put(id.trim().toUpperCase(Locale.ROOT), location));

        int applied = 0;
        for (HydrologyNode node : traversalService.getNodeList(network)) {
            Location location = byKey.remove(node.getCommonId().toUpperCase(Locale.ROOT));
            if (location != null) {
                node.setLocation(location.getX(), location.getY());
                applied++;
            }
        }
        byKey.keySet().forEach(id -> log.warn("Location override for \"{}\" does not match a node", id));
        log.info("Applied {} location override(s) to network \"{}\"", applied, network.getNetworkId());
        return applied;
    }

    /**
     * Fill unset node locations.
     *
     * @param provider    lookup for known coordinates, may be null
     * @param interpolate whether to interpolate nodes still unset after the lookup
     * @param limits      layout bounds; derived from the located nodes when null
     */
    public InterpolationResult fillLocations(HydrologyNodeNetwork network, NodeLocationProvider provider,
                                             boolean interpolate, NetworkLimits limits) {
        InterpolationResult result = InterpolationResult.builder().build();
        List<HydrologyNode> nodes = traversalService.getNodeList(network);

        if (provider != null) {
            for (HydrologyNode node : nodes) {
                if (node.hasLocation()) continue;
                Optional<Location> location = provider.lookupLocation(node.getCommonId());
                if (location.isPresent()) {
                    node.setLocation(location.get().getX(), location.get().getY());
                    result.setLookedUpCount(result.getLookedUpCount() + 1);
                }
            }
            log.debug("Looked up {} location(s)", result.getLookedUpCount());
        }

        if (interpolate) {
            NetworkLimits bounds = limits != null ? limits : queryService.determineExtent(network);
            double spacing = spacing(bounds);
            log.debug("Interpolating with spacing {} inside {}", spacing, bounds);

            fillMainStemLocations(network, bounds, spacing, result);
            fillUpstreamLocations(nodes, spacing, result);
            finalCheck(nodes, bounds, result);
        }

        result.setUnlocatedCount((int) nodes.stream().filter(node -> !node.hasLocation()).count());
        log.info("Filled locations for network \"{}\": {} looked up, {} interpolated, {} extrapolated, "
                        + "{} clamped, {} unlocated", network.getNetworkId(), result.getLookedUpCount(),
                result.getInterpolatedCount(), result.getExtrapolatedCount(), result.getClampedCount(),
                result.getUnlocatedCount());
        return result;
    }

    private double spacing(NetworkLimits bounds) {
        double side = Math.min(bounds.getWidth(), bounds.getHeight());
        return side > 0 ? side * settings.getSpacingFraction() : settings.getNodeSpacing();
    }

    // ========================= MAIN STEM =========================

    /**
     * Main stem nodes ordered from the top of reach 1 down to the End node.
     */
    private List<HydrologyNode> mainStem(HydrologyNodeNetwork network) {
        List<HydrologyNode> stem = new ArrayList<>();
        HydrologyNode node = traversalService.getDownstreamNode(
                network.getNodeHead(), Position.ABSOLUTE, network.getTributaryOrder());
        while (node != null) {
            stem.add(node);
            node = traversalService.nextUpstreamInReach(node);
        }
        Collections.reverse(stem);
        return stem;
    }

    void fillMainStemLocations(HydrologyNodeNetwork network, NetworkLimits bounds, double spacing,
                               InterpolationResult result) {
        List<HydrologyNode> stem = mainStem(network);
        List<Integer> anchors = new ArrayList<>();
        for (int i = 0; i < stem.size(); i++) {
            if (stem.get(i).hasLocation()) {
                anchors.add(i);
            }
        }
        if (anchors.size() == stem.size()) {
            return;
        }

        if (anchors.isEmpty()) {
            HydrologyNode end = stem.get(stem.size() - 1);
            place(end, bounds.getLeftX() + spacing, bounds.getBottomY() + spacing,
                    NetworkAdvisory.AdvisoryType.LOCATION_EXTRAPOLATED, result);
            anchors.add(stem.size() - 1);
        }

        for (int a = 0; a < anchors.size() - 1; a++) {
            interpolateBetween(stem, anchors.get(a), anchors.get(a + 1), result);
        }

        int first = anchors.get(0);
        int last = anchors.get(anchors.size() - 1);
        double upDx;
        double upDy;
        double downDx;
        double downDy;
        if (anchors.size() == 1) {
            // One known point: upstream nodes step up and right, downstream nodes down and left
            upDx = spacing;
            upDy = spacing;
            downDx = -spacing;
            downDy = -spacing;
        } else {
            HydrologyNode firstNode = stem.get(first);
            HydrologyNode firstNext = stem.get(first + 1);
            upDx = nonZero(firstNode.getX() - firstNext.getX(), spacing);
            upDy = nonZero(firstNode.getY() - firstNext.getY(), spacing);
            HydrologyNode lastNode = stem.get(last);
            HydrologyNode lastPrev = stem.get(last - 1);
            downDx = nonZero(lastNode.getX() - lastPrev.getX(), spacing);
            downDy = nonZero(lastNode.getY() - lastPrev.getY(), spacing);
        }

        HydrologyNode firstNode = stem.get(first);
        for (int k = first - 1; k >= 0; k--) {
            int steps = first - k;
            place(stem.get(k), firstNode.getX() + upDx * steps, firstNode.getY() + upDy * steps,
                    NetworkAdvisory.AdvisoryType.LOCATION_EXTRAPOLATED, result);
        }
        HydrologyNode lastNode = stem.get(last);
        for (int k = last + 1; k < stem.size(); k++) {
            int steps = k - last;
            place(stem.get(k), lastNode.getX() + downDx * steps, lastNode.getY() + downDy * steps,
                    NetworkAdvisory.AdvisoryType.LOCATION_EXTRAPOLATED, result);
        }
    }

    private void interpolateBetween(List<HydrologyNode> chain, int from, int to, InterpolationResult result) {
        if (to - from < 2) return;
        HydrologyNode a = chain.get(from);
        HydrologyNode b = chain.get(to);
        for (int k = from + 1; k < to; k++) {
            double t = (double) (k - from) / (to - from);
            place(chain.get(k), a.getX() + (b.getX() - a.getX()) * t, a.getY() + (b.getY() - a.getY()) * t,
                    NetworkAdvisory.AdvisoryType.LOCATION_INTERPOLATED, result);
        }
    }

    private static double nonZero(double delta, double fallback) {
        return delta == 0 ? fallback : delta;
    }

    // ========================= SIDE REACHES =========================

    void fillUpstreamLocations(List<HydrologyNode> nodes, double spacing, InterpolationResult result) {
        // Gaps between two located nodes on the same downstream chain
        for (HydrologyNode node : nodes) {
            if (node.hasLocation()) {
                fillReachDownstream(node, result);
            }
        }
        // Remaining nodes, downstream first so each node's downstream node is located
        for (int i = nodes.size() - 1; i >= 0; i--) {
            HydrologyNode node = nodes.get(i);
            if (!node.hasLocation()) {
                fillFromDownstream(node, spacing, result);
            }
        }
    }

    private void fillReachDownstream(HydrologyNode node, InterpolationResult result) {
        List<HydrologyNode> chain = new ArrayList<>();
        chain.add(node);
        HydrologyNode ds = node.getDownstreamNode();
        while (ds != null && !ds.hasLocation()) {
            chain.add(ds);
            ds = ds.getDownstreamNode();
        }
        if (ds == null || chain.size() == 1) {
            return;
        }
        chain.add(ds);
        interpolateBetween(chain, 0, chain.size() - 1, result);
    }

    private void fillFromDownstream(HydrologyNode node, double spacing, InterpolationResult result) {
        HydrologyNode ds = node.getDownstreamNode();
        if (ds == null || !ds.hasLocation()) {
            log.debug("Cannot place \"{}\", downstream node has no location", node.getCommonId());
            return;
        }
        double dx = spacing;
        double dy = spacing;
        HydrologyNode dsds = ds.getDownstreamNode();
        if (dsds != null && dsds.hasLocation()) {
            dx = nonZero(ds.getX() - dsds.getX(), spacing);
            dy = nonZero(ds.getY() - dsds.getY(), spacing);
        }
        place(node, ds.getX() + dx, ds.getY() + dy, NetworkAdvisory.AdvisoryType.LOCATION_EXTRAPOLATED, result);
    }

    // ========================= BOUNDS =========================

    /**
     * Move located nodes that fall outside the bounds back inside by a margin of the
     * extent. An axis with zero extent is not clamped.
     */
    void finalCheck(List<HydrologyNode> nodes, NetworkLimits bounds, InterpolationResult result) {
        double w = bounds.getWidth();
        double h = bounds.getHeight();
        double wMargin = w * settings.getClampMarginFraction();
        double hMargin = h * settings.getClampMarginFraction();

        for (HydrologyNode node : nodes) {
            if (!node.hasLocation()) continue;
            StringBuilder message = new StringBuilder();
            double x = node.getX();
            double y = node.getY();
            if (w > 0) {
                if (x < bounds.getLeftX()) {
                    message.append(" ").append(x).append(" < ").append(bounds.getLeftX());
                    x = bounds.getLeftX() + wMargin;
                } else if (x > bounds.getRightX()) {
                    message.append(" ").append(x).append(" > ").append(bounds.getRightX());
                    x = bounds.getRightX() - wMargin;
                }
            }
            if (h > 0) {
                if (y < bounds.getBottomY()) {
                    message.append(" ").append(y).append(" < ").append(bounds.getBottomY());
                    y = bounds.getBottomY() + hMargin;
                } else if (y > bounds.getTopY()) {
                    message.append(" ").append(y).append(" > ").append(bounds.getTopY());
                    y = bounds.getTopY() - hMargin;
                }
            }
            if (message.length() > 0) {
                node.setLocation(x, y);
                String text = "Setting \"" + node.getCommonId() + "\" in final check (" + message.toString().trim() + ")";
                log.info(text);
                result.setClampedCount(result.getClampedCount() + 1);
                result.getAdvisories().add(advisory(NetworkAdvisory.AdvisoryType.LOCATION_CLAMPED, node, text));
            }
        }
    }

    private void place(HydrologyNode node, double x, double y, NetworkAdvisory.AdvisoryType type,
                       InterpolationResult result) {
        node.setLocation(x, y);
        if (type == NetworkAdvisory.AdvisoryType.LOCATION_INTERPOLATED) {
            result.setInterpolatedCount(result.getInterpolatedCount() + 1);
        } else {
            result.setExtrapolatedCount(result.getExtrapolatedCount() + 1);
        }
        log.debug("Placed \"{}\" at ({}, {}) [{}]", node.getCommonId(), x, y, type);
        result.getAdvisories().add(advisory(type, node,
                "Location of \"" + node.getCommonId() + "\" set to (" + x + ", " + y + ")"));
    }

    private static NetworkAdvisory advisory(NetworkAdvisory.AdvisoryType type, HydrologyNode node, String message) {
        return NetworkAdvisory.builder()
                .type(type)
                .nodeId(node.getCommonId())
                .message(message)
                .build();
    }
}
