package com.waterresources.streamnet.service.geometry;

import com.waterresources.streamnet.dto.network.InterpolationResult;
import com.waterresources.streamnet.dto.network.Location;
import com.waterresources.streamnet.dto.network.NetworkAdvisory;
import com.waterresources.streamnet.dto.network.NetworkLimits;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.NodeType;
import com.waterresources.streamnet.model.TributaryOrder;
import com.waterresources.streamnet.service.network.NetworkTestSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeometryInterpolationServiceTest {

    private static final NetworkLimits BOUNDS = new NetworkLimits(0, 0, 100, 100);

    @Mock
    private NodeLocationProvider locationProvider;

    private final NetworkTestSupport support = new NetworkTestSupport(TributaryOrder.ADDED_FIRST);
    private final GeometryInterpolationService interpolationService =
            new GeometryInterpolationService(support.traversal, support.query, support.settings);

    @Test
    void looksUpMissingLocationsOnly() {
        HydrologyNodeNetwork network = support.chain();
        support.get(network, "END").setLocation(1, 1);
        when(locationProvider.lookupLocation(anyString())).thenReturn(Optional.empty());
        when(locationProvider.lookupLocation("A")).thenReturn(Optional.of(Location.of(5, 6)));

        InterpolationResult result = interpolationService.fillLocations(network, locationProvider, false, null);

        assertLocation(support.get(network, "A"), 5, 6);
        assertThat(support.get(network, "B").hasLocation()).isFalse();
        assertThat(result.getLookedUpCount()).isEqualTo(1);
        assertThat(result.getUnlocatedCount()).isEqualTo(1);
        verify(locationProvider, never()).lookupLocation("END");
    }

    @Test
    void interpolatesMainStemGaps() {
        HydrologyNodeNetwork network = chainOfFour();
        support.get(network, "END").setLocation(0, 0);
        support.get(network, "C").setLocation(30, 30);

        InterpolationResult result = interpolationService.fillLocations(network, null, true, BOUNDS);

        assertLocation(support.get(network, "B"), 20, 20);
        assertLocation(support.get(network, "A"), 10, 10);
        assertThat(result.getInterpolatedCount()).isEqualTo(2);
        assertThat(result.getExtrapolatedCount()).isZero();
        assertThat(result.getUnlocatedCount()).isZero();
        assertThat(result.getAdvisories()).extracting(NetworkAdvisory::getType)
                .containsOnly(NetworkAdvisory.AdvisoryType.LOCATION_INTERPOLATED);
    }

    @Test
    void extrapolatesBothEndsOfMainStem() {
        HydrologyNodeNetwork network = chainOfFour();
        support.get(network, "A").setLocation(10, 10);
        support.get(network, "B").setLocation(20, 20);

        InterpolationResult result = interpolationService.fillLocations(network, null, true, BOUNDS);

        assertLocation(support.get(network, "C"), 30, 30);
        assertLocation(support.get(network, "END"), 0, 0);
        assertThat(result.getExtrapolatedCount()).isEqualTo(2);
        assertThat(result.getClampedCount()).isZero();
    }

    @Test
    void placesWholeNetwork_whenNothingIsLocated() {
        HydrologyNodeNetwork network = support.chain();

        InterpolationResult result = interpolationService.fillLocations(network, null, true, BOUNDS);

        // spacing is 6% of the smaller side
        assertLocation(network.getNodeHead(), 6, 6);
        assertLocation(support.get(network, "A"), 12, 12);
        assertLocation(support.get(network, "B"), 18, 18);
        assertThat(result.getExtrapolatedCount()).isEqualTo(3);
        assertThat(result.getUnlocatedCount()).isZero();
    }

    @Test
    void extrapolatesSideReachFromItsDownstreamNode() {
        HydrologyNodeNetwork network = support.fork();
        support.get(network, "END").setLocation(0, 0);
        support.get(network, "A").setLocation(0, 10);
        support.get(network, "B").setLocation(0, 20);

        InterpolationResult result = interpolationService.fillLocations(network, null, true, BOUNDS);

        // no x step between A and END, so the default spacing is used
        assertLocation(support.get(network, "C"), 6, 20);
        assertThat(result.getExtrapolatedCount()).isEqualTo(1);
    }

    @Test
    void interpolatesSideReachBetweenLocatedNodes() {
        HydrologyNodeNetwork network = support.branching();
        support.get(network, "END").setLocation(50, 0);
        support.get(network, "GAGE_LOW").setLocation(50, 10);
        support.get(network, "CONF_1").setLocation(50, 20);
        support.get(network, "RES_1").setLocation(50, 30);
        support.get(network, "DIV_1").setLocation(50, 40);
        support.get(network, "GAGE_UP").setLocation(50, 50);
        support.get(network, "DIV_2.01").setLocation(80, 50);

        interpolationService.fillLocations(network, null, true, BOUNDS);

        assertLocation(support.get(network, "CONF_2"), 70, 40);
        assertLocation(support.get(network, "TRIB_GAGE"), 60, 30);
        assertThat(support.get(network, "WELL_1").hasLocation()).isTrue();
    }

    @Test
    void clampsPointsOutsideBounds() {
        HydrologyNodeNetwork network = support.chain();
        support.get(network, "END").setLocation(0, 0);
        support.get(network, "A").setLocation(150, 50);
        support.get(network, "B").setLocation(50, -20);

        InterpolationResult result = interpolationService.fillLocations(network, null, true, BOUNDS);

        assertLocation(support.get(network, "A"), 95, 50);
        assertLocation(support.get(network, "B"), 50, 5);
        assertThat(result.getClampedCount()).isEqualTo(2);
        assertThat(result.getAdvisories()).extracting(NetworkAdvisory::getType)
                .containsOnly(NetworkAdvisory.AdvisoryType.LOCATION_CLAMPED);
    }

    @Test
    void appliesOverridesIgnoringCase() {
        HydrologyNodeNetwork network = support.chain();
        support.get(network, "A").setLocation(1, 1);

        int applied = interpolationService.applyLocationOverrides(network,
                Map.of("a", Location.of(7, 8), "nowhere", Location.of(0, 0)));

        assertThat(applied).isEqualTo(1);
        assertLocation(support.get(network, "A"), 7, 8);
    }

    private HydrologyNodeNetwork chainOfFour() {
        return support.rebuild(List.of(
                NetworkTestSupport.node("END", NodeType.END, null, "A"),
                NetworkTestSupport.node("A", NodeType.STREAMFLOW, "END", "B"),
                NetworkTestSupport.node("B", NodeType.DIVERSION, "A", "C"),
                NetworkTestSupport.node("C", NodeType.STREAMFLOW, "B")));
    }

    private static void assertLocation(HydrologyNode node, double x, double y) {
        assertThat(node.getX()).as("x of %s", node.getCommonId()).isCloseTo(x, within(1e-9));
        assertThat(node.getY()).as("y of %s", node.getCommonId()).isCloseTo(y, within(1e-9));
    }
}
