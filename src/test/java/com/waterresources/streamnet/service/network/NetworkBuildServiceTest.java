package com.waterresources.streamnet.service.network;

import com.waterresources.streamnet.config.NetworkSettings;
import com.waterresources.streamnet.dto.network.InsertNodeRequest;
import com.waterresources.streamnet.dto.network.NodeLink;
import com.waterresources.streamnet.exception.NetworkStructureException;
import com.waterresources.streamnet.model.HydrologyNode;
import com.waterresources.streamnet.model.HydrologyNodeNetwork;
import com.waterresources.streamnet.model.NodeType;
import com.waterresources.streamnet.model.TributaryOrder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.waterresources.streamnet.service.network.NetworkTestSupport.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkBuildServiceTest {

    private final NetworkTestSupport support = new NetworkTestSupport(TributaryOrder.ADDED_FIRST);

    @Test
    void createsNetworkWithSingleEndNode() {
        HydrologyNodeNetwork network = support.build.createNetwork("colorado", "Colorado mainstem");

        HydrologyNode end = network.getNodeHead();
        assertThat(end.getCommonId()).isEqualTo("END");
        assertThat(end.getType()).isEqualTo(NodeType.END);
        assertThat(end.getSerial()).isEqualTo(1);
        assertThat(end.getComputationalOrder()).isEqualTo(1);
        assertThat(end.getReachCounter()).isEqualTo(1);
        assertThat(end.getNodeInReachNumber()).isEqualTo(1);
        assertThat(network.getNodeCount()).isEqualTo(1);
        assertThat(network.getTributaryOrder()).isEqualTo(TributaryOrder.ADDED_FIRST);
    }

    @Test
    void createsNetworkUsingConfiguredEndIdAndConvention() {
        NetworkTestSupport custom = new NetworkTestSupport(NetworkSettings.builder()
                .endNodeId("OUTFLOW")
                .tributaryOrder(TributaryOrder.ADDED_LAST)
                .treatDryAsNaturalFlow(true)
                .build());

        HydrologyNodeNetwork network = custom.build.createNetwork("yampa", "Yampa");

        assertThat(network.getNodeHead().getCommonId()).isEqualTo("OUTFLOW");
        assertThat(network.getTributaryOrder()).isEqualTo(TributaryOrder.ADDED_LAST);
        assertThat(network.isTreatDryAsNaturalFlow()).isTrue();
    }

    @Test
    void numbersChainSeriallyAndComputationally() {
        HydrologyNodeNetwork network = support.chain();

        assertThat(support.get(network, "END").getSerial()).isEqualTo(1);
        assertThat(support.get(network, "A").getSerial()).isEqualTo(2);
        assertThat(support.get(network, "B").getSerial()).isEqualTo(3);
        assertThat(support.get(network, "B").getComputationalOrder()).isEqualTo(1);
        assertThat(support.get(network, "A").getComputationalOrder()).isEqualTo(2);
        assertThat(support.get(network, "END").getComputationalOrder()).isEqualTo(3);
        assertThat(network.getNodeCount()).isEqualTo(3);
    }

    @Test
    void assignsReachesInDiscoveryOrder() {
        HydrologyNodeNetwork network = support.branching();

        assertReach(network, "END", 1, 1, 1);
        assertReach(network, "GAGE_LOW", 1, 2, 1);
        assertReach(network, "CONF_1", 1, 3, 1);
        assertReach(network, "TRIB_GAGE", 2, 1, 2);
        assertReach(network, "CONF_2", 2, 2, 1);
        assertReach(network, "WELL_1", 3, 1, 2);
        assertReach(network, "DIV_2.01", 2, 3, 1);
        assertReach(network, "RES_1", 1, 4, 1);
        assertReach(network, "DIV_1", 1, 5, 1);
        assertReach(network, "GAGE_UP", 1, 6, 1);
    }

    @ParameterizedTest
    @EnumSource(TributaryOrder.class)
    void continuesReachThroughFirstUpstream(TributaryOrder order) {
        NetworkTestSupport orderSupport = new NetworkTestSupport(order);
        HydrologyNodeNetwork network = orderSupport.fork();

        HydrologyNode b = orderSupport.get(network, "B");
        HydrologyNode c = orderSupport.get(network, "C");
        assertThat(b.getReachCounter()).isEqualTo(1);
        assertThat(b.getNodeInReachNumber()).isEqualTo(3);
        assertThat(c.getReachCounter()).isEqualTo(2);
        assertThat(c.getNodeInReachNumber()).isEqualTo(1);
        assertThat(c.getTributaryNumber()).isEqualTo(2);
    }

    @ParameterizedTest
    @EnumSource(TributaryOrder.class)
    void serialAndComputationalOrderAreDensePermutations(TributaryOrder order) {
        NetworkTestSupport orderSupport = new NetworkTestSupport(order);
        HydrologyNodeNetwork network = orderSupport.branching();
        List<HydrologyNode> nodes = orderSupport.traversal.getNodeList(network);
        int size = nodes.size();

        assertThat(nodes.stream().map(HydrologyNode::getSerial).collect(Collectors.toSet()))
                .containsExactlyInAnyOrderElementsOf(IntStream.rangeClosed(1, size).boxed().collect(Collectors.toList()));
        for (int i = 0; i < size; i++) {
            assertThat(nodes.get(i).getComputationalOrder()).isEqualTo(i + 1);
            HydrologyNode ds = nodes.get(i).getDownstreamNode();
            if (ds != null) {
                assertThat(nodes.get(i).getSerial()).isGreaterThan(ds.getSerial());
            }
        }
        assertThat(nodes.get(size - 1).isEnd()).isTrue();
    }

    @Test
    void acceptsTailFirstInput() {
        HydrologyNodeNetwork network = new HydrologyNodeNetwork("tail", "Tail first");
        support.build.rebuildNetwork(network, List.of(
                node("B", NodeType.DIVERSION, "A"),
                node("A", NodeType.STREAMFLOW, "END", "B"),
                node("END", NodeType.END, null, "A")), false);

        assertThat(network.getNodeHead().getCommonId()).isEqualTo("END");
        assertThat(support.computationalIds(network)).containsExactly("B", "A", "END");
    }

    @Test
    void appendsChildMissingFromUpstreamList() {
        HydrologyNodeNetwork network = support.rebuild(List.of(
                node("END", NodeType.END, null),
                node("A", NodeType.STREAMFLOW, "END")));

        assertThat(support.get(network, "END").getUpstreamNodeIdsFromLinks()).containsExactly("A");
        assertThat(network.getNodeCount()).isEqualTo(2);
    }

    @Test
    void resolvesIdsIgnoringCase() {
        HydrologyNodeNetwork network = support.rebuild(List.of(
                node("END", NodeType.END, null, "a"),
                node("A", NodeType.STREAMFLOW, "end")));

        assertThat(support.get(network, "A").getDownstreamNode()).isSameAs(network.getNodeHead());
    }

    @Test
    void throwsStructureException_whenDownstreamIdUnresolved() {
        HydrologyNode a = node("A", NodeType.STREAMFLOW, "MISSING");
        List<HydrologyNode> nodes = List.of(node("END", NodeType.END, null, "A"), a);

        assertThatThrownBy(() -> support.rebuild(nodes))
                .isInstanceOf(NetworkStructureException.class)
                .hasMessageContaining("MISSING");
        assertThat(a.getReachCounter()).isZero();
        assertThat(a.getDownstreamNode()).isNull();
    }

    @Test
    void throwsStructureException_whenIdDuplicated() {
        List<HydrologyNode> nodes = List.of(
                node("END", NodeType.END, null, "A"),
                node("A", NodeType.STREAMFLOW, "END"),
                node("a", NodeType.DIVERSION, "END"));

        assertThatThrownBy(() -> support.rebuild(nodes))
                .isInstanceOf(NetworkStructureException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void throwsStructureException_whenTwoNodesHaveNoDownstream() {
        List<HydrologyNode> nodes = List.of(
                node("END", NodeType.END, null),
                node("LOOSE", NodeType.STREAMFLOW, null));

        assertThatThrownBy(() -> support.rebuild(nodes))
                .isInstanceOf(NetworkStructureException.class);
    }

    @Test
    void throwsStructureException_whenNodesFormDisconnectedCycle() {
        HydrologyNode x = node("X", NodeType.STREAMFLOW, "Y", "Y");
        List<HydrologyNode> nodes = List.of(
                node("END", NodeType.END, null, "A"),
                node("A", NodeType.STREAMFLOW, "END"),
                x,
                node("Y", NodeType.STREAMFLOW, "X", "X"));

        assertThatThrownBy(() -> support.rebuild(nodes))
                .isInstanceOf(NetworkStructureException.class)
                .hasMessageContaining("2 of 4");
        assertThat(x.getDownstreamNode()).isNull();
    }

    @Test
    void throwsIllegalArgument_whenNodeListEmpty() {
        HydrologyNodeNetwork network = new HydrologyNodeNetwork("empty", "Empty");

        assertThatThrownBy(() -> support.build.rebuildNetwork(network, List.of(), true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(TributaryOrder.class)
    void exportAndRebuildReproducesOrdering(TributaryOrder order) {
        NetworkTestSupport orderSupport = new NetworkTestSupport(order);
        HydrologyNodeNetwork original = orderSupport.branching();
        List<NodeLink> exported = orderSupport.build.exportNodeLinks(original);

        HydrologyNodeNetwork rebuilt = orderSupport.build.rebuildFromLinks("copy", "Copy", exported, false, order);
        Map<String, NodeLink> again = orderSupport.build.exportNodeLinks(rebuilt).stream()
                .collect(Collectors.toMap(NodeLink::getId, Function.identity()));

        assertThat(again).hasSize(exported.size());
        for (NodeLink link : exported) {
            NodeLink copy = again.get(link.getId());
            assertThat(copy.getSerial()).isEqualTo(link.getSerial());
            assertThat(copy.getComputationalOrder()).isEqualTo(link.getComputationalOrder());
            assertThat(copy.getReachCounter()).isEqualTo(link.getReachCounter());
            assertThat(copy.getNodeInReachNumber()).isEqualTo(link.getNodeInReachNumber());
            assertThat(copy.getTributaryNumber()).isEqualTo(link.getTributaryNumber());
            assertThat(copy.getUpstreamIds()).isEqualTo(link.getUpstreamIds());
            assertThat(copy.getDownstreamId()).isEqualTo(link.getDownstreamId());
        }
    }

    @ParameterizedTest
    @EnumSource(TributaryOrder.class)
    void exportAndRebuildReproducesOrdering_whenNetworkBuiltByInserts(TributaryOrder order) {
        NetworkTestSupport orderSupport = new NetworkTestSupport(order);
        HydrologyNodeNetwork network = orderSupport.build.createNetwork("edited", "Edited", order);
        insert(orderSupport, network, "A", "END", null);
        insert(orderSupport, network, "B", "A", null);
        insert(orderSupport, network, "C", "B", null);
        insert(orderSupport, network, "T2", "A", null);
        insert(orderSupport, network, "T1", "B", null);
        insert(orderSupport, network, "T3", "T1", null);
        insert(orderSupport, network, "M", "A", "B");

        assertRoundTrip(orderSupport, network, order);

        orderSupport.edit.deleteNode(network, "B");

        assertRoundTrip(orderSupport, network, order);
    }

    @ParameterizedTest
    @EnumSource(TributaryOrder.class)
    void keepsReachesOfInsertedTributaryThroughRoundTrip(TributaryOrder order) {
        NetworkTestSupport orderSupport = new NetworkTestSupport(order);
        HydrologyNodeNetwork network = orderSupport.chain();
        insert(orderSupport, network, "X", "A", null);

        HydrologyNodeNetwork rebuilt = orderSupport.build.rebuildFromLinks("copy", "Copy",
                orderSupport.build.exportNodeLinks(network), false, order);

        for (HydrologyNodeNetwork n : List.of(network, rebuilt)) {
            HydrologyNode x = orderSupport.get(n, "X");
            HydrologyNode b = orderSupport.get(n, "B");
            assertThat(x.getReachCounter()).isEqualTo(2);
            assertThat(x.getNodeInReachNumber()).isEqualTo(1);
            assertThat(x.getTributaryNumber()).isEqualTo(2);
            assertThat(b.getReachCounter()).isEqualTo(1);
            assertThat(b.getNodeInReachNumber()).isEqualTo(3);
        }
    }

    @Test
    void setsHeadAndCountFromNodeList() {
        HydrologyNodeNetwork source = support.chain();
        List<HydrologyNode> nodes = support.traversal.getNodeList(source);
        HydrologyNodeNetwork network = new HydrologyNodeNetwork("copy", "Copy");

        network.setNetworkFromNodes(nodes);

        assertThat(network.getNodeHead()).isSameAs(source.getNodeHead());
        assertThat(network.getNodeCount()).isEqualTo(3);
        assertThat(support.computationalIds(network)).containsExactly("B", "A", "END");
    }

    @Test
    void exportsNodesInComputationalOrder() {
        HydrologyNodeNetwork network = support.branching();

        List<NodeLink> links = support.build.exportNodeLinks(network);

        assertThat(links).extracting(NodeLink::getId).containsExactly(
                "WELL_1", "DIV_2.01", "CONF_2", "TRIB_GAGE", "GAGE_UP", "DIV_1", "RES_1", "CONF_1", "GAGE_LOW", "END");
        NodeLink conf2 = links.get(2);
        assertThat(conf2.getLink()).isEqualTo(42L);
        assertThat(conf2.getUpstreamIds()).containsExactly("DIV_2.01", "WELL_1");
        assertThat(conf2.getX()).isNull();
        assertThat(links.get(9).getDownstreamId()).isNull();
    }

    @Test
    void renumberRestoresDriftedNumbers() {
        HydrologyNodeNetwork network = support.chain();
        support.get(network, "A").setSerial(99);
        support.get(network, "B").setComputationalOrder(7);
        network.setNodeCount(10);

        support.build.renumber(network);

        assertThat(support.get(network, "A").getSerial()).isEqualTo(2);
        assertThat(support.get(network, "B").getComputationalOrder()).isEqualTo(1);
        assertThat(network.getNodeCount()).isEqualTo(3);
    }

    private static void insert(NetworkTestSupport orderSupport, HydrologyNodeNetwork network,
                               String id, String downstreamId, String upstreamId) {
        orderSupport.edit.insertNode(network, InsertNodeRequest.builder()
                .id(id)
                .type(NodeType.STREAMFLOW)
                .downstreamId(downstreamId)
                .upstreamId(upstreamId)
                .build());
    }

    private static void assertRoundTrip(NetworkTestSupport orderSupport, HydrologyNodeNetwork network,
                                        TributaryOrder order) {
        List<NodeLink> exported = orderSupport.build.exportNodeLinks(network);
        HydrologyNodeNetwork rebuilt = orderSupport.build.rebuildFromLinks("copy", "Copy", exported, false, order);
        Map<String, NodeLink> again = orderSupport.build.exportNodeLinks(rebuilt).stream()
                .collect(Collectors.toMap(NodeLink::getId, Function.identity()));

        assertThat(again).hasSize(exported.size());
        for (NodeLink link : exported) {
            NodeLink copy = again.get(link.getId());
            assertThat(copy.getSerial()).as("serial of %s", link.getId()).isEqualTo(link.getSerial());
            assertThat(copy.getComputationalOrder()).as("computational order of %s", link.getId())
                    .isEqualTo(link.getComputationalOrder());
            assertThat(copy.getReachCounter()).as("reach of %s", link.getId()).isEqualTo(link.getReachCounter());
            assertThat(copy.getNodeInReachNumber()).as("node in reach of %s", link.getId())
                    .isEqualTo(link.getNodeInReachNumber());
            assertThat(copy.getTributaryNumber()).as("tributary of %s", link.getId())
                    .isEqualTo(link.getTributaryNumber());
        }
    }

    private void assertReach(HydrologyNodeNetwork network, String id, int reach, int nodeInReach, int tributary) {
        HydrologyNode node = support.get(network, id);
        assertThat(node.getReachCounter()).as("reach of %s", id).isEqualTo(reach);
        assertThat(node.getNodeInReachNumber()).as("node in reach of %s", id).isEqualTo(nodeInReach);
        assertThat(node.getTributaryNumber()).as("tributary of %s", id).isEqualTo(tributary);
    }
}
