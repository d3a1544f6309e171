package com.ttennebkram.schematic.topology;

import com.ttennebkram.schematic.model.ComponentType;
import com.ttennebkram.schematic.model.Connection;
import com.ttennebkram.schematic.model.ConnectionKind;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PixelPoint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ElectricalNodeResolverTest {

    private final ElectricalNodeResolver resolver = new ElectricalNodeResolver();

    private static Pin pin(String componentId, int index, int x, int y) {
        return new Pin(componentId + "_pin_" + index, componentId, new PixelPoint(x, y), index + 1,
            ComponentType.RESISTOR);
    }

    private static Connection wire(List<String> components, String... pinIds) {
        return Connection.straight(new PixelPoint(0, 0), new PixelPoint(10, 0), ConnectionKind.WIRE, 1.0,
            components, Arrays.asList(pinIds));
    }

    private static final List<Pin> PINS = Arrays.asList(
        pin("r1", 0, 100, 110), pin("r1", 1, 150, 110),
        pin("r2", 0, 200, 110), pin("r2", 1, 250, 110),
        pin("r3", 0, 300, 110), pin("r3", 1, 350, 110));

    @Test
    void shouldGiveEveryUnwiredPinItsOwnNode() {
        List<ElectricalNode> nodes = resolver.resolve(Collections.emptyList(), PINS);

        assertThat(nodes).hasSize(PINS.size());
        assertThat(nodes).extracting(ElectricalNode::getNodeId)
            .containsExactly("node_0", "node_1", "node_2", "node_3", "node_4", "node_5");
        assertThat(nodes).allSatisfy(n -> assertThat(n.getConnectionCount()).isEqualTo(1));
    }

    @Test
    void shouldJoinOnlyTheWiredPinsOfSeriesParts() {
        List<ElectricalNode> nodes = resolver.resolve(
            Collections.singletonList(wire(Arrays.asList("r1", "r2"), "r1_pin_1", "r2_pin_0")),
            PINS.subList(0, 4));

        assertThat(nodes).hasSize(3);
        ElectricalNode shared = nodes.get(1);
        assertThat(shared.getPinIds()).containsExactly("r1_pin_1", "r2_pin_0");
        assertThat(shared.getConnectedComponents()).containsExactly("r1", "r2");
        assertThat(shared.getPosition()).isEqualTo(new PixelPoint(175, 110));
    }

    @Test
    void shouldBeTransitiveAcrossWires() {
        List<ElectricalNode> nodes = resolver.resolve(Arrays.asList(
            wire(Arrays.asList("r1", "r2"), "r1_pin_1", "r2_pin_0"),
            wire(Arrays.asList("r2", "r3"), "r2_pin_0", "r3_pin_0")), PINS);

        ElectricalNode merged = nodes.stream().filter(n -> n.containsPin("r1_pin_1")).findFirst().get();
        assertThat(merged.getPinIds()).containsExactlyInAnyOrder("r1_pin_1", "r2_pin_0", "r3_pin_0");
        assertThat(nodes).hasSize(4);
    }

    @Test
    void shouldPartitionPins() {
        List<ElectricalNode> nodes = resolver.resolve(Arrays.asList(
            wire(Arrays.asList("r1", "r3"), "r1_pin_0", "r3_pin_1"),
            wire(Arrays.asList("r2"), "r2_pin_1"),
            wire(Arrays.asList("r2", "r3"), "r2_pin_1", "r3_pin_0", "unknown_pin")), PINS);

        List<String> all = new ArrayList<>();
        for (ElectricalNode node : nodes) {
            all.addAll(node.getPinIds());
        }
        Set<String> expected = new HashSet<>();
        for (Pin p : PINS) {
            expected.add(p.getPinId());
        }
        assertThat(all).hasSize(PINS.size());
        assertThat(new HashSet<>(all)).isEqualTo(expected);
    }

    @Test
    void shouldBeDeterministic() {
        List<Connection> connections = Arrays.asList(
            wire(Arrays.asList("r2", "r3"), "r2_pin_1", "r3_pin_0"),
            wire(Arrays.asList("r1", "r2"), "r1_pin_1", "r2_pin_0"));

        List<ElectricalNode> first = resolver.resolve(connections, PINS);
        List<ElectricalNode> second = resolver.resolve(connections, PINS);

        assertThat(second).extracting(ElectricalNode::getPinIds)
            .containsExactlyElementsOf(first.stream().map(ElectricalNode::getPinIds)
                .collect(Collectors.toList()));
    }

    @Test
    void shouldReturnNoNodesForNoPins() {
        assertThat(resolver.resolve(Collections.emptyList(), Collections.emptyList())).isEmpty();
    }
}
