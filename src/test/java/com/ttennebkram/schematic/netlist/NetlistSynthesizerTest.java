package com.ttennebkram.schematic.netlist;

import com.ttennebkram.schematic.model.BoundingBox;
import com.ttennebkram.schematic.model.ComponentType;
import com.ttennebkram.schematic.model.DetectedComponent;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.NetlistResult;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PixelPoint;
import com.ttennebkram.schematic.model.SpiceComponent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NetlistSynthesizerTest {

    private final NetlistSynthesizer synthesizer = new NetlistSynthesizer();

    private static final BoundingBox BOX = new BoundingBox(0, 0, 40, 20);

    private static DetectedComponent comp(String id, String type, String designation, String value) {
        return new DetectedComponent(id, BOX, type, designation, value, null);
    }

    private static Pin pin(String componentId, int index, ComponentType type) {
        return new Pin(componentId + "_pin_" + index, componentId, new PixelPoint(index, 0), index + 1, type);
    }

    private static ElectricalNode node(String id, String... pinIds) {
        List<String> components = new ArrayList<>();
        for (String pinId : pinIds) {
            String owner = pinId.substring(0, pinId.indexOf("_pin_"));
            if (!components.contains(owner)) components.add(owner);
        }
        return new ElectricalNode(id, new PixelPoint(0, 0), components, Arrays.asList(pinIds));
    }

    /** V1 across R1 with the source's negative terminal grounded. */
    private NetlistResult voltageDivider() {
        List<DetectedComponent> components = Arrays.asList(
            comp("v1", "voltage_source", "V1", "5V"),
            comp("r1", "resistor", "R1", "10kΩ"),
            comp("g1", "ground", null, null));
        List<Pin> pins = Arrays.asList(
            pin("v1", 0, ComponentType.VOLTAGE_SOURCE), pin("v1", 1, ComponentType.VOLTAGE_SOURCE),
            pin("r1", 0, ComponentType.RESISTOR), pin("r1", 1, ComponentType.RESISTOR),
            pin("g1", 0, ComponentType.GROUND));
        List<ElectricalNode> nodes = Arrays.asList(
            node("node_0", "v1_pin_0", "r1_pin_0"),
            node("node_1", "v1_pin_1", "g1_pin_0"),
            node("node_2", "r1_pin_1"));
        return synthesizer.synthesize(components, pins, nodes);
    }

    @Test
    void shouldMapGroundedNodesToZero() {
        NetlistResult result = voltageDivider();

        assertThat(result.isGenerationSuccess()).isTrue();
        assertThat(result.getNodeMapping())
            .containsEntry("gnd", 0)
            .containsEntry("node_0", 1)
            .containsEntry("node_1", 0)
            .containsEntry("node_2", 2);
    }

    @Test
    void shouldWriteDeviceLinesAndDirectives() {
        NetlistResult result = voltageDivider();

        assertThat(result.getLines()).containsSubsequence(
            "* Circuit Components",
            "V1 1 0 5",
            "R1 1 2 10k",
            "",
            "* Analysis Commands",
            ".op",
            ".dc V1 0 10 0.1",
            ".tran 1n 1u",
            "",
            "* Control Commands",
            ".control",
            "run",
            "print all",
            ".endc",
            "",
            ".end");
        assertThat(result.getAnalysisCommands()).containsExactly(".op", ".dc V1 0 10 0.1", ".tran 1n 1u");
        assertThat(result.getNetlistText()).endsWith(".end");
    }

    @Test
    void groundSymbolsShouldNotBecomeDevices() {
        NetlistResult result = voltageDivider();

        assertThat(result.getDevices()).extracting(SpiceComponent::getName).containsExactly("V1", "R1");
        assertThat(result.getDevices().get(0).getParameters()).containsEntry("type", "DC");
    }

    @Test
    void shouldAddAcAnalysisAndHideDescriptiveParametersForCapacitors() {
        NetlistResult result = synthesizer.synthesize(
            Collections.singletonList(comp("c1", "capacitor", null, "100μF")),
            Arrays.asList(pin("c1", 0, ComponentType.CAPACITOR), pin("c1", 1, ComponentType.CAPACITOR)),
            Arrays.asList(node("node_0", "c1_pin_0"), node("node_1", "c1_pin_1")));

        assertThat(result.getLines()).contains("C1 1 2 100u");
        assertThat(result.getDevices().get(0).getParameters()).containsEntry("voltage_rating", "16V");
        assertThat(result.getAnalysisCommands()).containsExactly(".op", ".ac dec 10 1 1meg", ".tran 1n 1u");
    }

    @Test
    void shouldEstimateCapacitorVoltageRatingFromPrefix() {
        assertThat(NetlistSynthesizer.estimateVoltageRating("100µF")).isEqualTo("16V");
        assertThat(NetlistSynthesizer.estimateVoltageRating("100nF")).isEqualTo("50V");
        assertThat(NetlistSynthesizer.estimateVoltageRating("22pF")).isEqualTo("100V");
        assertThat(NetlistSynthesizer.estimateVoltageRating("1F")).isEqualTo("25V");
        assertThat(NetlistSynthesizer.estimateVoltageRating(null)).isEqualTo("16V");
    }

    @Test
    void shouldUseDefaultModelsForSemiconductors() {
        List<DetectedComponent> components = Arrays.asList(
            comp("d1", "diode", null, null),
            comp("q1", "transistor", null, null),
            comp("u1", "op_amp", "U1", null),
            comp("u2", "opamp", "lm358", null),
            comp("u3", "ic", null, "NE555"));
        List<Pin> pins = new ArrayList<>();
        List<ElectricalNode> nodes = new ArrayList<>();
        int[] pinCounts = {2, 4, 4, 4, 4};
        for (int c = 0; c < components.size(); c++) {
            DetectedComponent dc = components.get(c);
            for (int i = 0; i < pinCounts[c]; i++) {
                Pin p = pin(dc.getComponentId(), i, dc.getType());
                pins.add(p);
                nodes.add(node("node_" + nodes.size(), p.getPinId()));
            }
        }

        NetlistResult result = synthesizer.synthesize(components, pins, nodes);

        assertThat(result.getLines()).contains(
            "D1 1 2 1N4148 area=1",
            "Q1 3 4 5 2N2222",
            "XU1 7 8 9 10 UA741",
            "XLM358 11 12 13 14 LM358",
            "X1 15 16 17 18 NE555");
    }

    @Test
    void shouldSubstituteResistorForUnknownTypes() {
        NetlistResult result = synthesizer.synthesize(
            Collections.singletonList(comp("z1", "flux_capacitor", null, "88mph")),
            Arrays.asList(pin("z1", 0, ComponentType.UNKNOWN), pin("z1", 1, ComponentType.UNKNOWN)),
            Arrays.asList(node("node_0", "z1_pin_0", "z1_pin_1")));

        assertThat(result.getLines()).contains("R1 1 1 1k");
        assertThat(result.getDevices().get(0).getParameters())
            .containsEntry("note", "Unknown component type: flux_capacitor");
    }

    @Test
    void shouldRenderMinimalNetlistForNoComponents() {
        NetlistResult result = synthesizer.synthesize(Collections.emptyList(), Collections.emptyList(),
            Collections.emptyList());

        assertThat(result.isGenerationSuccess()).isTrue();
        assertThat(result.getDevices()).isEmpty();
        assertThat(result.getNodeMapping()).hasSize(1).containsEntry("gnd", 0);
        assertThat(result.getLines()).endsWith(".op", ".end");
        assertThat(result.getError()).isNull();
    }

    @Test
    void shouldReportFailureInsteadOfThrowing() {
        NetlistResult result = synthesizer.synthesize(
            Collections.singletonList(comp("r1", "resistor", null, "1k")),
            Arrays.asList(pin("r1", 0, ComponentType.RESISTOR), pin("r1", 1, ComponentType.RESISTOR)),
            Collections.singletonList(node("node_0", "r1_pin_0")));

        assertThat(result.isGenerationSuccess()).isFalse();
        assertThat(result.getError()).contains("r1_pin_1");
        assertThat(result.getDevices()).isEmpty();
        assertThat(result.getLines()).endsWith(".op", ".end");
    }

    @Test
    void namesShouldRestartForEveryNetlist() {
        NetlistResult first = synthesizer.synthesize(
            Collections.singletonList(comp("r1", "resistor", null, "1k")),
            Arrays.asList(pin("r1", 0, ComponentType.RESISTOR), pin("r1", 1, ComponentType.RESISTOR)),
            Arrays.asList(node("node_0", "r1_pin_0"), node("node_1", "r1_pin_1")));
        NetlistResult second = synthesizer.synthesize(
            Collections.singletonList(comp("r1", "resistor", null, "1k")),
            Arrays.asList(pin("r1", 0, ComponentType.RESISTOR), pin("r1", 1, ComponentType.RESISTOR)),
            Arrays.asList(node("node_0", "r1_pin_0"), node("node_1", "r1_pin_1")));

        assertThat(second.getNetlistText()).isEqualTo(first.getNetlistText());
        assertThat(second.getDevices().get(0).getName()).isEqualTo("R1");
    }
}
