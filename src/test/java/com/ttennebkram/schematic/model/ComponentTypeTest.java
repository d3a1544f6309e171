package com.ttennebkram.schematic.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentTypeTest {

    @Test
    void shouldResolveCanonicalLabelsAndAliases() {
        assertThat(ComponentType.fromLabel("resistor")).isEqualTo(ComponentType.RESISTOR);
        assertThat(ComponentType.fromLabel("Voltage Source")).isEqualTo(ComponentType.VOLTAGE_SOURCE);
        assertThat(ComponentType.fromLabel("battery")).isEqualTo(ComponentType.VOLTAGE_SOURCE);
        assertThat(ComponentType.fromLabel("opamp")).isEqualTo(ComponentType.OP_AMP);
        assertThat(ComponentType.fromLabel("OP-AMP")).isEqualTo(ComponentType.OP_AMP);
        assertThat(ComponentType.fromLabel("gnd")).isEqualTo(ComponentType.GROUND);
    }

    @Test
    void shouldFallBackToUnknown() {
        assertThat(ComponentType.fromLabel(null)).isEqualTo(ComponentType.UNKNOWN);
        assertThat(ComponentType.fromLabel("  ")).isEqualTo(ComponentType.UNKNOWN);
        assertThat(ComponentType.fromLabel("flux capacitor")).isEqualTo(ComponentType.UNKNOWN);
    }

    @Test
    void groundShouldHaveNoDevice() {
        assertThat(ComponentType.GROUND.getDeviceKind()).isNull();
        assertThat(ComponentType.GROUND.getPinLayout()).isEqualTo(PinLayout.SINGLE_TOP);
        assertThat(ComponentType.UNKNOWN.getDeviceKind()).isEqualTo(DeviceKind.R);
    }

    @Test
    void rawSegmentShouldStoreEndpointsInCanonicalOrder() {
        RawSegment reversed = new RawSegment(100, 50, 10, 50);
        RawSegment vertical = new RawSegment(40, 90, 40, 10);

        assertThat(reversed.getP1()).isEqualTo(new PixelPoint(10, 50));
        assertThat(reversed).isEqualTo(new RawSegment(10, 50, 100, 50));
        assertThat(vertical.getP1()).isEqualTo(new PixelPoint(40, 10));
        assertThat(vertical.length()).isEqualTo(80.0);
    }
}
