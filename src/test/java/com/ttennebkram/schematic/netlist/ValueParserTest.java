package com.ttennebkram.schematic.netlist;

import com.ttennebkram.schematic.model.ComponentValue;
import com.ttennebkram.schematic.model.ValueKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValueParserTest {

    @ParameterizedTest
    @CsvSource({
        "RESISTANCE, 10kΩ, 10k",
        "RESISTANCE, 10 k ohm, 10k",
        "RESISTANCE, 470, 470",
        "RESISTANCE, 4k7, 4.7k",
        "RESISTANCE, 2R2, 2.2",
        "RESISTANCE, 1M, 1meg",
        "RESISTANCE, 2.2Meg, 2.2meg",
        "RESISTANCE, 1m, 1m",
        "RESISTANCE, 1G, 1g",
        "CAPACITANCE, 100μF, 100u",
        "CAPACITANCE, 100µF, 100u",
        "CAPACITANCE, 22pF, 22p",
        "CAPACITANCE, 100nf, 100n",
        "CAPACITANCE, 10uF, 10u",
        "INDUCTANCE, 10mH, 10m",
        "INDUCTANCE, 4.7μH, 4.7u",
        "VOLTAGE, 5V, 5",
        "VOLTAGE, 3.3 V, 3.3",
        "VOLTAGE, 1kV, 1k",
        "VOLTAGE, -5V, -5",
        "VOLTAGE, -12, -12",
        "VOLTAGE, +3.3V, 3.3",
        "CURRENT, 1mA, 1m",
        "CURRENT, -2mA, -2m",
    })
    void shouldNormalizeToSpiceText(ValueKind kind, String raw, String expected) {
        ComponentValue value = ValueParser.parse(kind, raw);

        assertThat(value.getSpiceText()).isEqualTo(expected);
        assertThat(value.isDefaulted()).isFalse();
        assertThat(value.getRawText()).isEqualTo(raw);
    }

    @Test
    void shouldFallBackToPerKindDefaults() {
        assertThat(ValueParser.parseResistance(null).getSpiceText()).isEqualTo("1k");
        assertThat(ValueParser.parseCapacitance("").getSpiceText()).isEqualTo("1n");
        assertThat(ValueParser.parseInductance("   ").getSpiceText()).isEqualTo("1u");
        assertThat(ValueParser.parseVoltage(null).getSpiceText()).isEqualTo("5");
        assertThat(ValueParser.parseCurrent(null).getSpiceText()).isEqualTo("1m");
    }

    @Test
    void shouldMarkUnreadableValuesAsDefaulted() {
        ComponentValue value = ValueParser.parseResistance("R?7x");

        assertThat(value.isDefaulted()).isTrue();
        assertThat(value.getSpiceText()).isEqualTo("1k");
        assertThat(value.getRawText()).isEqualTo("R?7x");
        assertThat(ValueParser.parseCapacitance("10zF").isDefaulted()).isTrue();
    }

    @Test
    void shouldComputeMagnitudeInBaseUnits() {
        assertThat(ValueParser.parseResistance("4k7").getMagnitude()).isCloseTo(4700.0, within(1e-6));
        assertThat(ValueParser.parseResistance("1M").getMagnitude()).isCloseTo(1e6, within(1e-6));
        assertThat(ValueParser.parseCapacitance("100μF").getMagnitude()).isCloseTo(1e-4, within(1e-12));
        assertThat(ValueParser.parseCapacitance("22pF").getMagnitude()).isCloseTo(22e-12, within(1e-18));
        assertThat(ValueParser.parseVoltage("5V").getMagnitude()).isEqualTo(5.0);
    }

    @Test
    void shouldKeepNegativeSignInMagnitude() {
        ComponentValue value = ValueParser.parseVoltage("-5V");

        assertThat(value.isDefaulted()).isFalse();
        assertThat(value.getMagnitude()).isEqualTo(-5.0);
        assertThat(ValueParser.parseCurrent("-2mA").getMagnitude()).isCloseTo(-2e-3, within(1e-12));
    }

    @Test
    void defaultedValueShouldCarryDefaultMagnitude() {
        assertThat(ValueParser.parseCapacitance(null).getMagnitude()).isEqualTo(ValueKind.CAPACITANCE.getDefaultMagnitude());
    }
}
