package com.ttennebkram.schematic.model;

import java.util.Locale;

/**
 * Component categories understood by the pin locator and the netlist synthesizer.
 *
 * Each type carries its canonical label (as produced by the symbol detector),
 * accepted aliases, the pin layout used to place its terminals and the
 * SPICE device it maps to. GROUND has no device: it only pins node 0.
 */
public enum ComponentType {
    RESISTOR("resistor", PinLayout.HORIZONTAL_PAIR, DeviceKind.R, "res"),
    CAPACITOR("capacitor", PinLayout.HORIZONTAL_PAIR, DeviceKind.C, "cap"),
    INDUCTOR("inductor", PinLayout.HORIZONTAL_PAIR, DeviceKind.L, "coil"),
    VOLTAGE_SOURCE("voltage_source", PinLayout.VERTICAL_PAIR, DeviceKind.V, "battery", "vsource", "dc_source"),
    CURRENT_SOURCE("current_source", PinLayout.VERTICAL_PAIR, DeviceKind.I, "isource"),
    DIODE("diode", PinLayout.HORIZONTAL_PAIR, DeviceKind.D, "led", "zener"),
    TRANSISTOR("transistor", PinLayout.DISTRIBUTED, DeviceKind.Q, "bjt", "npn", "pnp"),
    OP_AMP("op_amp", PinLayout.DISTRIBUTED, DeviceKind.X, "opamp", "op-amp", "operational_amplifier"),
    IC("ic", PinLayout.DISTRIBUTED, DeviceKind.X, "integrated_circuit", "chip"),
    GROUND("ground", PinLayout.SINGLE_TOP, null, "gnd"),
    UNKNOWN("unknown", PinLayout.HORIZONTAL_PAIR, DeviceKind.R);

    private final String label;
    private final PinLayout pinLayout;
    private final DeviceKind deviceKind;
    private final String[] aliases;

    ComponentType(String label, PinLayout pinLayout, DeviceKind deviceKind, String... aliases) {
        this.label = label;
        this.pinLayout = pinLayout;
        this.deviceKind = deviceKind;
        this.aliases = aliases;
    }

    public String getLabel() {
        return label;
    }

    public PinLayout getPinLayout() {
        return pinLayout;
    }

    /**
     * SPICE device kind, or null for GROUND.
     */
    public DeviceKind getDeviceKind() {
        return deviceKind;
    }

    /**
     * Resolve a detector label (case-insensitive, spaces treated as underscores).
     * Unrecognised or missing labels map to UNKNOWN.
     */
    public static ComponentType fromLabel(String label) {
        if (label == null) return UNKNOWN;
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        if (normalized.isEmpty()) return UNKNOWN;

        for (ComponentType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
            for (String alias : type.aliases) {
                if (alias.equals(normalized)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
