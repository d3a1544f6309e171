package com.ttennebkram.schematic.model;

/**
 * Physical quantity of a component value, with the SPICE text used when the
 * OCR string is missing or unreadable.
 */
public enum ValueKind {
    RESISTANCE("1k", 1e3),
    CAPACITANCE("1n", 1e-9),
    INDUCTANCE("1u", 1e-6),
    VOLTAGE("5", 5.0),
    CURRENT("1m", 1e-3);

    private final String defaultText;
    private final double defaultMagnitude;

    ValueKind(String defaultText, double defaultMagnitude) {
        this.defaultText = defaultText;
        this.defaultMagnitude = defaultMagnitude;
    }

    public String getDefaultText() { return defaultText; }
    public double getDefaultMagnitude() { return defaultMagnitude; }
}
