package com.ttennebkram.schematic.model;

/**
 * A parsed component value.
 *
 * {@code spiceText} is what goes into the netlist ("10k", "100u", "4.7meg"),
 * {@code magnitude} is the same value in SI base units and {@code rawText} is
 * the OCR string it came from (null when there was none).
 */
public final class ComponentValue {
    private final ValueKind kind;
    private final double magnitude;
    private final String rawText;
    private final String spiceText;
    private final boolean defaulted;

    public ComponentValue(ValueKind kind, double magnitude, String rawText, String spiceText, boolean defaulted) {
        this.kind = kind;
        this.magnitude = magnitude;
        this.rawText = rawText;
        this.spiceText = spiceText;
        this.defaulted = defaulted;
    }

    public static ComponentValue defaultFor(ValueKind kind, String rawText) {
        return new ComponentValue(kind, kind.getDefaultMagnitude(), rawText, kind.getDefaultText(), true);
    }

    public ValueKind getKind() { return kind; }
    public double getMagnitude() { return magnitude; }
    public String getRawText() { return rawText; }
    public String getSpiceText() { return spiceText; }

    /** True when the raw text was missing or unparseable. */
    public boolean isDefaulted() { return defaulted; }

    @Override
    public String toString() {
        return spiceText;
    }
}
