package com.ttennebkram.schematic.model;

/**
 * SPICE element letter of a synthesized device.
 */
public enum DeviceKind {
    R, C, L, V, I, D, Q, X;

    public boolean isReactive() {
        return this == C || this == L;
    }

    public char letter() {
        return name().charAt(0);
    }
}
