package com.ttennebkram.schematic.model;

import java.util.Locale;

public enum ConnectionKind {
    WIRE, TRACE, BUS;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
