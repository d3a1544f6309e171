package com.ttennebkram.schematic.model;

import java.util.Locale;

public enum IssueSeverity {
    WARNING, INFO;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
