package com.ttennebkram.schematic.model;

/**
 * A terminal of a detected component where a wire may attach.
 */
public final class Pin {
    private final String pinId;
    private final String componentId;
    private final PixelPoint position;
    private final int pinNumber;
    private final ComponentType componentType;

    public Pin(String pinId, String componentId, PixelPoint position, int pinNumber, ComponentType componentType) {
        this.pinId = pinId;
        this.componentId = componentId;
        this.position = position;
        this.pinNumber = pinNumber;
        this.componentType = componentType;
    }

    public String getPinId() { return pinId; }
    public String getComponentId() { return componentId; }
    public PixelPoint getPosition() { return position; }

    /** 1-based ordinal within the owning component. */
    public int getPinNumber() { return pinNumber; }

    public ComponentType getComponentType() { return componentType; }

    @Override
    public String toString() {
        return pinId + "@" + position;
    }
}
