package com.ttennebkram.schematic.model;

/**
 * A component reported by the symbol detector, optionally annotated with the
 * designation, value and tolerance strings read by OCR.
 */
public final class DetectedComponent {
    private final String componentId;
    private final BoundingBox boundingBox;
    private final ComponentType type;
    private final String typeLabel;
    private final String designation;
    private final String value;
    private final String tolerance;

    public DetectedComponent(String componentId, BoundingBox boundingBox, String typeLabel,
                             String designation, String value, String tolerance) {
        if (componentId == null || componentId.isEmpty()) {
            throw new IllegalArgumentException("componentId is required");
        }
        if (boundingBox == null) {
            throw new IllegalArgumentException("boundingBox is required for " + componentId);
        }
        this.componentId = componentId;
        this.boundingBox = boundingBox;
        this.typeLabel = typeLabel != null ? typeLabel : ComponentType.UNKNOWN.getLabel();
        this.type = ComponentType.fromLabel(typeLabel);
        this.designation = designation;
        this.value = value;
        this.tolerance = tolerance;
    }

    public DetectedComponent(String componentId, BoundingBox boundingBox, String typeLabel) {
        this(componentId, boundingBox, typeLabel, null, null, null);
    }

    public String getComponentId() { return componentId; }
    public BoundingBox getBoundingBox() { return boundingBox; }
    public ComponentType getType() { return type; }

    /** Label exactly as the detector reported it. */
    public String getTypeLabel() { return typeLabel; }

    /** OCR designation such as "R1", or null. */
    public String getDesignation() { return designation; }

    /** OCR value string such as "10kΩ", or null. */
    public String getValue() { return value; }

    /** OCR tolerance string such as "5%", or null. */
    public String getTolerance() { return tolerance; }

    @Override
    public String toString() {
        return componentId + "(" + typeLabel + ")";
    }
}
