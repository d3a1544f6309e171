package com.ttennebkram.schematic.model;

/**
 * A merged line segment scored as a candidate electrical connection.
 * Geometry measurements are kept alongside the score for reporting.
 */
public final class ClassifiedConnection {
    private final String id;
    private final PixelPoint start;
    private final PixelPoint end;
    private final ConnectionKind kind;
    private final double confidence;

    // Measured properties
    private final double length;
    private final double angleDegrees;
    private final double thicknessPx;
    private final double continuityRatio;

    public ClassifiedConnection(String id, PixelPoint start, PixelPoint end, ConnectionKind kind,
                                double confidence, double length, double angleDegrees,
                                double thicknessPx, double continuityRatio) {
        this.id = id;
        this.start = start;
        this.end = end;
        this.kind = kind;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.length = length;
        this.angleDegrees = angleDegrees;
        this.thicknessPx = thicknessPx;
        this.continuityRatio = continuityRatio;
    }

    public String getId() { return id; }
    public PixelPoint getStart() { return start; }
    public PixelPoint getEnd() { return end; }
    public ConnectionKind getKind() { return kind; }
    public double getConfidence() { return confidence; }
    public double getLength() { return length; }
    public double getAngleDegrees() { return angleDegrees; }
    public double getThicknessPx() { return thicknessPx; }
    public double getContinuityRatio() { return continuityRatio; }

    public boolean isReliable(double threshold) {
        return confidence >= threshold;
    }

    @Override
    public String toString() {
        return String.format("%s %s-%s %s conf=%.2f", id, start, end, kind.getLabel(), confidence);
    }
}
