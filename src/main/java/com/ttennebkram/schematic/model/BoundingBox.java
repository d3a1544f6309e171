package com.ttennebkram.schematic.model;

/**
 * Axis-aligned component bounding box as reported by the symbol detector.
 * Corners are normalized on construction so that x1 <= x2 and y1 <= y2.
 */
public final class BoundingBox {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public BoundingBox(double x1, double y1, double x2, double y2) {
        this.x1 = Math.min(x1, x2);
        this.y1 = Math.min(y1, y2);
        this.x2 = Math.max(x1, x2);
        this.y2 = Math.max(y1, y2);
    }

    public double getX1() { return x1; }
    public double getY1() { return y1; }
    public double getX2() { return x2; }
    public double getY2() { return y2; }

    public double getWidth() {
        return x2 - x1;
    }

    public double getHeight() {
        return y2 - y1;
    }

    public double getCenterX() {
        return (x1 + x2) / 2.0;
    }

    public double getCenterY() {
        return (y1 + y2) / 2.0;
    }

    /**
     * True when the box has no area (a point or a line).
     */
    public boolean isDegenerate() {
        return getWidth() <= 0 || getHeight() <= 0;
    }

    @Override
    public String toString() {
        return String.format("[%.1f, %.1f, %.1f, %.1f]", x1, y1, x2, y2);
    }
}
