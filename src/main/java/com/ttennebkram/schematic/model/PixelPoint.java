package com.ttennebkram.schematic.model;

/**
 * Integer pixel coordinate in image space (origin top-left, y grows downward).
 */
public final class PixelPoint {
    public final int x;
    public final int y;

    public PixelPoint(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public double distanceTo(PixelPoint other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelPoint)) return false;
        PixelPoint other = (PixelPoint) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
