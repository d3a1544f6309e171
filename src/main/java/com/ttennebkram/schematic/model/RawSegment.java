package com.ttennebkram.schematic.model;

/**
 * Line segment as reported by the line transform, before classification.
 * Endpoints are kept in canonical order (smaller x first, then smaller y) so
 * two detections of the same stroke compare endpoint-to-endpoint.
 */
public final class RawSegment {
    private final PixelPoint p1;
    private final PixelPoint p2;

    public RawSegment(int x1, int y1, int x2, int y2) {
        if (x1 < x2 || (x1 == x2 && y1 <= y2)) {
            this.p1 = new PixelPoint(x1, y1);
            this.p2 = new PixelPoint(x2, y2);
        } else {
            this.p1 = new PixelPoint(x2, y2);
            this.p2 = new PixelPoint(x1, y1);
        }
    }

    public PixelPoint getP1() { return p1; }
    public PixelPoint getP2() { return p2; }

    public double length() {
        return p1.distanceTo(p2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawSegment)) return false;
        RawSegment other = (RawSegment) o;
        return p1.equals(other.p1) && p2.equals(other.p2);
    }

    @Override
    public int hashCode() {
        return 31 * p1.hashCode() + p2.hashCode();
    }

    @Override
    public String toString() {
        return p1 + "-" + p2;
    }
}
