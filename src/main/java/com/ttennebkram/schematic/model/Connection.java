package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A classified segment attached to the component pins near its endpoints.
 *
 * A Connection is either:
 * - Complete: it touches pins of two or more components (a wire or a junction)
 * - Dangling: it touches pins of exactly one component (an open-ended wire)
 *
 * Segments that touch no pin at all never become Connections.
 */
public final class Connection {
    private final PixelPoint start;
    private final PixelPoint end;
    private final List<PixelPoint> path;
    private final ConnectionKind kind;
    private final double confidence;
    private final List<String> connectedComponents;
    private final List<String> connectedPins;

    public Connection(PixelPoint start, PixelPoint end, List<PixelPoint> path, ConnectionKind kind,
                      double confidence, List<String> connectedComponents, List<String> connectedPins) {
        if (path == null || path.size() < 2) {
            throw new IllegalArgumentException("Connection path needs at least two points");
        }
        if (connectedComponents == null || connectedComponents.isEmpty()) {
            throw new IllegalArgumentException("Connection must touch at least one component");
        }
        this.start = start;
        this.end = end;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.kind = kind;
        this.confidence = confidence;
        this.connectedComponents = Collections.unmodifiableList(new ArrayList<>(connectedComponents));
        this.connectedPins = connectedPins != null
            ? Collections.unmodifiableList(new ArrayList<>(connectedPins))
            : Collections.emptyList();
    }

    /**
     * Create a straight two-point connection.
     */
    public static Connection straight(PixelPoint start, PixelPoint end, ConnectionKind kind, double confidence,
                                      List<String> connectedComponents, List<String> connectedPins) {
        List<PixelPoint> path = new ArrayList<>();
        path.add(start);
        path.add(end);
        return new Connection(start, end, path, kind, confidence, connectedComponents, connectedPins);
    }

    // ========== State queries ==========

    public boolean isDangling() {
        return connectedComponents.size() == 1;
    }

    public boolean isComplete() {
        return connectedComponents.size() >= 2;
    }

    public double length() {
        return start.distanceTo(end);
    }

    // ========== Accessors ==========

    public PixelPoint getStart() { return start; }
    public PixelPoint getEnd() { return end; }
    public List<PixelPoint> getPath() { return path; }
    public ConnectionKind getKind() { return kind; }
    public double getConfidence() { return confidence; }

    /** Component IDs touched by this segment, deduplicated, in first-seen order. */
    public List<String> getConnectedComponents() { return connectedComponents; }

    /** Pin IDs within reach of either endpoint. */
    public List<String> getConnectedPins() { return connectedPins; }

    @Override
    public String toString() {
        return start + "-" + end + " " + connectedComponents;
    }
}
