package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A maximal set of pins held at the same potential.
 */
public final class ElectricalNode {
    private final String nodeId;
    private final PixelPoint position;
    private final List<String> connectedComponents;
    private final List<String> pinIds;

    public ElectricalNode(String nodeId, PixelPoint position, List<String> connectedComponents, List<String> pinIds) {
        this.nodeId = nodeId;
        this.position = position;
        this.connectedComponents = Collections.unmodifiableList(new ArrayList<>(connectedComponents));
        this.pinIds = Collections.unmodifiableList(new ArrayList<>(pinIds));
    }

    public String getNodeId() { return nodeId; }

    /** Centroid of the member pins. */
    public PixelPoint getPosition() { return position; }

    public List<String> getConnectedComponents() { return connectedComponents; }
    public List<String> getPinIds() { return pinIds; }

    /** Number of pins folded into this node. */
    public int getConnectionCount() {
        return pinIds.size();
    }

    public boolean containsPin(String pinId) {
        return pinIds.contains(pinId);
    }

    @Override
    public String toString() {
        return nodeId + pinIds;
    }
}
