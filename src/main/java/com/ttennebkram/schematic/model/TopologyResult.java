package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Connectivity graph and analysis for one schematic.
 */
public final class TopologyResult {
    private final List<Connection> connections;
    private final List<ElectricalNode> nodes;
    private final List<Pin> pins;
    private final ConnectivityMatrix connectivityMatrix;
    private final CircuitComplexity complexity;
    private final List<PotentialIssue> potentialIssues;
    private final int totalComponents;
    private final int lowConfidenceConnections;

    public TopologyResult(List<Connection> connections, List<ElectricalNode> nodes, List<Pin> pins,
                          ConnectivityMatrix connectivityMatrix, CircuitComplexity complexity,
                          List<PotentialIssue> potentialIssues, int totalComponents,
                          int lowConfidenceConnections) {
        this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.pins = Collections.unmodifiableList(new ArrayList<>(pins));
        this.connectivityMatrix = connectivityMatrix;
        this.complexity = complexity;
        this.potentialIssues = Collections.unmodifiableList(new ArrayList<>(potentialIssues));
        this.totalComponents = totalComponents;
        this.lowConfidenceConnections = lowConfidenceConnections;
    }

    public List<Connection> getConnections() { return connections; }
    public List<ElectricalNode> getNodes() { return nodes; }
    public List<Pin> getPins() { return pins; }
    public ConnectivityMatrix getConnectivityMatrix() { return connectivityMatrix; }
    public CircuitComplexity getComplexity() { return complexity; }
    public List<PotentialIssue> getPotentialIssues() { return potentialIssues; }
    public int getTotalComponents() { return totalComponents; }

    /** Connections scored below the configured confidence threshold. */
    public int getLowConfidenceConnections() { return lowConfidenceConnections; }

    public boolean hasIssue(String type) {
        for (PotentialIssue issue : potentialIssues) {
            if (issue.getType().equals(type)) {
                return true;
            }
        }
        return false;
    }
}
