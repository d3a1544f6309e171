package com.ttennebkram.schematic.model;

/**
 * Ratios describing how densely a schematic is wired.
 */
public final class CircuitComplexity {
    private final double componentDensity;
    private final double nodeComplexity;
    private final double connectionRatio;
    private final double averageNodeDegree;

    public CircuitComplexity(double componentDensity, double nodeComplexity,
                             double connectionRatio, double averageNodeDegree) {
        this.componentDensity = componentDensity;
        this.nodeComplexity = nodeComplexity;
        this.connectionRatio = connectionRatio;
        this.averageNodeDegree = averageNodeDegree;
    }

    /** connections / components */
    public double getComponentDensity() { return componentDensity; }

    /** nodes / components */
    public double getNodeComplexity() { return nodeComplexity; }

    /** connections / (components - 1), the spanning-tree minimum */
    public double getConnectionRatio() { return connectionRatio; }

    /** mean pins per node */
    public double getAverageNodeDegree() { return averageNodeDegree; }
}
