package com.ttennebkram.schematic.topology;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.CircuitComplexity;
import com.ttennebkram.schematic.model.Connection;
import com.ttennebkram.schematic.model.ConnectivityMatrix;
import com.ttennebkram.schematic.model.DetectedComponent;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.IssueSeverity;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PotentialIssue;
import com.ttennebkram.schematic.model.TopologyResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Circuit-level view of the connection graph: component adjacency,
 * complexity ratios and anomalies worth flagging.
 */
public class TopologyAnalyzer {

    private final AnalysisConfig config;

    public TopologyAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    public TopologyResult analyze(List<DetectedComponent> components, List<Pin> pins,
                                  List<Connection> connections, List<ElectricalNode> nodes) {
        ConnectivityMatrix matrix = buildConnectivityMatrix(connections, components);
        CircuitComplexity complexity = calculateComplexity(connections, nodes, components.size());
        List<PotentialIssue> issues = identifyPotentialIssues(connections, nodes, matrix);

        int lowConfidence = 0;
        for (Connection connection : connections) {
            if (connection.getConfidence() < config.getConfidenceThreshold()) {
                lowConfidence++;
            }
        }

        return new TopologyResult(connections, nodes, pins, matrix, complexity, issues,
            components.size(), lowConfidence);
    }

    /**
     * Adjacency over components in input order. Entry (i, j) is set when one
     * connection touches both components. Pair strength is the highest
     * confidence among such connections.
     */
    public ConnectivityMatrix buildConnectivityMatrix(List<Connection> connections, List<DetectedComponent> components) {
        int n = components.size();
        boolean[][] adjacency = new boolean[n][n];
        List<String> componentIds = new ArrayList<>(n);
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            String id = components.get(i).getComponentId();
            componentIds.add(id);
            indexById.put(id, i);
        }

        double[][] strengths = new double[n][n];
        for (Connection connection : connections) {
            List<String> touched = connection.getConnectedComponents();
            for (int a = 0; a < touched.size(); a++) {
                for (int b = a + 1; b < touched.size(); b++) {
                    Integer i = indexById.get(touched.get(a));
                    Integer j = indexById.get(touched.get(b));
                    if (i == null || j == null) continue;

                    double strength = adjacency[i][j]
                        ? Math.max(strengths[i][j], connection.getConfidence())
                        : connection.getConfidence();
                    adjacency[i][j] = true;
                    adjacency[j][i] = true;
                    strengths[i][j] = strength;
                    strengths[j][i] = strength;
                }
            }
        }

        List<String> isolated = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            boolean any = false;
            for (int j = 0; j < n; j++) {
                any |= adjacency[i][j];
            }
            if (!any) {
                isolated.add(componentIds.get(i));
            }
        }

        return new ConnectivityMatrix(componentIds, adjacency, strengths, isolated);
    }

    public CircuitComplexity calculateComplexity(List<Connection> connections, List<ElectricalNode> nodes,
                                                 int componentCount) {
        int nConnections = connections.size();
        int nNodes = nodes.size();

        int pinTotal = 0;
        for (ElectricalNode node : nodes) {
            pinTotal += node.getConnectionCount();
        }

        return new CircuitComplexity(
            (double) nConnections / Math.max(componentCount, 1),
            (double) nNodes / Math.max(componentCount, 1),
            (double) nConnections / Math.max(componentCount - 1, 1),
            (double) pinTotal / Math.max(nNodes, 1));
    }

    /**
     * Isolation, high-degree nodes, very short connections and wires that end
     * at only one component. The checks are independent; an empty list is a
     * clean result.
     */
    public List<PotentialIssue> identifyPotentialIssues(List<Connection> connections, List<ElectricalNode> nodes,
                                                        ConnectivityMatrix matrix) {
        List<PotentialIssue> issues = new ArrayList<>();

        List<String> isolated = matrix.getIsolatedComponents();
        if (!isolated.isEmpty()) {
            issues.add(new PotentialIssue(PotentialIssue.ISOLATION, IssueSeverity.WARNING,
                "Found " + isolated.size() + " isolated components: " + String.join(", ", isolated),
                isolated));
        }

        List<String> highDegree = new ArrayList<>();
        for (ElectricalNode node : nodes) {
            if (node.getConnectionCount() > config.getHighDegreeThreshold()) {
                highDegree.add(node.getNodeId());
            }
        }
        if (!highDegree.isEmpty()) {
            issues.add(new PotentialIssue(PotentialIssue.HIGH_CONNECTIVITY, IssueSeverity.INFO,
                "Found " + highDegree.size() + " nodes with high connectivity (>"
                    + config.getHighDegreeThreshold() + " connections)",
                highDegree));
        }

        int shortCount = 0;
        for (Connection connection : connections) {
            if (connection.length() < config.getShortConnectionLength()) {
                shortCount++;
            }
        }
        if (shortCount > 0) {
            issues.add(new PotentialIssue(PotentialIssue.SHORT_CONNECTIONS, IssueSeverity.INFO,
                "Found " + shortCount + " very short connections (possible noise)", null));
        }

        int danglingCount = 0;
        Set<String> danglingComponents = new LinkedHashSet<>();
        for (Connection connection : connections) {
            if (connection.isDangling()) {
                danglingCount++;
                danglingComponents.addAll(connection.getConnectedComponents());
            }
        }
        if (danglingCount > 0) {
            issues.add(new PotentialIssue(PotentialIssue.DANGLING_CONNECTIONS, IssueSeverity.INFO,
                "Found " + danglingCount + " dangling connections at: " + String.join(", ", danglingComponents),
                new ArrayList<>(danglingComponents)));
        }

        return issues;
    }
}
