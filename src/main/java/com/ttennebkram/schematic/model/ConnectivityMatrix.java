package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Symmetric component adjacency plus per-pair connection strength.
 * Rows and columns follow the order of {@link #getComponentIds()}; strengths
 * are held by index pair, so component IDs may contain any character.
 */
public final class ConnectivityMatrix {
    private final List<String> componentIds;
    private final boolean[][] adjacency;
    private final double[][] strengths;
    private final List<String> isolatedComponents;

    public ConnectivityMatrix(List<String> componentIds, boolean[][] adjacency,
                              double[][] strengths, List<String> isolatedComponents) {
        int n = componentIds.size();
        if (adjacency.length != n || strengths.length != n) {
            throw new IllegalArgumentException("Matrix size " + adjacency.length + "/" + strengths.length
                + " does not match " + n + " components");
        }
        this.componentIds = Collections.unmodifiableList(new ArrayList<>(componentIds));
        this.adjacency = new boolean[n][];
        for (int i = 0; i < n; i++) {
            this.adjacency[i] = adjacency[i].clone();
        }
        this.strengths = new double[n][];
        for (int i = 0; i < n; i++) {
            this.strengths[i] = strengths[i].clone();
        }
        this.isolatedComponents = Collections.unmodifiableList(new ArrayList<>(isolatedComponents));
    }

    public List<String> getComponentIds() { return componentIds; }
    public List<String> getIsolatedComponents() { return isolatedComponents; }

    public int size() {
        return componentIds.size();
    }

    public boolean isConnected(int i, int j) {
        return adjacency[i][j];
    }

    /**
     * Adjacency by component ID. Unknown IDs are never connected.
     */
    public boolean isConnected(String componentA, String componentB) {
        int i = componentIds.indexOf(componentA);
        int j = componentIds.indexOf(componentB);
        return i >= 0 && j >= 0 && adjacency[i][j];
    }

    /**
     * Highest confidence among connections joining components i and j, or null
     * when no connection joins them.
     */
    public Double getStrength(int i, int j) {
        return adjacency[i][j] ? strengths[i][j] : null;
    }

    public Double getStrength(String componentA, String componentB) {
        int i = componentIds.indexOf(componentA);
        int j = componentIds.indexOf(componentB);
        return i >= 0 && j >= 0 ? getStrength(i, j) : null;
    }

    public int rowSum(int i) {
        int sum = 0;
        for (boolean b : adjacency[i]) {
            if (b) sum++;
        }
        return sum;
    }

    /**
     * Matrix as 0/1 integers, the form downstream consumers expect.
     */
    public int[][] toIntMatrix() {
        int n = size();
        int[][] result = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = adjacency[i][j] ? 1 : 0;
            }
        }
        return result;
    }
}
