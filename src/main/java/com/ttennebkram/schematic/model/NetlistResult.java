package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesized netlist. Always structurally valid: on failure the device list is
 * empty, the text is a minimal skeleton and {@link #getError()} explains why.
 */
public final class NetlistResult {
    private final List<String> lines;
    private final List<SpiceComponent> devices;
    private final Map<String, Integer> nodeMapping;
    private final List<String> analysisCommands;
    private final boolean generationSuccess;
    private final String error;

    public NetlistResult(List<String> lines, List<SpiceComponent> devices, Map<String, Integer> nodeMapping,
                         List<String> analysisCommands, boolean generationSuccess, String error) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.devices = Collections.unmodifiableList(new ArrayList<>(devices));
        this.nodeMapping = Collections.unmodifiableMap(new LinkedHashMap<>(nodeMapping));
        this.analysisCommands = Collections.unmodifiableList(new ArrayList<>(analysisCommands));
        this.generationSuccess = generationSuccess;
        this.error = error;
    }

    public String getNetlistText() {
        return String.join("\n", lines);
    }

    public List<String> getLines() { return lines; }
    public List<SpiceComponent> getDevices() { return devices; }
    public Map<String, Integer> getNodeMapping() { return nodeMapping; }
    public List<String> getAnalysisCommands() { return analysisCommands; }
    public boolean isGenerationSuccess() { return generationSuccess; }

    /** Failure description, or null on success. */
    public String getError() { return error; }
}
