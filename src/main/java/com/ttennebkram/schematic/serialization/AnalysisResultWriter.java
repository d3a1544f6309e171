package com.ttennebkram.schematic.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ttennebkram.schematic.model.CircuitComplexity;
import com.ttennebkram.schematic.model.Connection;
import com.ttennebkram.schematic.model.ConnectivityMatrix;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.NetlistResult;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PixelPoint;
import com.ttennebkram.schematic.model.PotentialIssue;
import com.ttennebkram.schematic.model.SchematicAnalysis;
import com.ttennebkram.schematic.model.SpiceComponent;
import com.ttennebkram.schematic.model.TopologyResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link SchematicAnalysis} as pretty-printed JSON with snake_case keys.
 */
public class AnalysisResultWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static String toJsonString(SchematicAnalysis analysis) {
        return GSON.toJson(toJson(analysis));
    }

    public static void write(SchematicAnalysis analysis, Writer writer) throws IOException {
        GSON.toJson(toJson(analysis), writer);
        writer.flush();
    }

    public static void save(SchematicAnalysis analysis, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(analysis, writer);
        }
    }

    public static JsonObject toJson(SchematicAnalysis analysis) {
        JsonObject root = new JsonObject();
        root.add("topology", serializeTopology(analysis.getTopology()));
        root.add("netlist", serializeNetlist(analysis.getNetlist()));
        return root;
    }

    static JsonObject serializeTopology(TopologyResult topology) {
        JsonObject json = new JsonObject();

        JsonArray connections = new JsonArray();
        for (Connection conn : topology.getConnections()) {
            JsonObject c = new JsonObject();
            c.add("start_point", point(conn.getStart()));
            c.add("end_point", point(conn.getEnd()));
            JsonArray path = new JsonArray();
            for (PixelPoint p : conn.getPath()) {
                path.add(point(p));
            }
            c.add("path", path);
            c.addProperty("connection_type", conn.getKind().getLabel());
            c.addProperty("confidence", conn.getConfidence());
            c.addProperty("length", conn.length());
            c.add("connected_components", strings(conn.getConnectedComponents()));
            c.add("connected_pins", strings(conn.getConnectedPins()));
            c.addProperty("dangling", conn.isDangling());
            connections.add(c);
        }
        json.add("connections", connections);

        JsonArray nodes = new JsonArray();
        for (ElectricalNode node : topology.getNodes()) {
            JsonObject n = new JsonObject();
            n.addProperty("node_id", node.getNodeId());
            n.add("position", point(node.getPosition()));
            n.add("connected_components", strings(node.getConnectedComponents()));
            n.addProperty("connection_count", node.getConnectionCount());
            n.add("pins", strings(node.getPinIds()));
            nodes.add(n);
        }
        json.add("nodes", nodes);

        JsonArray pins = new JsonArray();
        for (Pin pin : topology.getPins()) {
            JsonObject p = new JsonObject();
            p.addProperty("pin_id", pin.getPinId());
            p.addProperty("component_id", pin.getComponentId());
            p.add("position", point(pin.getPosition()));
            p.addProperty("pin_number", pin.getPinNumber());
            p.addProperty("component_type", pin.getComponentType().getLabel());
            pins.add(p);
        }
        json.add("pins", pins);

        json.add("connectivity_matrix", serializeMatrix(topology.getConnectivityMatrix()));

        CircuitComplexity complexity = topology.getComplexity();
        JsonObject metrics = new JsonObject();
        metrics.addProperty("component_density", complexity.getComponentDensity());
        metrics.addProperty("node_complexity", complexity.getNodeComplexity());
        metrics.addProperty("connection_ratio", complexity.getConnectionRatio());
        metrics.addProperty("average_node_degree", complexity.getAverageNodeDegree());
        json.add("circuit_complexity", metrics);

        JsonArray issues = new JsonArray();
        for (PotentialIssue issue : topology.getPotentialIssues()) {
            JsonObject i = new JsonObject();
            i.addProperty("type", issue.getType());
            i.addProperty("severity", issue.getSeverity().getLabel());
            i.addProperty("message", issue.getMessage());
            if (!issue.getAffectedIds().isEmpty()) {
                i.add("affected", strings(issue.getAffectedIds()));
            }
            issues.add(i);
        }
        json.add("potential_issues", issues);

        JsonObject summary = new JsonObject();
        summary.addProperty("total_connections", topology.getConnections().size());
        summary.addProperty("total_nodes", topology.getNodes().size());
        summary.addProperty("total_components", topology.getTotalComponents());
        summary.addProperty("low_confidence_connections", topology.getLowConfidenceConnections());
        json.add("summary", summary);

        return json;
    }

    private static JsonObject serializeMatrix(ConnectivityMatrix matrix) {
        JsonObject json = new JsonObject();
        json.add("component_ids", strings(matrix.getComponentIds()));

        JsonArray rows = new JsonArray();
        for (int[] row : matrix.toIntMatrix()) {
            JsonArray r = new JsonArray();
            for (int v : row) {
                r.add(v);
            }
            rows.add(r);
        }
        json.add("adjacency_matrix", rows);

        // One entry per connected pair, upper triangle in component order
        JsonArray strengths = new JsonArray();
        List<String> ids = matrix.getComponentIds();
        for (int i = 0; i < matrix.size(); i++) {
            for (int j = i + 1; j < matrix.size(); j++) {
                Double strength = matrix.getStrength(i, j);
                if (strength == null) continue;

                JsonObject pair = new JsonObject();
                pair.add("components", strings(Arrays.asList(ids.get(i), ids.get(j))));
                pair.addProperty("strength", strength);
                strengths.add(pair);
            }
        }
        json.add("connection_strengths", strengths);
        json.add("isolated_components", strings(matrix.getIsolatedComponents()));
        return json;
    }

    static JsonObject serializeNetlist(NetlistResult netlist) {
        JsonObject json = new JsonObject();
        json.addProperty("netlist_text", netlist.getNetlistText());

        JsonArray devices = new JsonArray();
        for (SpiceComponent device : netlist.getDevices()) {
            JsonObject d = new JsonObject();
            d.addProperty("name", device.getName());
            d.addProperty("device_type", String.valueOf(device.getDeviceKind().letter()));
            d.add("nodes", strings(device.getNodes()));
            d.addProperty("value", device.getValueOrModel());
            d.addProperty("component_id", device.getComponentId());
            if (!device.getParameters().isEmpty()) {
                JsonObject params = new JsonObject();
                for (Map.Entry<String, String> e : device.getParameters().entrySet()) {
                    params.addProperty(e.getKey(), e.getValue());
                }
                d.add("parameters", params);
            }
            devices.add(d);
        }
        json.add("devices", devices);

        JsonObject mapping = new JsonObject();
        for (Map.Entry<String, Integer> e : netlist.getNodeMapping().entrySet()) {
            mapping.addProperty(e.getKey(), e.getValue());
        }
        json.add("node_mapping", mapping);
        json.add("analysis_commands", strings(netlist.getAnalysisCommands()));
        json.addProperty("generation_success", netlist.isGenerationSuccess());
        if (netlist.getError() != null) {
            json.addProperty("error", netlist.getError());
        }
        return json;
    }

    private static JsonArray point(PixelPoint p) {
        JsonArray arr = new JsonArray();
        arr.add(p.x);
        arr.add(p.y);
        return arr;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) {
            arr.add(v);
        }
        return arr;
    }
}
