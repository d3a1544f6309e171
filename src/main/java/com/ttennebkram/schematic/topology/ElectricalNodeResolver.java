package com.ttennebkram.schematic.topology;

import com.ttennebkram.schematic.model.Connection;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PixelPoint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups pins into equipotential nodes.
 *
 * Two pins are adjacent when one connection reaches both of them. Nodes are
 * the connected components of that graph, found by breadth-first search from
 * each unvisited pin in input order, so node IDs are stable for identical
 * input. Every pin lands in exactly one node; unwired pins become singletons.
 */
public class ElectricalNodeResolver {

    public List<ElectricalNode> resolve(List<Connection> connections, List<Pin> pins) {
        Map<String, Pin> pinsById = new HashMap<>();
        for (Pin pin : pins) {
            pinsById.put(pin.getPinId(), pin);
        }
        Map<String, Set<String>> adjacency = buildAdjacency(connections, pins, pinsById);

        List<ElectricalNode> nodes = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        int nodeCounter = 0;

        for (Pin start : pins) {
            if (visited.contains(start.getPinId())) continue;

            List<Pin> members = new ArrayList<>();
            Deque<Pin> queue = new ArrayDeque<>();
            queue.add(start);
            visited.add(start.getPinId());

            while (!queue.isEmpty()) {
                Pin current = queue.poll();
                members.add(current);
                for (String neighbourId : adjacency.get(current.getPinId())) {
                    if (visited.add(neighbourId)) {
                        queue.add(pinsById.get(neighbourId));
                    }
                }
            }

            nodes.add(toNode("node_" + nodeCounter++, members));
        }
        return nodes;
    }

    /**
     * Neighbour sets keyed by pin ID. Pins reached by one connection are linked in pin input order.
     */
    private Map<String, Set<String>> buildAdjacency(List<Connection> connections, List<Pin> pins,
                                                    Map<String, Pin> pinsById) {
        Map<String, Integer> order = new HashMap<>();
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (int i = 0; i < pins.size(); i++) {
            order.put(pins.get(i).getPinId(), i);
            adjacency.put(pins.get(i).getPinId(), new LinkedHashSet<>());
        }

        for (Connection connection : connections) {
            List<String> touched = new ArrayList<>();
            for (String pinId : connection.getConnectedPins()) {
                if (pinsById.containsKey(pinId)) {
                    touched.add(pinId);
                }
            }
            touched.sort((a, b) -> Integer.compare(order.get(a), order.get(b)));
            for (String a : touched) {
                for (String b : touched) {
                    if (!a.equals(b)) {
                        adjacency.get(a).add(b);
                    }
                }
            }
        }
        return adjacency;
    }

    private ElectricalNode toNode(String nodeId, List<Pin> members) {
        long sumX = 0;
        long sumY = 0;
        Set<String> componentIds = new LinkedHashSet<>();
        List<String> pinIds = new ArrayList<>();
        for (Pin pin : members) {
            sumX += pin.getPosition().x;
            sumY += pin.getPosition().y;
            componentIds.add(pin.getComponentId());
            pinIds.add(pin.getPinId());
        }
        PixelPoint centroid = new PixelPoint((int) (sumX / members.size()), (int) (sumY / members.size()));
        return new ElectricalNode(nodeId, centroid, new ArrayList<>(componentIds), pinIds);
    }
}
