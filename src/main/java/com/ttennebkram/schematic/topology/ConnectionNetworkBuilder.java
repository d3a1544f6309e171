package com.ttennebkram.schematic.topology;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.ClassifiedConnection;
import com.ttennebkram.schematic.model.Connection;
import com.ttennebkram.schematic.model.Pin;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Attaches classified segments to the pins near their endpoints.
 *
 * A segment with no pin in reach is not a connection and is dropped. A segment
 * reaching pins of a single component is kept as a dangling connection.
 * Output order follows input order so node numbering stays reproducible.
 */
public class ConnectionNetworkBuilder {

    private static final Logger LOG = Logger.getLogger(ConnectionNetworkBuilder.class.getName());

    private final double proximityThreshold;

    public ConnectionNetworkBuilder(AnalysisConfig config) {
        this.proximityThreshold = config.getProximityThreshold();
    }

    public List<Connection> build(List<ClassifiedConnection> segments, List<Pin> pins) {
        List<Connection> connections = new ArrayList<>();
        int dropped = 0;

        for (ClassifiedConnection segment : segments) {
            Set<String> componentIds = new LinkedHashSet<>();
            List<String> pinIds = new ArrayList<>();

            for (Pin pin : pins) {
                double distStart = segment.getStart().distanceTo(pin.getPosition());
                double distEnd = segment.getEnd().distanceTo(pin.getPosition());
                if (distStart < proximityThreshold || distEnd < proximityThreshold) {
                    componentIds.add(pin.getComponentId());
                    pinIds.add(pin.getPinId());
                }
            }

            if (componentIds.isEmpty()) {
                dropped++;
                continue;
            }

            connections.add(Connection.straight(segment.getStart(), segment.getEnd(), segment.getKind(),
                segment.getConfidence(), new ArrayList<>(componentIds), pinIds));
        }

        LOG.fine("Built " + connections.size() + " connections, dropped " + dropped + " unattached segments");
        return connections;
    }
}
