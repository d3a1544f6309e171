package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One device line of a SPICE netlist.
 */
public final class SpiceComponent {
    private final String name;
    private final DeviceKind deviceKind;
    private final List<String> nodes;
    private final String valueOrModel;
    private final Map<String, String> parameters;
    private final String componentId;

    public SpiceComponent(String name, DeviceKind deviceKind, List<String> nodes, String valueOrModel,
                          Map<String, String> parameters, String componentId) {
        this.name = name;
        this.deviceKind = deviceKind;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.valueOrModel = valueOrModel;
        this.parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
            : Collections.emptyMap();
        this.componentId = componentId;
    }

    public String getName() { return name; }
    public DeviceKind getDeviceKind() { return deviceKind; }

    /** Electrical node IDs in terminal order. */
    public List<String> getNodes() { return nodes; }

    public String getValueOrModel() { return valueOrModel; }
    public Map<String, String> getParameters() { return parameters; }

    /** ID of the detected component this device was synthesized from. */
    public String getComponentId() { return componentId; }

    @Override
    public String toString() {
        return name + " " + nodes + " " + valueOrModel;
    }
}
