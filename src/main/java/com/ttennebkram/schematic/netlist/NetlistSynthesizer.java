package com.ttennebkram.schematic.netlist;

import com.ttennebkram.schematic.model.ComponentType;
import com.ttennebkram.schematic.model.DetectedComponent;
import com.ttennebkram.schematic.model.DeviceKind;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.NetlistResult;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.SpiceComponent;
import com.ttennebkram.schematic.model.ValueKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns resolved electrical nodes and detected components into SPICE netlist text.
 *
 * Node numbering: every node holding a ground symbol pin is 0, the rest are
 * numbered 1.. in node order. Ground symbols emit no device line.
 * {@link #synthesize} never throws; a failure yields a skeleton netlist with
 * {@code generationSuccess=false}.
 */
public class NetlistSynthesizer {

    private static final Logger LOG = Logger.getLogger(NetlistSynthesizer.class.getName());

    public static final String GROUND_NODE = "gnd";

    static final String DEFAULT_DIODE_MODEL = "1N4148";
    static final String DEFAULT_TRANSISTOR_MODEL = "2N2222";
    static final String LM358_MODEL = "LM358";
    static final String DEFAULT_OPAMP_MODEL = "UA741";
    static final String DEFAULT_IC_MODEL = "GENERIC_IC";

    // Descriptive only; kept in the device record but not written to the line
    private static final Set<String> HIDDEN_PARAMETERS =
        new HashSet<>(Arrays.asList("tolerance", "voltage_rating", "note", "type"));

    private static final List<String> HEADER = Arrays.asList(
        "* SPICE Netlist Generated from Schematic Analysis",
        "* Nodes resolved from detected wires and component pins",
        "");

    public NetlistResult synthesize(List<DetectedComponent> components, List<Pin> pins, List<ElectricalNode> nodes) {
        Map<String, Integer> groundOnly = new LinkedHashMap<>();
        groundOnly.put(GROUND_NODE, 0);

        if (components == null || components.isEmpty()) {
            return skeleton(groundOnly, true, null);
        }

        try {
            return build(components, pins, nodes);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Netlist synthesis failed: " + e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return skeleton(groundOnly, false, error);
        }
    }

    private NetlistResult build(List<DetectedComponent> components, List<Pin> pins, List<ElectricalNode> nodes) {
        Map<String, Integer> nodeMapping = buildNodeMapping(nodes, pins);

        Map<String, String> nodeByPin = new HashMap<>();
        for (ElectricalNode node : nodes) {
            for (String pinId : node.getPinIds()) {
                nodeByPin.put(pinId, node.getNodeId());
            }
        }

        Map<String, List<Pin>> pinsByComponent = new HashMap<>();
        for (Pin pin : pins) {
            pinsByComponent.computeIfAbsent(pin.getComponentId(), k -> new ArrayList<>()).add(pin);
        }

        SpiceNameAllocator names = new SpiceNameAllocator();
        List<SpiceComponent> devices = new ArrayList<>();
        for (DetectedComponent component : components) {
            if (component.getType() == ComponentType.GROUND) continue;

            List<Pin> componentPins = pinsByComponent.getOrDefault(component.getComponentId(), Collections.emptyList());
            devices.add(createDevice(component, componentPins, nodeByPin, names));
        }

        List<String> deviceLines = new ArrayList<>();
        for (SpiceComponent device : devices) {
            deviceLines.add(formatDeviceLine(device, nodeMapping));
        }

        List<String> analysisCommands = generateAnalysisCommands(devices);

        LOG.fine("Synthesized " + devices.size() + " devices over " + nodes.size() + " nodes");
        return new NetlistResult(assemble(deviceLines, analysisCommands), devices, nodeMapping,
            analysisCommands, true, null);
    }

    /**
     * Node id to SPICE node number, in node order. "gnd" always maps to 0.
     */
    static Map<String, Integer> buildNodeMapping(List<ElectricalNode> nodes, List<Pin> pins) {
        Set<String> groundPins = new HashSet<>();
        for (Pin pin : pins) {
            if (pin.getComponentType() == ComponentType.GROUND) {
                groundPins.add(pin.getPinId());
            }
        }

        Map<String, Integer> mapping = new LinkedHashMap<>();
        mapping.put(GROUND_NODE, 0);

        int next = 1;
        for (ElectricalNode node : nodes) {
            if (mapping.containsKey(node.getNodeId())) continue;
            if (isGroundNode(node, groundPins)) {
                mapping.put(node.getNodeId(), 0);
            } else {
                mapping.put(node.getNodeId(), next++);
            }
        }
        return mapping;
    }

    private static boolean isGroundNode(ElectricalNode node, Set<String> groundPins) {
        for (String pinId : node.getPinIds()) {
            if (groundPins.contains(pinId)) {
                return true;
            }
        }
        return false;
    }

    private SpiceComponent createDevice(DetectedComponent component, List<Pin> componentPins,
                                        Map<String, String> nodeByPin, SpiceNameAllocator names) {
        ComponentType type = component.getType();
        DeviceKind kind = type.getDeviceKind();
        String name = names.allocate(kind, component.getDesignation());

        int terminals;
        switch (kind) {
            case Q: terminals = 3; break;
            case X: terminals = componentPins.size(); break;
            default: terminals = 2; break;
        }
        if (componentPins.size() < terminals) {
            throw new NetlistSynthesisException(component.getComponentId() + " has " + componentPins.size()
                + " pins, " + name + " needs " + terminals);
        }

        List<String> terminalNodes = new ArrayList<>(terminals);
        for (Pin pin : componentPins.subList(0, terminals)) {
            String nodeId = nodeByPin.get(pin.getPinId());
            if (nodeId == null) {
                throw new NetlistSynthesisException("Pin " + pin.getPinId() + " is not assigned to any node");
            }
            terminalNodes.add(nodeId);
        }

        Map<String, String> params = new LinkedHashMap<>();
        String valueOrModel;
        switch (type) {
            case RESISTOR:
                valueOrModel = ValueParser.parseResistance(component.getValue()).getSpiceText();
                if (component.getTolerance() != null) {
                    params.put("tolerance", component.getTolerance());
                }
                break;
            case CAPACITOR:
                valueOrModel = ValueParser.parseCapacitance(component.getValue()).getSpiceText();
                params.put("voltage_rating", estimateVoltageRating(component.getValue()));
                break;
            case INDUCTOR:
                valueOrModel = ValueParser.parseInductance(component.getValue()).getSpiceText();
                break;
            case VOLTAGE_SOURCE:
                valueOrModel = ValueParser.parseVoltage(component.getValue()).getSpiceText();
                params.put("type", "DC");
                break;
            case CURRENT_SOURCE:
                valueOrModel = ValueParser.parseCurrent(component.getValue()).getSpiceText();
                params.put("type", "DC");
                break;
            case DIODE:
                valueOrModel = explicitModel(component.getValue(), DEFAULT_DIODE_MODEL);
                params.put("area", "1");
                break;
            case TRANSISTOR:
                valueOrModel = explicitModel(component.getValue(), DEFAULT_TRANSISTOR_MODEL);
                params.put("type", type.getLabel());
                break;
            case OP_AMP:
                valueOrModel = explicitModel(component.getValue(), opAmpModel(component));
                params.put("type", type.getLabel());
                break;
            case IC:
                valueOrModel = explicitModel(component.getValue(), DEFAULT_IC_MODEL);
                params.put("type", type.getLabel());
                break;
            default:
                valueOrModel = ValueKind.RESISTANCE.getDefaultText();
                params.put("note", "Unknown component type: " + component.getTypeLabel());
                break;
        }

        return new SpiceComponent(name, kind, terminalNodes, valueOrModel, params, component.getComponentId());
    }

    private static String explicitModel(String value, String fallback) {
        if (value == null || value.trim().isEmpty()) return fallback;
        return value.trim().replaceAll("\\s+", "_").toUpperCase(Locale.ROOT);
    }

    private static String opAmpModel(DetectedComponent component) {
        String designation = component.getDesignation() != null ? component.getDesignation() : "";
        return designation.toLowerCase(Locale.ROOT).contains("lm358") ? LM358_MODEL : DEFAULT_OPAMP_MODEL;
    }

    /**
     * Rough working-voltage guess for a capacitor from its value prefix.
     */
    static String estimateVoltageRating(String value) {
        if (value == null || value.isEmpty()) return "16V";
        String normalized = ValueParser.normalizeMicro(value);
        if (normalized.contains("u")) return "16V";
        if (normalized.contains("n")) return "50V";
        if (normalized.contains("p")) return "100V";
        return "25V";
    }

    static String formatDeviceLine(SpiceComponent device, Map<String, Integer> nodeMapping) {
        StringBuilder sb = new StringBuilder(device.getName());
        for (String nodeId : device.getNodes()) {
            Integer number = nodeMapping.get(nodeId);
            sb.append(' ').append(number != null ? number : 0);
        }
        sb.append(' ').append(device.getValueOrModel());
        for (Map.Entry<String, String> param : device.getParameters().entrySet()) {
            if (!HIDDEN_PARAMETERS.contains(param.getKey())) {
                sb.append(' ').append(param.getKey()).append('=').append(param.getValue());
            }
        }
        return sb.toString();
    }

    static List<String> generateAnalysisCommands(List<SpiceComponent> devices) {
        List<String> commands = new ArrayList<>();
        commands.add(".op");

        SpiceComponent firstVoltageSource = null;
        boolean reactive = false;
        for (SpiceComponent device : devices) {
            if (device.getDeviceKind() == DeviceKind.V && firstVoltageSource == null) {
                firstVoltageSource = device;
            }
            reactive |= device.getDeviceKind().isReactive();
        }

        if (firstVoltageSource != null) {
            commands.add(".dc " + firstVoltageSource.getName() + " 0 10 0.1");
        }
        if (reactive) {
            commands.add(".ac dec 10 1 1meg");
        }
        commands.add(".tran 1n 1u");
        return commands;
    }

    private static List<String> assemble(List<String> deviceLines, List<String> analysisCommands) {
        List<String> lines = new ArrayList<>(HEADER);

        lines.add("* Circuit Components");
        lines.addAll(deviceLines);
        lines.add("");

        lines.add("* Analysis Commands");
        lines.addAll(analysisCommands);
        lines.add("");

        lines.add("* Control Commands");
        lines.add(".control");
        lines.add("run");
        lines.add("print all");
        lines.add(".endc");
        lines.add("");

        lines.add(".end");
        return lines;
    }

    private static NetlistResult skeleton(Map<String, Integer> nodeMapping, boolean success, String error) {
        List<String> lines = new ArrayList<>(HEADER);
        lines.add(".op");
        lines.add(".end");
        return new NetlistResult(lines, Collections.emptyList(), nodeMapping,
            Collections.singletonList(".op"), success, error);
    }
}
