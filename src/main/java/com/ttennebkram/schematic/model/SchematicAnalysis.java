package com.ttennebkram.schematic.model;

/**
 * Everything one invocation produces.
 */
public final class SchematicAnalysis {
    public final TopologyResult topology;
    public final NetlistResult netlist;

    public SchematicAnalysis(TopologyResult topology, NetlistResult netlist) {
        this.topology = topology;
        this.netlist = netlist;
    }

    public TopologyResult getTopology() { return topology; }
    public NetlistResult getNetlist() { return netlist; }
}
