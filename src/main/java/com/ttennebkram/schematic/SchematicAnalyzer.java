package com.ttennebkram.schematic;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.CircuitComplexity;
import com.ttennebkram.schematic.model.ClassifiedConnection;
import com.ttennebkram.schematic.model.Connection;
import com.ttennebkram.schematic.model.ConnectivityMatrix;
import com.ttennebkram.schematic.model.DetectedComponent;
import com.ttennebkram.schematic.model.ElectricalNode;
import com.ttennebkram.schematic.model.NetlistResult;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PotentialIssue;
import com.ttennebkram.schematic.model.RawSegment;
import com.ttennebkram.schematic.model.SchematicAnalysis;
import com.ttennebkram.schematic.model.TopologyResult;
import com.ttennebkram.schematic.netlist.NetlistSynthesizer;
import com.ttennebkram.schematic.processing.ConnectionClassifier;
import com.ttennebkram.schematic.processing.GrayRaster;
import com.ttennebkram.schematic.processing.ImageDecodeException;
import com.ttennebkram.schematic.processing.ImageDecoder;
import com.ttennebkram.schematic.processing.LineSegmentExtractor;
import com.ttennebkram.schematic.topology.ConnectionNetworkBuilder;
import com.ttennebkram.schematic.topology.ElectricalNodeResolver;
import com.ttennebkram.schematic.topology.PinLocator;
import com.ttennebkram.schematic.topology.TopologyAnalyzer;
import org.opencv.core.Mat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the whole pipeline for one schematic: wires are found in the image,
 * matched to component pins, folded into electrical nodes and written out as
 * a SPICE netlist.
 *
 * Only an undecodable image fails the call. Components repeating an earlier
 * ID are dropped. A failing stage is logged and replaced by its empty result
 * (no pins, no connections, one node per pin, a graph without metrics), and
 * the netlist is synthesized in every case.
 * Instances hold only immutable configuration and may be shared across threads.
 */
public class SchematicAnalyzer {

    private static final Logger LOG = Logger.getLogger(SchematicAnalyzer.class.getName());

    private final AnalysisConfig config;
    private final ImageDecoder decoder;
    private final LineSegmentExtractor extractor;
    private final ConnectionClassifier classifier;
    private final PinLocator pinLocator;
    private final ConnectionNetworkBuilder networkBuilder;
    private final ElectricalNodeResolver nodeResolver;
    private final TopologyAnalyzer topologyAnalyzer;
    private final NetlistSynthesizer netlistSynthesizer;

    public SchematicAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public SchematicAnalyzer(AnalysisConfig config) {
        this(config, new PinLocator(config), new ConnectionNetworkBuilder(config),
            new ElectricalNodeResolver(), new TopologyAnalyzer(config));
    }

    SchematicAnalyzer(AnalysisConfig config, PinLocator pinLocator, ConnectionNetworkBuilder networkBuilder,
                      ElectricalNodeResolver nodeResolver, TopologyAnalyzer topologyAnalyzer) {
        this.config = config;
        this.decoder = new ImageDecoder();
        this.extractor = new LineSegmentExtractor(config);
        this.classifier = new ConnectionClassifier(config);
        this.pinLocator = pinLocator;
        this.networkBuilder = networkBuilder;
        this.nodeResolver = nodeResolver;
        this.topologyAnalyzer = topologyAnalyzer;
        this.netlistSynthesizer = new NetlistSynthesizer();
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public SchematicAnalysis analyze(Path imagePath, List<DetectedComponent> components) throws ImageDecodeException {
        Mat image = decoder.read(imagePath);
        try {
            return analyze(image, components);
        } finally {
            image.release();
        }
    }

    public SchematicAnalysis analyze(byte[] imageBytes, List<DetectedComponent> components) throws ImageDecodeException {
        Mat image = decoder.decode(imageBytes);
        try {
            return analyze(image, components);
        } finally {
            image.release();
        }
    }

    /**
     * Analyze an already decoded image. The Mat is not released.
     */
    public SchematicAnalysis analyze(Mat image, List<DetectedComponent> components) {
        List<RawSegment> segments;
        GrayRaster raster;
        try {
            segments = extractor.extract(image);
            raster = GrayRaster.fromMat(image);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Line extraction failed, continuing without connections", e);
            segments = Collections.emptyList();
            raster = new GrayRaster(0, 0, new byte[0]);
        }
        return analyzeSegments(segments, raster, components);
    }

    /**
     * Everything after line extraction. Needs no native code, so it also
     * serves callers that bring their own segments.
     */
    public SchematicAnalysis analyzeSegments(List<RawSegment> segments, GrayRaster raster,
                                             List<DetectedComponent> components) {
        List<DetectedComponent> comps = uniqueById(
            components != null ? components : Collections.<DetectedComponent>emptyList());

        List<ClassifiedConnection> classified;
        try {
            classified = classifier.classify(segments, raster);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Connection classification failed, continuing without connections", e);
            classified = Collections.emptyList();
        }

        List<Pin> pins;
        try {
            pins = pinLocator.locate(comps);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Pin placement failed, continuing without pins", e);
            pins = Collections.emptyList();
        }

        List<Connection> connections;
        try {
            connections = networkBuilder.build(classified, pins);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Connection network failed, continuing without connections", e);
            connections = Collections.emptyList();
        }

        List<ElectricalNode> nodes;
        try {
            nodes = nodeResolver.resolve(connections, pins);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Node resolution failed, placing every pin on its own node", e);
            nodes = singletonNodes(pins);
        }

        TopologyResult topology;
        try {
            topology = topologyAnalyzer.analyze(comps, pins, connections, nodes);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Topology analysis failed, reporting the graph without metrics", e);
            topology = unanalyzedTopology(comps, pins, connections, nodes);
        }

        NetlistResult netlist = netlistSynthesizer.synthesize(comps, pins, nodes);

        LOG.info("Analyzed " + comps.size() + " components: " + connections.size() + " connections, "
            + nodes.size() + " nodes, " + netlist.getDevices().size() + " devices");
        return new SchematicAnalysis(topology, netlist);
    }

    /**
     * Pin and node IDs derive from component IDs, so only the first component
     * with a given ID is kept.
     */
    static List<DetectedComponent> uniqueById(List<DetectedComponent> components) {
        Set<String> seen = new HashSet<>();
        List<DetectedComponent> unique = new ArrayList<>(components.size());
        for (DetectedComponent c : components) {
            if (seen.add(c.getComponentId())) {
                unique.add(c);
            } else {
                LOG.warning("Dropping component with duplicate id: " + c.getComponentId());
            }
        }
        return unique;
    }

    /**
     * Graph without adjacency or metrics; every component is listed as isolated.
     */
    static TopologyResult unanalyzedTopology(List<DetectedComponent> components, List<Pin> pins,
                                             List<Connection> connections, List<ElectricalNode> nodes) {
        int n = components.size();
        List<String> ids = new ArrayList<>(n);
        for (DetectedComponent c : components) {
            ids.add(c.getComponentId());
        }
        ConnectivityMatrix matrix = new ConnectivityMatrix(ids, new boolean[n][n], new double[n][n], ids);
        return new TopologyResult(connections, nodes, pins, matrix, new CircuitComplexity(0, 0, 0, 0),
            Collections.<PotentialIssue>emptyList(), n, 0);
    }

    static List<ElectricalNode> singletonNodes(List<Pin> pins) {
        List<ElectricalNode> nodes = new ArrayList<>(pins.size());
        for (int i = 0; i < pins.size(); i++) {
            Pin pin = pins.get(i);
            nodes.add(new ElectricalNode("node_" + i, pin.getPosition(),
                Collections.singletonList(pin.getComponentId()),
                Collections.singletonList(pin.getPinId())));
        }
        return nodes;
    }
}
