package com.ttennebkram.schematic;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.DetectedComponent;
import com.ttennebkram.schematic.model.SchematicAnalysis;
import com.ttennebkram.schematic.processing.ImageDecodeException;
import com.ttennebkram.schematic.serialization.AnalysisResultWriter;
import com.ttennebkram.schematic.serialization.ComponentListReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * schematic-topology IMAGE COMPONENTS_JSON [CONFIG_JSON] [--netlist-out FILE]
 * </pre>
 *
 * Prints the analysis as JSON on stdout. With --netlist-out the netlist text is
 * also written to FILE.
 */
public class SchematicAnalyzerLauncher {

    private static final Logger LOG = Logger.getLogger(SchematicAnalyzerLauncher.class.getName());

    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    static int run(String[] args) {
        List<String> positional = new ArrayList<>();
        Path netlistOut = null;
        for (int i = 0; i < args.length; i++) {
            if ("--netlist-out".equals(args[i])) {
                if (i + 1 >= args.length) {
                    return usage("--netlist-out needs a file name");
                }
                netlistOut = Paths.get(args[++i]);
            } else if ("-h".equals(args[i]) || "--help".equals(args[i])) {
                usage(null);
                return 0;
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.size() < 2 || positional.size() > 3) {
            return usage("expected an image and a component list");
        }

        try {
            AnalysisConfig config = positional.size() == 3
                ? loadConfig(Paths.get(positional.get(2)))
                : AnalysisConfig.loadDefaults();
            List<DetectedComponent> components = ComponentListReader.read(Paths.get(positional.get(1)));

            // Load OpenCV native library
            nu.pattern.OpenCV.loadLocally();

            SchematicAnalysis analysis = new SchematicAnalyzer(config).analyze(Paths.get(positional.get(0)), components);
            System.out.println(AnalysisResultWriter.toJsonString(analysis));

            if (netlistOut != null) {
                Files.write(netlistOut, (analysis.getNetlist().getNetlistText() + "\n").getBytes(StandardCharsets.UTF_8));
                LOG.info("Netlist written to " + netlistOut);
            }
            return 0;
        } catch (ImageDecodeException e) {
            System.err.println("Cannot read image: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static AnalysisConfig loadConfig(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return AnalysisConfig.load(reader);
        }
    }

    private static int usage(String problem) {
        if (problem != null) {
            System.err.println("Error: " + problem);
        }
        System.err.println("Usage: schematic-topology IMAGE COMPONENTS_JSON [CONFIG_JSON] [--netlist-out FILE]");
        return EXIT_USAGE;
    }

    /**
     * Install the packaged logging.properties unless the JVM was started with
     * its own java.util.logging configuration.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = SchematicAnalyzerLauncher.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to read logging configuration: " + e.getMessage());
        }
    }
}
