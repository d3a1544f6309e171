package com.ttennebkram.schematic.processing;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.RawSegment;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a schematic image into consolidated candidate wire segments.
 *
 * Chain: grayscale -> Gaussian blur -> adaptive threshold (inverted) ->
 * morphological close -> Canny -> probabilistic Hough -> merge.
 * Finding no lines is not an error; the result is simply empty.
 */
public class LineSegmentExtractor {

    private static final Logger LOG = Logger.getLogger(LineSegmentExtractor.class.getName());

    private final List<ProcessorBase> preprocessing;
    private final HoughSegmentDetector detector;
    private final SegmentMerger merger;

    public LineSegmentExtractor(AnalysisConfig config) {
        List<ProcessorBase> chain = new ArrayList<>();
        chain.add(new GrayscaleProcessor());
        chain.add(new GaussianBlurProcessor(config.getBlurKernelSize()));
        chain.add(new AdaptiveThresholdProcessor(config.getAdaptiveBlockSize(), config.getAdaptiveC()));
        chain.add(new MorphCloseProcessor(config.getCloseKernelSize()));
        chain.add(new CannyEdgeProcessor(config.getCannyThreshold1(), config.getCannyThreshold2(),
            config.getCannyApertureSize()));
        this.preprocessing = Collections.unmodifiableList(chain);
        this.detector = new HoughSegmentDetector(config.getHoughRho(), config.getHoughThetaDegrees(),
            config.getHoughThreshold(), config.getMinLineLength(), config.getMaxLineGap());
        this.merger = new SegmentMerger(config.getMergeDistance());
    }

    /**
     * Extract merged segments. The input Mat is not modified or released.
     */
    public List<RawSegment> extract(Mat image) {
        if (image == null || image.empty()) {
            LOG.info("No image content; no line segments");
            return new ArrayList<>();
        }

        Mat edges = preprocess(image);
        try {
            List<RawSegment> raw = detector.detect(edges);
            List<RawSegment> merged = merger.merge(raw);
            if (merged.isEmpty()) {
                LOG.info("No line segments found in " + image.cols() + "x" + image.rows() + " image");
            } else {
                LOG.fine("Detected " + raw.size() + " raw segments, " + merged.size() + " after merging");
            }
            return merged;
        } finally {
            edges.release();
        }
    }

    /**
     * Run the preprocessing chain and return the edge map (caller releases).
     */
    public Mat preprocess(Mat image) {
        Mat current = image;
        for (ProcessorBase step : preprocessing) {
            Mat next = step.process(current);
            if (current != image) {
                current.release();
            }
            current = next;
            if (LOG.isLoggable(Level.FINEST)) {
                LOG.finest("[" + step.getName() + "] -> " + current.cols() + "x" + current.rows());
            }
        }
        return current == image ? image.clone() : current;
    }
}
