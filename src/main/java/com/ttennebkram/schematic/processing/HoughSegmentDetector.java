package com.ttennebkram.schematic.processing;

import com.ttennebkram.schematic.model.RawSegment;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Probabilistic Hough line transform over an edge map.
 * Imgproc.HoughLinesP(edges, lines, rho, theta, threshold, minLineLength, maxLineGap)
 */
public class HoughSegmentDetector {

    private final double rho;
    private final double thetaRadians;
    private final int threshold;
    private final int minLineLength;
    private final int maxLineGap;

    public HoughSegmentDetector(double rho, double thetaDegrees, int threshold, int minLineLength, int maxLineGap) {
        this.rho = rho;
        this.thetaRadians = Math.toRadians(thetaDegrees);
        this.threshold = threshold;
        this.minLineLength = minLineLength;
        this.maxLineGap = maxLineGap;
    }

    /**
     * Detect segments on a single-channel edge image. Returns an empty list when
     * nothing is found.
     */
    public List<RawSegment> detect(Mat edges) {
        List<RawSegment> segments = new ArrayList<>();
        if (edges == null || edges.empty()) {
            return segments;
        }

        Mat lines = new Mat();
        try {
            Imgproc.HoughLinesP(edges, lines, rho, thetaRadians, threshold, minLineLength, maxLineGap);
            for (int i = 0; i < lines.rows(); i++) {
                double[] l = lines.get(i, 0);
                if (l != null && l.length >= 4) {
                    segments.add(new RawSegment((int) l[0], (int) l[1], (int) l[2], (int) l[3]));
                }
            }
            return segments;
        } finally {
            lines.release();
        }
    }
}
