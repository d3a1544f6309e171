package com.ttennebkram.schematic.processing;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.ClassifiedConnection;
import com.ttennebkram.schematic.model.ConnectionKind;
import com.ttennebkram.schematic.model.PixelPoint;
import com.ttennebkram.schematic.model.RawSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores merged segments by how much they look like intentional wires.
 *
 * Axis-aligned, long, thin and unbroken strokes score highest. Nothing is
 * discarded here; proximity to pins decides relevance downstream.
 */
public class ConnectionClassifier {

    private final AnalysisConfig config;

    public ConnectionClassifier(AnalysisConfig config) {
        this.config = config;
    }

    public List<ClassifiedConnection> classify(List<RawSegment> segments, GrayRaster raster) {
        List<ClassifiedConnection> result = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            result.add(classify("conn_" + i, segments.get(i), raster));
        }
        return result;
    }

    public ClassifiedConnection classify(String id, RawSegment segment, GrayRaster raster) {
        PixelPoint p1 = segment.getP1();
        PixelPoint p2 = segment.getP2();

        double length = segment.length();
        double angle = Math.toDegrees(Math.atan2(p2.y - p1.y, p2.x - p1.x));
        double thickness = estimateThickness(raster, p1, p2);
        double continuity = measureContinuity(raster, p1, p2);

        double confidence = config.getBaseConfidence();
        if (isAxisAligned(angle)) {
            confidence += config.getAxisAlignedBoost();
        }
        if (length > config.getLongLineLength()) {
            confidence += config.getLongLineBoost();
        }
        if (thickness <= config.getMaxWireThickness() && continuity > config.getMinContinuity()) {
            confidence += config.getWireQualityBoost();
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        return new ClassifiedConnection(id, p1, p2, ConnectionKind.WIRE, confidence,
            length, angle, thickness, continuity);
    }

    /**
     * Within tolerance of 0, 90 or 180 degrees (either direction).
     */
    boolean isAxisAligned(double angleDegrees) {
        double a = Math.abs(angleDegrees);
        double tol = config.getAxisToleranceDegrees();
        return a < tol || Math.abs(a - 90.0) < tol || Math.abs(a - 180.0) < tol;
    }

    /**
     * Mean stroke width across evenly spaced samples along the segment.
     * Returns 1.0 when no sample falls inside the image.
     */
    double estimateThickness(GrayRaster raster, PixelPoint p1, PixelPoint p2) {
        double length = p1.distanceTo(p2);
        int numSamples = Math.max(3, (int) (length / config.getThicknessSampleSpacing()));

        double total = 0;
        int counted = 0;
        for (int i = 0; i < numSamples; i++) {
            double t = (double) i / (numSamples - 1);
            int x = (int) (p1.x + t * (p2.x - p1.x));
            int y = (int) (p1.y + t * (p2.y - p1.y));
            if (raster.contains(x, y)) {
                total += perpendicularThickness(raster, x, y, p1, p2);
                counted++;
            }
        }
        return counted > 0 ? total / counted : 1.0;
    }

    /**
     * Walk outward from (x, y) along the unit normal in both directions until a
     * light pixel or the image edge; width is twice the larger extent.
     */
    double perpendicularThickness(GrayRaster raster, int x, int y, PixelPoint p1, PixelPoint p2) {
        double dx = p2.x - p1.x;
        double dy = p2.y - p1.y;
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length == 0) {
            return 1.0;
        }

        double perpX = -dy / length;
        double perpY = dx / length;
        int darkThreshold = config.getDarkPixelThreshold();

        int maxExtent = 0;
        for (int direction = -1; direction <= 1; direction += 2) {
            for (int dist = 1; dist < config.getThicknessSearchRadius(); dist++) {
                int sx = (int) (x + direction * dist * perpX);
                int sy = (int) (y + direction * dist * perpY);
                if (!raster.isDark(sx, sy, darkThreshold)) {
                    break;
                }
                maxExtent = Math.max(maxExtent, dist);
            }
        }
        return maxExtent * 2.0;
    }

    /**
     * Fraction of evenly spaced samples along the segment that land on dark pixels.
     */
    double measureContinuity(GrayRaster raster, PixelPoint p1, PixelPoint p2) {
        double length = p1.distanceTo(p2);
        int numSamples = Math.max(5, (int) (length / config.getContinuitySampleSpacing()));

        int darkPixels = 0;
        for (int i = 0; i < numSamples; i++) {
            double t = (double) i / (numSamples - 1);
            int x = (int) (p1.x + t * (p2.x - p1.x));
            int y = (int) (p1.y + t * (p2.y - p1.y));
            if (raster.isDark(x, y, config.getDarkPixelThreshold())) {
                darkPixels++;
            }
        }
        return (double) darkPixels / numSamples;
    }
}
