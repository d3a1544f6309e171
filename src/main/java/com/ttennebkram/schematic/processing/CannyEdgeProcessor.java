package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Canny edge detection on the cleaned binary image.
 * Imgproc.Canny(image, edges, threshold1, threshold2, apertureSize)
 */
public class CannyEdgeProcessor extends ProcessorBase {

    private final int threshold1;
    private final int threshold2;
    private final int apertureSize;

    public CannyEdgeProcessor(int threshold1, int threshold2, int apertureSize) {
        this.threshold1 = threshold1;
        this.threshold2 = threshold2;
        // Aperture must be odd, 3..7
        this.apertureSize = Math.min(7, oddAtLeast(apertureSize, 3));
    }

    @Override
    public String getName() {
        return "CannyEdge";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return emptyResult();
        }

        Mat edges = new Mat();
        Imgproc.Canny(input, edges, threshold1, threshold2, apertureSize, false);
        return edges;
    }
}
