package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Local (Gaussian-weighted) thresholding, inverted so ink becomes white.
 * Tolerates uneven lighting in scanned or photographed schematics.
 * Imgproc.adaptiveThreshold(src, dst, maxValue, method, type, blockSize, C)
 */
public class AdaptiveThresholdProcessor extends ProcessorBase {

    private final int blockSize;
    private final int cValue;

    public AdaptiveThresholdProcessor(int blockSize, int cValue) {
        // Block size must be odd and > 1
        this.blockSize = oddAtLeast(blockSize, 3);
        this.cValue = cValue;
    }

    @Override
    public String getName() {
        return "AdaptiveThreshold";
    }

    public int getBlockSize() {
        return blockSize;
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return emptyResult();
        }

        Mat thresh = new Mat();
        Imgproc.adaptiveThreshold(input, thresh, 255,
            Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY_INV, blockSize, cValue);
        return thresh;
    }
}
