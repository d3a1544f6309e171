package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Gaussian blur for noise suppression ahead of thresholding.
 * Imgproc.GaussianBlur(src, dst, ksize, sigmaX)
 */
public class GaussianBlurProcessor extends ProcessorBase {

    private final int kernelSize;
    private final double sigmaX;

    public GaussianBlurProcessor(int kernelSize) {
        this(kernelSize, 0.0);
    }

    public GaussianBlurProcessor(int kernelSize, double sigmaX) {
        // Kernel size must be odd
        this.kernelSize = oddAtLeast(kernelSize, 1);
        this.sigmaX = sigmaX;
    }

    @Override
    public String getName() {
        return "GaussianBlur";
    }

    public int getKernelSize() {
        return kernelSize;
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return emptyResult();
        }

        Mat output = new Mat();
        Imgproc.GaussianBlur(input, output, new Size(kernelSize, kernelSize), sigmaX);
        return output;
    }
}
