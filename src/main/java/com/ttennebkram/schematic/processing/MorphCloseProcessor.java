package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Morphological close (dilate then erode). Bridges small gaps in drawn lines.
 * Imgproc.morphologyEx(src, dst, MORPH_CLOSE, kernel)
 */
public class MorphCloseProcessor extends ProcessorBase {

    private final int kernelSize;

    public MorphCloseProcessor(int kernelSize) {
        this.kernelSize = Math.max(1, kernelSize);
    }

    @Override
    public String getName() {
        return "MorphClose";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return emptyResult();
        }

        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT,
            new Size(kernelSize, kernelSize));

        Mat output = new Mat();
        Imgproc.morphologyEx(input, output, Imgproc.MORPH_CLOSE, kernel);

        kernel.release();
        return output;
    }
}
