package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Converts BGR or BGRA input to single-channel gray. Gray input is cloned.
 */
public class GrayscaleProcessor extends ProcessorBase {

    @Override
    public String getName() {
        return "Grayscale";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return emptyResult();
        }

        Mat gray = new Mat();
        if (input.channels() == 3) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (input.channels() == 4) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            input.copyTo(gray);
        }
        return gray;
    }
}
