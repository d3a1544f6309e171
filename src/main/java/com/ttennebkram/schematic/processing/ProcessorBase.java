package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;

/**
 * Common helpers for preprocessing steps.
 */
public abstract class ProcessorBase implements ImageProcessor {

    /**
     * Short name used in log messages (e.g., "GaussianBlur").
     */
    public abstract String getName();

    /**
     * Standard null/empty check for input validation.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Kernel and block sizes must be odd and at least {@code min}.
     */
    protected static int oddAtLeast(int size, int min) {
        int v = Math.max(size, min);
        return (v % 2 == 0) ? v + 1 : v;
    }

    /**
     * Invalid input passes through as an empty Mat so the caller can always release the result.
     */
    protected Mat emptyResult() {
        return new Mat();
    }
}
