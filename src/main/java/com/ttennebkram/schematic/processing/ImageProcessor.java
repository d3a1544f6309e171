package com.ttennebkram.schematic.processing;

import org.opencv.core.Mat;

/**
 * One step of the wire-extraction preprocessing chain.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * @param input left untouched; the caller keeps ownership
     * @return a new Mat the caller must release
     */
    Mat process(Mat input);
}
