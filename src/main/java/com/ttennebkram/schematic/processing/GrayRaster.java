package com.ttennebkram.schematic.processing;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Read-only 8-bit grayscale pixels copied out of a Mat once per analysis, so
 * the per-pixel sampling in {@link ConnectionClassifier} avoids a JNI call per
 * pixel and can run without native code in tests.
 */
public final class GrayRaster {
    private final int width;
    private final int height;
    private final byte[] data;

    public GrayRaster(int width, int height, byte[] data) {
        if (width < 0 || height < 0 || data.length < width * height) {
            throw new IllegalArgumentException("Raster data too small for " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = data.clone();
    }

    /**
     * Copy pixels from an 8-bit image; colour input is converted to gray first.
     */
    public static GrayRaster fromMat(Mat image) {
        if (image == null || image.empty()) {
            return new GrayRaster(0, 0, new byte[0]);
        }

        Mat gray = new GrayscaleProcessor().process(image);
        Mat continuous = null;
        try {
            if (gray.type() != CvType.CV_8UC1) {
                Mat converted = new Mat();
                gray.convertTo(converted, CvType.CV_8UC1);
                gray.release();
                gray = converted;
            }
            continuous = gray.isContinuous() ? gray : gray.clone();
            byte[] pixels = new byte[continuous.rows() * continuous.cols()];
            continuous.get(0, 0, pixels);
            return new GrayRaster(continuous.cols(), continuous.rows(), pixels);
        } finally {
            if (continuous != null && continuous != gray) continuous.release();
            gray.release();
        }
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Pixel intensity 0..255. Caller must check {@link #contains(int, int)} first.
     */
    public int get(int x, int y) {
        return data[y * width + x] & 0xFF;
    }

    public boolean isDark(int x, int y, int darkThreshold) {
        return contains(x, y) && get(x, y) < darkThreshold;
    }
}
