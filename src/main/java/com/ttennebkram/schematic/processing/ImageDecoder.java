package com.ttennebkram.schematic.processing;

import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes encoded image bytes (PNG, JPEG, BMP, ...) into a BGR Mat.
 */
public class ImageDecoder {

    /**
     * Decode an in-memory image buffer.
     *
     * @return a non-empty BGR Mat (caller must release)
     * @throws ImageDecodeException if the buffer is empty or not a decodable image
     */
    public Mat decode(byte[] imageBytes) throws ImageDecodeException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageDecodeException("Image buffer is empty");
        }

        MatOfByte buffer = new MatOfByte(imageBytes);
        try {
            Mat image = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
            if (image == null || image.empty()) {
                if (image != null) image.release();
                throw new ImageDecodeException("Could not decode image (" + imageBytes.length + " bytes)");
            }
            return image;
        } catch (CvException e) {
            throw new ImageDecodeException("Could not decode image: " + e.getMessage(), e);
        } finally {
            buffer.release();
        }
    }

    /**
     * Read and decode an image file.
     */
    public Mat read(Path path) throws ImageDecodeException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageDecodeException("Could not load image: " + path, e);
        }
        return decode(bytes);
    }
}
