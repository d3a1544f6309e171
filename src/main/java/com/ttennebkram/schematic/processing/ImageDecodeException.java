package com.ttennebkram.schematic.processing;

import java.io.IOException;

/**
 * The schematic image could not be read or decoded. The only failure that
 * aborts an analysis.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
