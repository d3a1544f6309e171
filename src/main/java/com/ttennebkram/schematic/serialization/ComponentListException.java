package com.ttennebkram.schematic.serialization;

import java.io.IOException;

/**
 * The component list JSON is readable but does not describe components.
 */
public class ComponentListException extends IOException {

    public ComponentListException(String message) {
        super(message);
    }
}
