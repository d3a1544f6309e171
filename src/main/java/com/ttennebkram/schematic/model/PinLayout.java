package com.ttennebkram.schematic.model;

/**
 * How terminals are placed on a component's bounding box.
 */
public enum PinLayout {
    /** Left-midpoint and right-midpoint. */
    HORIZONTAL_PAIR,
    /** Top-midpoint and bottom-midpoint. */
    VERTICAL_PAIR,
    /** One pin at the top-midpoint. */
    SINGLE_TOP,
    /** Pins spread along both long edges, count derived from box size. */
    DISTRIBUTED
}
