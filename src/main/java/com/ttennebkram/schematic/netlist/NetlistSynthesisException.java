package com.ttennebkram.schematic.netlist;

/**
 * Raised inside the synthesizer when the topology handed to it is inconsistent
 * (for example a pin that belongs to no node). Never escapes
 * {@link NetlistSynthesizer#synthesize}.
 */
public class NetlistSynthesisException extends RuntimeException {

    public NetlistSynthesisException(String message) {
        super(message);
    }

    public NetlistSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
