package com.ttennebkram.schematic.topology;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.BoundingBox;
import com.ttennebkram.schematic.model.DetectedComponent;
import com.ttennebkram.schematic.model.Pin;
import com.ttennebkram.schematic.model.PixelPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Derives terminal positions from a component's bounding box and type.
 *
 * Two-terminal passives sit on the left/right midpoints, sources on the
 * top/bottom midpoints, ground has a single top pin. Transistors, op-amps and
 * ICs get {@code max(2, longerSide / pinPitch)} pins on each long edge.
 * Coordinates are truncated to whole pixels.
 */
public class PinLocator {

    private static final Logger LOG = Logger.getLogger(PinLocator.class.getName());

    private final int pinPitch;

    public PinLocator(AnalysisConfig config) {
        this.pinPitch = config.getPinPitch();
    }

    /**
     * Pins for every component, in component order then pin order.
     */
    public List<Pin> locate(List<DetectedComponent> components) {
        List<Pin> pins = new ArrayList<>();
        for (DetectedComponent component : components) {
            pins.addAll(locate(component));
        }
        return pins;
    }

    public List<Pin> locate(DetectedComponent component) {
        BoundingBox box = component.getBoundingBox();
        if (box.isDegenerate()) {
            LOG.fine("Degenerate bounding box for " + component.getComponentId() + " " + box
                + "; pins collapse onto its corners");
        }

        List<PixelPoint> positions = pinPositions(box, component);
        List<Pin> pins = new ArrayList<>(positions.size());
        for (int i = 0; i < positions.size(); i++) {
            pins.add(new Pin(component.getComponentId() + "_pin_" + i, component.getComponentId(),
                positions.get(i), i + 1, component.getType()));
        }
        return pins;
    }

    List<PixelPoint> pinPositions(BoundingBox box, DetectedComponent component) {
        double x1 = box.getX1();
        double y1 = box.getY1();
        double x2 = box.getX2();
        double y2 = box.getY2();
        double centerX = box.getCenterX();
        double centerY = box.getCenterY();

        List<PixelPoint> pins = new ArrayList<>();
        switch (component.getType().getPinLayout()) {
            case VERTICAL_PAIR:
                pins.add(point(centerX, y1)); // Top
                pins.add(point(centerX, y2)); // Bottom
                break;
            case SINGLE_TOP:
                pins.add(point(centerX, y1));
                break;
            case DISTRIBUTED:
                addDistributedPins(pins, box);
                break;
            case HORIZONTAL_PAIR:
            default:
                pins.add(point(x1, centerY)); // Left
                pins.add(point(x2, centerY)); // Right
                break;
        }
        return pins;
    }

    /**
     * Wider than tall: pins along top and bottom. Otherwise along left and right.
     * Pairs are interleaved (top, bottom, top, bottom...).
     */
    private void addDistributedPins(List<PixelPoint> pins, BoundingBox box) {
        double width = box.getWidth();
        double height = box.getHeight();

        if (width > height) {
            int numPins = pinsPerEdge(width);
            for (int i = 0; i < numPins; i++) {
                double pinX = box.getX1() + (i + 1) * width / (numPins + 1);
                pins.add(point(pinX, box.getY1()));
                pins.add(point(pinX, box.getY2()));
            }
        } else {
            int numPins = pinsPerEdge(height);
            for (int i = 0; i < numPins; i++) {
                double pinY = box.getY1() + (i + 1) * height / (numPins + 1);
                pins.add(point(box.getX1(), pinY));
                pins.add(point(box.getX2(), pinY));
            }
        }
    }

    int pinsPerEdge(double longerSide) {
        return Math.max(2, (int) (longerSide / pinPitch));
    }

    private static PixelPoint point(double x, double y) {
        return new PixelPoint((int) x, (int) y);
    }
}
