package com.ttennebkram.schematic.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Tunable thresholds for every pipeline stage.
 *
 * Immutable so one instance can be shared by concurrent analyses. Values are
 * in pixels unless noted. Load from JSON with {@link #fromJson(JsonObject)}
 * (missing keys keep their defaults) or build in code with {@link #builder()}.
 */
public final class AnalysisConfig {

    public static final String DEFAULTS_RESOURCE = "/schematic-analysis.json";

    // Preprocessing
    private final int blurKernelSize;
    private final int adaptiveBlockSize;
    private final int adaptiveC;
    private final int closeKernelSize;
    private final int cannyThreshold1;
    private final int cannyThreshold2;
    private final int cannyApertureSize;

    // Line transform
    private final double houghRho;
    private final double houghThetaDegrees;
    private final int houghThreshold;
    private final int minLineLength;
    private final int maxLineGap;
    private final double mergeDistance;

    // Classification
    private final double baseConfidence;
    private final double axisToleranceDegrees;
    private final double axisAlignedBoost;
    private final double longLineLength;
    private final double longLineBoost;
    private final double maxWireThickness;
    private final double minContinuity;
    private final double wireQualityBoost;
    private final int darkPixelThreshold;
    private final int thicknessSearchRadius;
    private final int thicknessSampleSpacing;
    private final int continuitySampleSpacing;
    private final double confidenceThreshold;

    // Pins and network
    private final int pinPitch;
    private final double proximityThreshold;

    // Topology checks
    private final double shortConnectionLength;
    private final int highDegreeThreshold;

    private AnalysisConfig(Builder b) {
        this.blurKernelSize = b.blurKernelSize;
        this.adaptiveBlockSize = b.adaptiveBlockSize;
        this.adaptiveC = b.adaptiveC;
        this.closeKernelSize = b.closeKernelSize;
        this.cannyThreshold1 = b.cannyThreshold1;
        this.cannyThreshold2 = b.cannyThreshold2;
        this.cannyApertureSize = b.cannyApertureSize;
        this.houghRho = b.houghRho;
        this.houghThetaDegrees = b.houghThetaDegrees;
        this.houghThreshold = b.houghThreshold;
        this.minLineLength = b.minLineLength;
        this.maxLineGap = b.maxLineGap;
        this.mergeDistance = b.mergeDistance;
        this.baseConfidence = b.baseConfidence;
        this.axisToleranceDegrees = b.axisToleranceDegrees;
        this.axisAlignedBoost = b.axisAlignedBoost;
        this.longLineLength = b.longLineLength;
        this.longLineBoost = b.longLineBoost;
        this.maxWireThickness = b.maxWireThickness;
        this.minContinuity = b.minContinuity;
        this.wireQualityBoost = b.wireQualityBoost;
        this.darkPixelThreshold = b.darkPixelThreshold;
        this.thicknessSearchRadius = b.thicknessSearchRadius;
        this.thicknessSampleSpacing = b.thicknessSampleSpacing;
        this.continuitySampleSpacing = b.continuitySampleSpacing;
        this.confidenceThreshold = b.confidenceThreshold;
        this.pinPitch = b.pinPitch;
        this.proximityThreshold = b.proximityThreshold;
        this.shortConnectionLength = b.shortConnectionLength;
        this.highDegreeThreshold = b.highDegreeThreshold;
    }

    public static AnalysisConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load the packaged defaults file from the classpath.
     */
    public static AnalysisConfig loadDefaults() throws IOException {
        try (InputStream in = AnalysisConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    /**
     * Load a configuration JSON object from a reader.
     */
    public static AnalysisConfig load(Reader reader) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid configuration: not a JSON object");
            }
            return fromJson(parsed.getAsJsonObject());
        } catch (JsonSyntaxException e) {
            throw new IOException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Read settings from JSON; keys that are absent keep their default value.
     */
    public static AnalysisConfig fromJson(JsonObject json) {
        Builder d = new Builder();
        Builder b = new Builder();
        b.blurKernelSize = getJsonInt(json, "blurKernelSize", d.blurKernelSize);
        b.adaptiveBlockSize = getJsonInt(json, "adaptiveBlockSize", d.adaptiveBlockSize);
        b.adaptiveC = getJsonInt(json, "adaptiveC", d.adaptiveC);
        b.closeKernelSize = getJsonInt(json, "closeKernelSize", d.closeKernelSize);
        b.cannyThreshold1 = getJsonInt(json, "cannyThreshold1", d.cannyThreshold1);
        b.cannyThreshold2 = getJsonInt(json, "cannyThreshold2", d.cannyThreshold2);
        b.cannyApertureSize = getJsonInt(json, "cannyApertureSize", d.cannyApertureSize);
        b.houghRho = getJsonDouble(json, "houghRho", d.houghRho);
        b.houghThetaDegrees = getJsonDouble(json, "houghThetaDegrees", d.houghThetaDegrees);
        b.houghThreshold = getJsonInt(json, "houghThreshold", d.houghThreshold);
        b.minLineLength = getJsonInt(json, "minLineLength", d.minLineLength);
        b.maxLineGap = getJsonInt(json, "maxLineGap", d.maxLineGap);
        b.mergeDistance = getJsonDouble(json, "mergeDistance", d.mergeDistance);
        b.baseConfidence = getJsonDouble(json, "baseConfidence", d.baseConfidence);
        b.axisToleranceDegrees = getJsonDouble(json, "axisToleranceDegrees", d.axisToleranceDegrees);
        b.axisAlignedBoost = getJsonDouble(json, "axisAlignedBoost", d.axisAlignedBoost);
        b.longLineLength = getJsonDouble(json, "longLineLength", d.longLineLength);
        b.longLineBoost = getJsonDouble(json, "longLineBoost", d.longLineBoost);
        b.maxWireThickness = getJsonDouble(json, "maxWireThickness", d.maxWireThickness);
        b.minContinuity = getJsonDouble(json, "minContinuity", d.minContinuity);
        b.wireQualityBoost = getJsonDouble(json, "wireQualityBoost", d.wireQualityBoost);
        b.darkPixelThreshold = getJsonInt(json, "darkPixelThreshold", d.darkPixelThreshold);
        b.thicknessSearchRadius = getJsonInt(json, "thicknessSearchRadius", d.thicknessSearchRadius);
        b.thicknessSampleSpacing = getJsonInt(json, "thicknessSampleSpacing", d.thicknessSampleSpacing);
        b.continuitySampleSpacing = getJsonInt(json, "continuitySampleSpacing", d.continuitySampleSpacing);
        b.confidenceThreshold = getJsonDouble(json, "confidenceThreshold", d.confidenceThreshold);
        b.pinPitch = getJsonInt(json, "pinPitch", d.pinPitch);
        b.proximityThreshold = getJsonDouble(json, "proximityThreshold", d.proximityThreshold);
        b.shortConnectionLength = getJsonDouble(json, "shortConnectionLength", d.shortConnectionLength);
        b.highDegreeThreshold = getJsonInt(json, "highDegreeThreshold", d.highDegreeThreshold);
        return b.build();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("blurKernelSize", blurKernelSize);
        json.addProperty("adaptiveBlockSize", adaptiveBlockSize);
        json.addProperty("adaptiveC", adaptiveC);
        json.addProperty("closeKernelSize", closeKernelSize);
        json.addProperty("cannyThreshold1", cannyThreshold1);
        json.addProperty("cannyThreshold2", cannyThreshold2);
        json.addProperty("cannyApertureSize", cannyApertureSize);
        json.addProperty("houghRho", houghRho);
        json.addProperty("houghThetaDegrees", houghThetaDegrees);
        json.addProperty("houghThreshold", houghThreshold);
        json.addProperty("minLineLength", minLineLength);
        json.addProperty("maxLineGap", maxLineGap);
        json.addProperty("mergeDistance", mergeDistance);
        json.addProperty("baseConfidence", baseConfidence);
        json.addProperty("axisToleranceDegrees", axisToleranceDegrees);
        json.addProperty("axisAlignedBoost", axisAlignedBoost);
        json.addProperty("longLineLength", longLineLength);
        json.addProperty("longLineBoost", longLineBoost);
        json.addProperty("maxWireThickness", maxWireThickness);
        json.addProperty("minContinuity", minContinuity);
        json.addProperty("wireQualityBoost", wireQualityBoost);
        json.addProperty("darkPixelThreshold", darkPixelThreshold);
        json.addProperty("thicknessSearchRadius", thicknessSearchRadius);
        json.addProperty("thicknessSampleSpacing", thicknessSampleSpacing);
        json.addProperty("continuitySampleSpacing", continuitySampleSpacing);
        json.addProperty("confidenceThreshold", confidenceThreshold);
        json.addProperty("pinPitch", pinPitch);
        json.addProperty("proximityThreshold", proximityThreshold);
        json.addProperty("shortConnectionLength", shortConnectionLength);
        json.addProperty("highDegreeThreshold", highDegreeThreshold);
        return json;
    }

    private static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    private static double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }

    // Getters

    public int getBlurKernelSize() { return blurKernelSize; }
    public int getAdaptiveBlockSize() { return adaptiveBlockSize; }
    public int getAdaptiveC() { return adaptiveC; }
    public int getCloseKernelSize() { return closeKernelSize; }
    public int getCannyThreshold1() { return cannyThreshold1; }
    public int getCannyThreshold2() { return cannyThreshold2; }
    public int getCannyApertureSize() { return cannyApertureSize; }
    public double getHoughRho() { return houghRho; }
    public double getHoughThetaDegrees() { return houghThetaDegrees; }
    public int getHoughThreshold() { return houghThreshold; }
    public int getMinLineLength() { return minLineLength; }
    public int getMaxLineGap() { return maxLineGap; }
    public double getMergeDistance() { return mergeDistance; }
    public double getBaseConfidence() { return baseConfidence; }
    public double getAxisToleranceDegrees() { return axisToleranceDegrees; }
    public double getAxisAlignedBoost() { return axisAlignedBoost; }
    public double getLongLineLength() { return longLineLength; }
    public double getLongLineBoost() { return longLineBoost; }
    public double getMaxWireThickness() { return maxWireThickness; }
    public double getMinContinuity() { return minContinuity; }
    public double getWireQualityBoost() { return wireQualityBoost; }
    public int getDarkPixelThreshold() { return darkPixelThreshold; }
    public int getThicknessSearchRadius() { return thicknessSearchRadius; }
    public int getThicknessSampleSpacing() { return thicknessSampleSpacing; }
    public int getContinuitySampleSpacing() { return continuitySampleSpacing; }
    public double getConfidenceThreshold() { return confidenceThreshold; }
    public int getPinPitch() { return pinPitch; }
    public double getProximityThreshold() { return proximityThreshold; }
    public double getShortConnectionLength() { return shortConnectionLength; }
    public int getHighDegreeThreshold() { return highDegreeThreshold; }

    /**
     * Mutable builder; every field starts at its default.
     */
    public static final class Builder {
        private int blurKernelSize = 3;
        private int adaptiveBlockSize = 11;
        private int adaptiveC = 2;
        private int closeKernelSize = 2;
        private int cannyThreshold1 = 50;
        private int cannyThreshold2 = 150;
        private int cannyApertureSize = 3;
        private double houghRho = 1.0;
        private double houghThetaDegrees = 1.0;
        private int houghThreshold = 50;
        private int minLineLength = 20;
        private int maxLineGap = 5;
        private double mergeDistance = 10.0;
        private double baseConfidence = 0.7;
        private double axisToleranceDegrees = 15.0;
        private double axisAlignedBoost = 0.2;
        private double longLineLength = 30.0;
        private double longLineBoost = 0.1;
        private double maxWireThickness = 3.0;
        private double minContinuity = 0.8;
        private double wireQualityBoost = 0.1;
        private int darkPixelThreshold = 128;
        private int thicknessSearchRadius = 20;
        private int thicknessSampleSpacing = 10;
        private int continuitySampleSpacing = 5;
        private double confidenceThreshold = 0.6;
        private int pinPitch = 20;
        private double proximityThreshold = 25.0;
        private double shortConnectionLength = 10.0;
        private int highDegreeThreshold = 4;

        private Builder() {
        }

        public Builder blurKernelSize(int v) { blurKernelSize = v; return this; }
        public Builder adaptiveBlockSize(int v) { adaptiveBlockSize = v; return this; }
        public Builder adaptiveC(int v) { adaptiveC = v; return this; }
        public Builder closeKernelSize(int v) { closeKernelSize = v; return this; }
        public Builder cannyThreshold1(int v) { cannyThreshold1 = v; return this; }
        public Builder cannyThreshold2(int v) { cannyThreshold2 = v; return this; }
        public Builder cannyApertureSize(int v) { cannyApertureSize = v; return this; }
        public Builder houghRho(double v) { houghRho = v; return this; }
        public Builder houghThetaDegrees(double v) { houghThetaDegrees = v; return this; }
        public Builder houghThreshold(int v) { houghThreshold = v; return this; }
        public Builder minLineLength(int v) { minLineLength = v; return this; }
        public Builder maxLineGap(int v) { maxLineGap = v; return this; }
        public Builder mergeDistance(double v) { mergeDistance = v; return this; }
        public Builder baseConfidence(double v) { baseConfidence = v; return this; }
        public Builder axisToleranceDegrees(double v) { axisToleranceDegrees = v; return this; }
        public Builder axisAlignedBoost(double v) { axisAlignedBoost = v; return this; }
        public Builder longLineLength(double v) { longLineLength = v; return this; }
        public Builder longLineBoost(double v) { longLineBoost = v; return this; }
        public Builder maxWireThickness(double v) { maxWireThickness = v; return this; }
        public Builder minContinuity(double v) { minContinuity = v; return this; }
        public Builder wireQualityBoost(double v) { wireQualityBoost = v; return this; }
        public Builder darkPixelThreshold(int v) { darkPixelThreshold = v; return this; }
        public Builder thicknessSearchRadius(int v) { thicknessSearchRadius = v; return this; }
        public Builder thicknessSampleSpacing(int v) { thicknessSampleSpacing = v; return this; }
        public Builder continuitySampleSpacing(int v) { continuitySampleSpacing = v; return this; }
        public Builder confidenceThreshold(double v) { confidenceThreshold = v; return this; }
        public Builder pinPitch(int v) { pinPitch = v; return this; }
        public Builder proximityThreshold(double v) { proximityThreshold = v; return this; }
        public Builder shortConnectionLength(double v) { shortConnectionLength = v; return this; }
        public Builder highDegreeThreshold(int v) { highDegreeThreshold = v; return this; }

        public AnalysisConfig build() {
            if (pinPitch <= 0) {
                throw new IllegalArgumentException("pinPitch must be positive: " + pinPitch);
            }
            if (thicknessSampleSpacing <= 0 || continuitySampleSpacing <= 0) {
                throw new IllegalArgumentException("Sample spacing must be positive");
            }
            if (proximityThreshold < 0 || mergeDistance < 0) {
                throw new IllegalArgumentException("Distance thresholds must not be negative");
            }
            return new AnalysisConfig(this);
        }
    }
}
