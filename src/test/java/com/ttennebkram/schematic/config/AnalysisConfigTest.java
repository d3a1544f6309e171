package com.ttennebkram.schematic.config;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisConfigTest {

    @Test
    void shouldExposeDocumentedDefaults() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.getAdaptiveBlockSize()).isEqualTo(11);
        assertThat(config.getCannyThreshold1()).isEqualTo(50);
        assertThat(config.getCannyThreshold2()).isEqualTo(150);
        assertThat(config.getHoughThreshold()).isEqualTo(50);
        assertThat(config.getMinLineLength()).isEqualTo(20);
        assertThat(config.getMaxLineGap()).isEqualTo(5);
        assertThat(config.getMergeDistance()).isEqualTo(10.0);
        assertThat(config.getBaseConfidence()).isEqualTo(0.7);
        assertThat(config.getProximityThreshold()).isEqualTo(25.0);
        assertThat(config.getPinPitch()).isEqualTo(20);
        assertThat(config.getConfidenceThreshold()).isEqualTo(0.6);
        assertThat(config.getHighDegreeThreshold()).isEqualTo(4);
    }

    @Test
    void shouldLoadPackagedDefaultsIdenticalToBuiltIns() throws IOException {
        AnalysisConfig packaged = AnalysisConfig.loadDefaults();

        assertThat(packaged.toJson()).isEqualTo(AnalysisConfig.defaults().toJson());
    }

    @Test
    void shouldKeepDefaultsForMissingKeys() {
        JsonObject json = new JsonObject();
        json.addProperty("proximityThreshold", 40.0);
        json.addProperty("pinPitch", 15);

        AnalysisConfig config = AnalysisConfig.fromJson(json);

        assertThat(config.getProximityThreshold()).isEqualTo(40.0);
        assertThat(config.getPinPitch()).isEqualTo(15);
        assertThat(config.getMergeDistance()).isEqualTo(10.0);
        assertThat(config.getHoughThreshold()).isEqualTo(50);
    }

    @Test
    void shouldSurviveJsonRoundTrip() {
        AnalysisConfig original = AnalysisConfig.builder()
            .mergeDistance(7.5)
            .highDegreeThreshold(6)
            .build();

        AnalysisConfig copy = AnalysisConfig.fromJson(original.toJson());

        assertThat(copy.getMergeDistance()).isEqualTo(7.5);
        assertThat(copy.getHighDegreeThreshold()).isEqualTo(6);
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> AnalysisConfig.load(new StringReader("{ not json")))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> AnalysisConfig.load(new StringReader("[1, 2]")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("not a JSON object");
    }

    @Test
    void shouldRejectNonPositivePinPitch() {
        assertThatThrownBy(() -> AnalysisConfig.builder().pinPitch(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
