package com.ttennebkram.schematic.processing;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.ClassifiedConnection;
import com.ttennebkram.schematic.model.ConnectionKind;
import com.ttennebkram.schematic.model.RawSegment;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConnectionClassifierTest {

    private static final int WIDTH = 200;
    private static final int HEIGHT = 100;

    private final ConnectionClassifier classifier = new ConnectionClassifier(AnalysisConfig.defaults());

    /** White canvas with a 3px black horizontal stroke on rows 49..51, x 20..180. */
    private static GrayRaster rasterWithHorizontalStroke() {
        byte[] pixels = new byte[WIDTH * HEIGHT];
        Arrays.fill(pixels, (byte) 0xFF);
        for (int y = 49; y <= 51; y++) {
            for (int x = 20; x <= 180; x++) {
                pixels[y * WIDTH + x] = 0;
            }
        }
        return new GrayRaster(WIDTH, HEIGHT, pixels);
    }

    private static GrayRaster blankRaster() {
        byte[] pixels = new byte[WIDTH * HEIGHT];
        Arrays.fill(pixels, (byte) 0xFF);
        return new GrayRaster(WIDTH, HEIGHT, pixels);
    }

    @Test
    void shouldGiveFullConfidenceToCleanHorizontalWire() {
        ClassifiedConnection conn = classifier.classify("conn_0", new RawSegment(20, 50, 180, 50),
            rasterWithHorizontalStroke());

        assertThat(conn.getKind()).isEqualTo(ConnectionKind.WIRE);
        assertThat(conn.getThicknessPx()).isEqualTo(2.0);
        assertThat(conn.getContinuityRatio()).isEqualTo(1.0);
        assertThat(conn.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(conn.getLength()).isEqualTo(160.0);
    }

    @Test
    void shouldKeepBaseConfidenceForShortDiagonalOnBlankImage() {
        ClassifiedConnection conn = classifier.classify("conn_0", new RawSegment(10, 10, 30, 25), blankRaster());

        assertThat(conn.getContinuityRatio()).isEqualTo(0.0);
        assertThat(conn.getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(conn.isReliable(0.6)).isTrue();
    }

    @Test
    void shouldRewardGeometryEvenWithoutInk() {
        ClassifiedConnection conn = classifier.classify("conn_0", new RawSegment(20, 50, 180, 50), blankRaster());

        // axis-aligned and long, but no stroke under it
        assertThat(conn.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(conn.getContinuityRatio()).isEqualTo(0.0);
    }

    @Test
    void shouldNumberConnectionsInInputOrder() {
        List<ClassifiedConnection> result = classifier.classify(Arrays.asList(
            new RawSegment(20, 50, 180, 50),
            new RawSegment(10, 10, 30, 25)), blankRaster());

        assertThat(result).extracting(ClassifiedConnection::getId).containsExactly("conn_0", "conn_1");
    }

    @Test
    void shouldTreatBothDirectionsOfEachAxisAsAligned() {
        assertThat(classifier.isAxisAligned(0)).isTrue();
        assertThat(classifier.isAxisAligned(-90)).isTrue();
        assertThat(classifier.isAxisAligned(175)).isTrue();
        assertThat(classifier.isAxisAligned(-170)).isTrue();
        assertThat(classifier.isAxisAligned(45)).isFalse();
    }

    @Test
    void shouldNotReadPastImageEdges() {
        GrayRaster tiny = new GrayRaster(0, 0, new byte[0]);

        ClassifiedConnection conn = classifier.classify("conn_0", new RawSegment(0, 0, 50, 0), tiny);

        assertThat(conn.getThicknessPx()).isEqualTo(1.0);
        assertThat(conn.getContinuityRatio()).isEqualTo(0.0);
    }
}
