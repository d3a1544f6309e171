package com.ttennebkram.schematic.processing;

import com.ttennebkram.schematic.config.AnalysisConfig;
import com.ttennebkram.schematic.model.RawSegment;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineSegmentExtractorTest {

    private final LineSegmentExtractor extractor = new LineSegmentExtractor(AnalysisConfig.defaults());

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    private static Mat whiteCanvas() {
        return new Mat(400, 600, CvType.CV_8UC3, new Scalar(255, 255, 255));
    }

    @Test
    void shouldFindDrawnHorizontalWire() {
        Mat image = whiteCanvas();
        try {
            Imgproc.line(image, new Point(100, 200), new Point(300, 200), new Scalar(0, 0, 0), 3);

            List<RawSegment> segments = extractor.extract(image);

            assertThat(segments).isNotEmpty();
            assertThat(segments).anySatisfy(s -> {
                assertThat(s.length()).isGreaterThan(100.0);
                assertThat(Math.abs(s.getP2().y - s.getP1().y)).isLessThanOrEqualTo(3);
                assertThat(s.getP1().y).isBetween(195, 205);
            });
        } finally {
            image.release();
        }
    }

    @Test
    void shouldReturnNothingForBlankImage() {
        Mat image = whiteCanvas();
        try {
            assertThat(extractor.extract(image)).isEmpty();
        } finally {
            image.release();
        }
    }

    @Test
    void shouldNotModifyInputImage() {
        Mat image = whiteCanvas();
        try {
            Imgproc.line(image, new Point(100, 200), new Point(300, 200), new Scalar(0, 0, 0), 3);
            Mat before = image.clone();

            extractor.extract(image);

            Mat diff = new Mat();
            Core.absdiff(image, before, diff);
            Mat gray = new Mat();
            Imgproc.cvtColor(diff, gray, Imgproc.COLOR_BGR2GRAY);
            assertThat(Core.countNonZero(gray)).isZero();

            before.release();
            diff.release();
            gray.release();
        } finally {
            image.release();
        }
    }

    @Test
    void shouldTreatEmptyMatAsNoGeometry() {
        assertThat(extractor.extract(new Mat())).isEmpty();
    }

    @Test
    void preprocessShouldProduceSingleChannelEdgeMap() {
        Mat image = whiteCanvas();
        Mat edges = extractor.preprocess(image);
        try {
            assertThat(edges.channels()).isEqualTo(1);
            assertThat(edges.size()).isEqualTo(image.size());
        } finally {
            edges.release();
            image.release();
        }
    }
}
