package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.MethodsConfig;
import com.qualitysentinel.core.model.DetectionMethodType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.qualitysentinel.core.detection.DetectionFixtures.baseline;
import static com.qualitysentinel.core.detection.DetectionFixtures.concat;
import static com.qualitysentinel.core.detection.DetectionFixtures.context;
import static com.qualitysentinel.core.detection.DetectionFixtures.repeat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectionTest {

    private final AnomalyDetection detection = new AnomalyDetection(new MethodsConfig.Anomaly());

    @Test
    @DisplayName("Last three samples all beyond 2.5 sigma should fire with score 1.0")
    void shouldFireWhenAllRecentAreOutliers() {
        // mean 110, population stdev 30, z(200) = 3.0
        double[] series = concat(repeat(100, 27), repeat(200, 3));

        Detection result = detection.evaluate(context(baseline(100), series)).orElseThrow();

        assertThat(result.getMethod()).isEqualTo(DetectionMethodType.ANOMALY);
        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getCurrentValue()).isEqualTo(200.0);
        assertThat(result.getChangePercentage()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Without a baseline the window mean is reported and change is zero")
    void shouldUseWindowMeanWithoutBaseline() {
        Detection result = detection.evaluate(context(null, concat(repeat(100, 27), repeat(200, 3))))
                .orElseThrow();

        assertThat(result.getBaselineValue()).isCloseTo(110.0, within(1e-9));
        assertThat(result.getChangePercentage()).isZero();
    }

    @Test
    @DisplayName("A single outlier among the last three should not fire")
    void shouldNotFireOnSingleOutlier() {
        assertThat(detection.evaluate(context(baseline(100), concat(repeat(100, 29), new double[]{200}))))
                .isEmpty();
    }

    @Test
    @DisplayName("No outliers or constant window should not fire")
    void shouldNotFireWithoutOutliers() {
        assertThat(detection.evaluate(context(baseline(100), 99, 101, 100, 98, 102, 100, 99, 101))).isEmpty();
        assertThat(detection.evaluate(context(baseline(100), repeat(100, 10)))).isEmpty();
    }
}
