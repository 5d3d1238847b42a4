package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.Thresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.qualitysentinel.core.detection.DetectionFixtures.KEY;
import static com.qualitysentinel.core.detection.DetectionFixtures.T0;
import static com.qualitysentinel.core.detection.DetectionFixtures.metric;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThresholdDetectionTest {

    private final ThresholdDetection detection = new ThresholdDetection();
    private final Thresholds bounds = Thresholds.of(10.0, 90.0);

    @Test
    @DisplayName("Value above the upper bound should fire")
    void shouldFireAboveUpper() {
        Optional<Detection> result = detection.evaluate(context(95, 50.0));

        assertThat(result).isPresent();
        assertThat(result.get().getMethod()).isEqualTo(DetectionMethodType.THRESHOLD);
        assertThat(result.get().getCurrentValue()).isEqualTo(95.0);
        assertThat(result.get().getChangePercentage()).isCloseTo(90.0, within(1e-9));
        assertThat(result.get().getScore()).isCloseTo(0.9, within(1e-9));
        assertThat(result.get().getDescription()).contains("Upper threshold violation");
    }

    @Test
    @DisplayName("Value below the lower bound should fire")
    void shouldFireBelowLower() {
        Optional<Detection> result = detection.evaluate(context(5, 50.0));

        assertThat(result).isPresent();
        assertThat(result.get().getDescription()).contains("Lower threshold violation");
    }

    @Test
    @DisplayName("Values on the bounds are not violations")
    void shouldNotFireOnBounds() {
        assertThat(detection.evaluate(context(90, 50.0))).isEmpty();
        assertThat(detection.evaluate(context(10, 50.0))).isEmpty();
        assertThat(detection.evaluate(context(50, 50.0))).isEmpty();
    }

    @Test
    @DisplayName("Without a baseline snapshot the change and score should be zero")
    void shouldReportZeroChangeWithoutBaseline() {
        Detection result = detection.evaluate(context(95, null)).orElseThrow();

        assertThat(result.getChangePercentage()).isZero();
        assertThat(result.getScore()).isZero();
    }

    @Test
    @DisplayName("Metric without thresholds should never fire")
    void shouldIgnoreUnboundedMetric() {
        MetricSample sample = MetricSample.builder().timestamp(T0).key(KEY).value(1e9).build();

        assertThat(detection.evaluate(new DetectionContext(metric(), List.of(sample), null))).isEmpty();
        assertThat(detection.onArrival()).isTrue();
    }

    // Helpers

    private DetectionContext context(double value, Double baselineSnapshot) {
        MetricSample sample = MetricSample.builder()
                .timestamp(T0)
                .key(KEY)
                .value(value)
                .baselineSnapshot(baselineSnapshot)
                .thresholds(bounds)
                .build();
        return new DetectionContext(metric(bounds), List.of(sample), null);
    }
}
