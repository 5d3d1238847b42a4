package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.MethodsConfig;
import com.qualitysentinel.core.model.DetectionMethodType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionMethodFactoryTest {

    @Test
    @DisplayName("Should create the matching implementation for every type")
    void shouldCreateEveryType() {
        MethodsConfig config = new MethodsConfig();

        assertThat(DetectionMethodFactory.create(DetectionMethodType.THRESHOLD, config))
                .isInstanceOf(ThresholdDetection.class);
        assertThat(DetectionMethodFactory.create(DetectionMethodType.STATISTICAL, config))
                .isInstanceOf(StatisticalDetection.class);
        assertThat(DetectionMethodFactory.create(DetectionMethodType.TREND, config))
                .isInstanceOf(TrendDetection.class);
        assertThat(DetectionMethodFactory.create(DetectionMethodType.CHANGE_POINT, config))
                .isInstanceOf(ChangePointDetection.class);
        assertThat(DetectionMethodFactory.create(DetectionMethodType.ANOMALY, config))
                .isInstanceOf(AnomalyDetection.class);
    }

    @Test
    @DisplayName("Should skip disabled methods and return an unmodifiable list")
    void shouldCreateOnlyEnabled() {
        MethodsConfig config = new MethodsConfig();
        config.getTrend().setEnabled(false);
        config.getAnomaly().setEnabled(false);

        List<DetectionMethod> methods = DetectionMethodFactory.createEnabled(config);

        assertThat(methods).extracting(DetectionMethod::type)
                .containsExactly(DetectionMethodType.THRESHOLD, DetectionMethodType.STATISTICAL,
                        DetectionMethodType.CHANGE_POINT);
        assertThatThrownBy(() -> methods.add(new ThresholdDetection()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject a null type")
    void shouldRejectNullType() {
        assertThatThrownBy(() -> DetectionMethodFactory.create(null, new MethodsConfig()))
                .isInstanceOf(NullPointerException.class);
    }
}
