package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.MethodsConfig;
import com.qualitysentinel.core.model.DetectionMethodType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link DetectionMethod} instances from
 * {@link MethodsConfig}.
 *
 * <p>
 * This is the single point of extension when adding a detection method:
 * add its type and settings, then map the type to an implementation here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionMethodFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionMethodFactory.class);

    private DetectionMethodFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the method for one type, using that type's settings.
     *
     * @param type   the method; must not be {@code null}
     * @param config method settings; must not be {@code null}
     * @return the detection method
     */
    public static DetectionMethod create(DetectionMethodType type, MethodsConfig config) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "MethodsConfig must not be null");
        return switch (type) {
            case THRESHOLD -> new ThresholdDetection();
            case STATISTICAL -> new StatisticalDetection(config.getStatistical());
            case TREND -> new TrendDetection(config.getTrend());
            case CHANGE_POINT -> new ChangePointDetection(config.getChangePoint());
            case ANOMALY -> new AnomalyDetection(config.getAnomaly());
        };
    }

    /**
     * Create every enabled method, in {@link DetectionMethodType} order.
     *
     * @param config method settings; must not be {@code null}
     * @return unmodifiable list of detection methods
     */
    public static List<DetectionMethod> createEnabled(MethodsConfig config) {
        Objects.requireNonNull(config, "MethodsConfig must not be null");
        List<DetectionMethod> methods = new ArrayList<>();
        for (DetectionMethodType type : config.enabledMethods()) {
            methods.add(create(type, config));
        }
        LOG.info("Created {} detection method(s): {}", methods.size(), config.enabledMethods());
        return Collections.unmodifiableList(methods);
    }
}
