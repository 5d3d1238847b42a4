package com.qualitysentinel.service;

import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.Thresholds;

/**
 * Body of {@code POST /metrics}.
 *
 * <pre>
 * {"componentId":"checkout","metricName":"latency_ms","category":"performance",
 *  "baselineValue":120.0,"upperThreshold":500.0}
 * </pre>
 */
public class MetricRegistrationRequest {

    private String componentId;
    private String metricName;
    private String category;
    private Double baselineValue;
    private Double lowerThreshold;
    private Double upperThreshold;

    /**
     * @throws IllegalArgumentException if the category is missing or unknown
     */
    public RegressionCategory parsedCategory() {
        return RegressionCategory.parse(category);
    }

    /** @return the bounds, or {@code null} when neither is set */
    public Thresholds thresholds() {
        if (lowerThreshold == null && upperThreshold == null) {
            return null;
        }
        return Thresholds.of(lowerThreshold, upperThreshold);
    }

    public String getComponentId() {
        return componentId;
    }

    public void setComponentId(String componentId) {
        this.componentId = componentId;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public Double getBaselineValue() {
        return baselineValue;
    }

    public void setBaselineValue(Double baselineValue) {
        this.baselineValue = baselineValue;
    }

    public Double getLowerThreshold() {
        return lowerThreshold;
    }

    public void setLowerThreshold(Double lowerThreshold) {
        this.lowerThreshold = lowerThreshold;
    }

    public Double getUpperThreshold() {
        return upperThreshold;
    }

    public void setUpperThreshold(Double upperThreshold) {
        this.upperThreshold = upperThreshold;
    }
}
