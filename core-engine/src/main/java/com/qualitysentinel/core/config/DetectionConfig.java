package com.qualitysentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine's YAML configuration. Every tunable constant
 * of the engine lives here.
 *
 * <p>
 * Expected YAML structure (all keys optional, defaults shown):
 * </p>
 *
 * <pre>
 * detectionIntervalSeconds: 300
 * detectionWindowSeconds: 1800
 * maxSamplesPerComponent: 1000
 * minSamplesPerMetric: 3
 * errorBackoffSeconds: 5
 * retentionHours: 168
 * recurrenceWindowSeconds: 1800
 * defaultReportHours: 24
 * severity: { ... }
 * methods: { ... }
 * immediateCheck: { ... }
 * baseline: { ... }
 * alerting: { ... }
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value is legal.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private long detectionIntervalSeconds = 300;
    private long detectionWindowSeconds = 1_800;
    private int maxSamplesPerComponent = 1_000;
    private int minSamplesPerMetric = 3;
    private long errorBackoffSeconds = 5;
    private long retentionHours = 168;
    private long recurrenceWindowSeconds = 1_800;
    private long defaultReportHours = 24;

    private SeveritySettings severity = new SeveritySettings();
    private MethodsConfig methods = new MethodsConfig();
    private ImmediateCheckSettings immediateCheck = new ImmediateCheckSettings();
    private BaselineSettings baseline = new BaselineSettings();
    private AlertingSettings alerting = new AlertingSettings();

    /** @return a configuration holding every default */
    public static DetectionConfig defaults() {
        return new DetectionConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section. Collects all errors and throws a single
     * exception if any value is illegal.
     *
     * @return this configuration, for chaining
     * @throws IllegalStateException if one or more values are invalid
     */
    public DetectionConfig validate() {
        List<String> errors = new ArrayList<>();

        if (detectionIntervalSeconds <= 0) {
            errors.add("detectionIntervalSeconds must be > 0, got: " + detectionIntervalSeconds);
        }
        if (detectionWindowSeconds <= 0) {
            errors.add("detectionWindowSeconds must be > 0, got: " + detectionWindowSeconds);
        }
        if (maxSamplesPerComponent < 1) {
            errors.add("maxSamplesPerComponent must be >= 1, got: " + maxSamplesPerComponent);
        }
        if (minSamplesPerMetric < 1) {
            errors.add("minSamplesPerMetric must be >= 1, got: " + minSamplesPerMetric);
        }
        if (errorBackoffSeconds <= 0) {
            errors.add("errorBackoffSeconds must be > 0, got: " + errorBackoffSeconds);
        }
        if (retentionHours <= 0) {
            errors.add("retentionHours must be > 0, got: " + retentionHours);
        }
        if (recurrenceWindowSeconds < 0) {
            errors.add("recurrenceWindowSeconds must be >= 0, got: " + recurrenceWindowSeconds);
        }
        if (defaultReportHours <= 0) {
            errors.add("defaultReportHours must be > 0, got: " + defaultReportHours);
        }

        severity.validate(errors);
        methods.validate(errors);
        immediateCheck.validate(errors);
        baseline.validate(errors);
        alerting.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
        return this;
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public Duration detectionInterval() {
        return Duration.ofSeconds(detectionIntervalSeconds);
    }

    public Duration detectionWindow() {
        return Duration.ofSeconds(detectionWindowSeconds);
    }

    public Duration errorBackoff() {
        return Duration.ofSeconds(errorBackoffSeconds);
    }

    public Duration retention() {
        return Duration.ofHours(retentionHours);
    }

    public Duration recurrenceWindow() {
        return Duration.ofSeconds(recurrenceWindowSeconds);
    }

    public Duration defaultReportPeriod() {
        return Duration.ofHours(defaultReportHours);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public long getDetectionIntervalSeconds() {
        return detectionIntervalSeconds;
    }

    public void setDetectionIntervalSeconds(long detectionIntervalSeconds) {
        this.detectionIntervalSeconds = detectionIntervalSeconds;
    }

    public long getDetectionWindowSeconds() {
        return detectionWindowSeconds;
    }

    public void setDetectionWindowSeconds(long detectionWindowSeconds) {
        this.detectionWindowSeconds = detectionWindowSeconds;
    }

    public int getMaxSamplesPerComponent() {
        return maxSamplesPerComponent;
    }

    public void setMaxSamplesPerComponent(int maxSamplesPerComponent) {
        this.maxSamplesPerComponent = maxSamplesPerComponent;
    }

    public int getMinSamplesPerMetric() {
        return minSamplesPerMetric;
    }

    public void setMinSamplesPerMetric(int minSamplesPerMetric) {
        this.minSamplesPerMetric = minSamplesPerMetric;
    }

    public long getErrorBackoffSeconds() {
        return errorBackoffSeconds;
    }

    public void setErrorBackoffSeconds(long errorBackoffSeconds) {
        this.errorBackoffSeconds = errorBackoffSeconds;
    }

    public long getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    public long getRecurrenceWindowSeconds() {
        return recurrenceWindowSeconds;
    }

    public void setRecurrenceWindowSeconds(long recurrenceWindowSeconds) {
        this.recurrenceWindowSeconds = recurrenceWindowSeconds;
    }

    public long getDefaultReportHours() {
        return defaultReportHours;
    }

    public void setDefaultReportHours(long defaultReportHours) {
        this.defaultReportHours = defaultReportHours;
    }

    public SeveritySettings getSeverity() {
        return severity;
    }

    public void setSeverity(SeveritySettings severity) {
        this.severity = severity != null ? severity : new SeveritySettings();
    }

    public MethodsConfig getMethods() {
        return methods;
    }

    public void setMethods(MethodsConfig methods) {
        this.methods = methods != null ? methods : new MethodsConfig();
    }

    public ImmediateCheckSettings getImmediateCheck() {
        return immediateCheck;
    }

    public void setImmediateCheck(ImmediateCheckSettings immediateCheck) {
        this.immediateCheck = immediateCheck != null ? immediateCheck : new ImmediateCheckSettings();
    }

    public BaselineSettings getBaseline() {
        return baseline;
    }

    public void setBaseline(BaselineSettings baseline) {
        this.baseline = baseline != null ? baseline : new BaselineSettings();
    }

    public AlertingSettings getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertingSettings alerting) {
        this.alerting = alerting != null ? alerting : new AlertingSettings();
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "detectionIntervalSeconds=" + detectionIntervalSeconds +
                ", detectionWindowSeconds=" + detectionWindowSeconds +
                ", maxSamplesPerComponent=" + maxSamplesPerComponent +
                ", minSamplesPerMetric=" + minSamplesPerMetric +
                ", retentionHours=" + retentionHours +
                ", severity=" + severity +
                ", methods=" + methods +
                ", baseline=" + baseline +
                ", alerting=" + alerting +
                '}';
    }
}
