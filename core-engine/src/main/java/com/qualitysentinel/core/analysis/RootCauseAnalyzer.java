package com.qualitysentinel.core.analysis;

import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.RootCauseAnalysis;
import com.qualitysentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rule-based root-cause candidates and recommended actions.
 *
 * <p>
 * Both tables are deterministic: the same inputs always yield the same lists
 * in the same order. Confidence is fixed at {@link #BASE_CONFIDENCE}, raised
 * to {@link #HIGH_CONFIDENCE} when the value moved by more than half of a
 * non-zero baseline.
 * </p>
 *
 * @since 1.0.0
 */
public final class RootCauseAnalyzer {

    static final double BASE_CONFIDENCE = 0.5;
    static final double HIGH_CONFIDENCE = 0.8;
    static final String CATASTROPHIC_CAUSE = "Catastrophic failure or major system change";

    private static final Map<RegressionCategory, List<String>> CAUSES = new EnumMap<>(RegressionCategory.class);
    private static final Map<RegressionCategory, List<String>> ACTIONS = new EnumMap<>(RegressionCategory.class);

    private static final List<String> CRITICAL_ACTIONS = List.of(
            "IMMEDIATE ACTION REQUIRED",
            "Consider rolling back recent changes",
            "Activate incident response procedures",
            "Notify stakeholders immediately");

    private static final List<String> MAJOR_ACTIONS = List.of(
            "High priority investigation required",
            "Review recent deployments and changes",
            "Consider temporary mitigation measures");

    private static final List<String> CLOSING_ACTIONS = List.of(
            "Document the regression for future reference",
            "Monitor closely for further degradation",
            "Update alerting thresholds if necessary");

    static {
        CAUSES.put(RegressionCategory.PERFORMANCE, List.of(
                "Increased system load",
                "Resource contention",
                "Algorithm inefficiency",
                "Network latency",
                "Database performance issues"));
        CAUSES.put(RegressionCategory.ACCURACY, List.of(
                "Model drift",
                "Data quality issues",
                "Feature distribution changes",
                "Training data staleness",
                "Hyperparameter degradation"));
        CAUSES.put(RegressionCategory.RELIABILITY, List.of(
                "System instability",
                "Hardware failures",
                "Software bugs",
                "Configuration changes",
                "External dependencies"));
        CAUSES.put(RegressionCategory.EFFICIENCY, List.of(
                "Memory leaks or unbounded caches",
                "Inefficient resource allocation",
                "Increased input volume",
                "Suboptimal batching or concurrency settings"));
        CAUSES.put(RegressionCategory.QUALITY, List.of(
                "Upstream data quality degradation",
                "Validation rules bypassed or relaxed",
                "Recent code changes",
                "Dependency version changes"));
        CAUSES.put(RegressionCategory.STABILITY, List.of(
                "Intermittent infrastructure faults",
                "Race conditions under load",
                "Retry storms or cascading failures",
                "Configuration drift between instances"));

        ACTIONS.put(RegressionCategory.PERFORMANCE, List.of(
                "Review system resource utilization",
                "Check for performance bottlenecks",
                "Analyze recent code changes for inefficiencies",
                "Consider performance optimization strategies"));
        ACTIONS.put(RegressionCategory.ACCURACY, List.of(
                "Validate input data quality",
                "Check for model drift",
                "Review feature engineering pipeline",
                "Consider model retraining"));
        ACTIONS.put(RegressionCategory.RELIABILITY, List.of(
                "Check system health and error logs",
                "Verify external dependencies",
                "Review recent configuration changes",
                "Implement additional monitoring"));
        ACTIONS.put(RegressionCategory.EFFICIENCY, List.of(
                "Profile memory and CPU consumption",
                "Review resource limits and allocation",
                "Check for leaked connections or handles",
                "Tune batching and concurrency settings"));
        ACTIONS.put(RegressionCategory.QUALITY, List.of(
                "Audit upstream data sources",
                "Review validation and quality gates",
                "Compare outputs against a known-good release",
                "Add regression tests for the affected path"));
        ACTIONS.put(RegressionCategory.STABILITY, List.of(
                "Correlate failures with infrastructure events",
                "Review retry and timeout policies",
                "Check for configuration drift across instances",
                "Run targeted load tests"));
    }

    /**
     * @param category     category of the regressed metric
     * @param currentValue observed value
     * @param baseline     reference value
     * @return ranked candidate causes with a confidence in {@code [0, 1]}
     */
    public RootCauseAnalysis analyze(RegressionCategory category, double currentValue, double baseline) {
        Objects.requireNonNull(category, "category must not be null");
        List<String> candidates = new ArrayList<>(CAUSES.get(category));
        double confidence = BASE_CONFIDENCE;
        if (baseline != 0.0 && Math.abs(currentValue - baseline) > 0.5 * Math.abs(baseline)) {
            candidates.add(CATASTROPHIC_CAUSE);
            confidence = HIGH_CONFIDENCE;
        }
        return new RootCauseAnalysis(candidates, confidence);
    }

    /**
     * Severity boilerplate first, then category-specific actions, then
     * closing actions.
     */
    public List<String> recommend(RegressionCategory category, Severity severity) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        List<String> actions = new ArrayList<>();
        if (severity == Severity.CRITICAL) {
            actions.addAll(CRITICAL_ACTIONS);
        } else if (severity == Severity.MAJOR) {
            actions.addAll(MAJOR_ACTIONS);
        }
        actions.addAll(ACTIONS.get(category));
        actions.addAll(CLOSING_ACTIONS);
        return List.copyOf(actions);
    }
}
