package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Candidate causes of a regression with an overall confidence in
 * {@code [0, 1]}.
 *
 * @since 1.0.0
 */
public final class RootCauseAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> candidates;
    private final double confidence;

    public RootCauseAnalysis(List<String> candidates, double confidence) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        this.candidates = List.copyOf(candidates);
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public List<String> getCandidates() {
        return candidates;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCauseAnalysis that))
            return false;
        return Double.compare(confidence, that.confidence) == 0 && candidates.equals(that.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidates, confidence);
    }

    @Override
    public String toString() {
        return "RootCauseAnalysis{candidates=" + candidates + ", confidence=" + confidence + '}';
    }
}
