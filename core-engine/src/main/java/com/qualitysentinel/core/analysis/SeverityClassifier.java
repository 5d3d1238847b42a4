package com.qualitysentinel.core.analysis;

import com.qualitysentinel.core.config.SeveritySettings;
import com.qualitysentinel.core.model.Severity;

import java.util.Objects;

/**
 * Maps a percentage change to a {@link Severity}.
 *
 * <p>
 * Classification is on {@code |changePct|} against ascending boundaries,
 * inclusive at each boundary: a change exactly equal to the major boundary is
 * {@code MAJOR}. Anything below the moderate boundary is {@code MINOR}, so the
 * mapping is monotonic over the whole range.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    private final double moderate;
    private final double major;
    private final double critical;

    public SeverityClassifier(SeveritySettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.moderate = settings.getModerate();
        this.major = settings.getMajor();
        this.critical = settings.getCritical();
    }

    /**
     * @param changePct signed percentage change; a non-finite value is MINOR
     * @return the severity tier
     */
    public Severity classify(double changePct) {
        if (!Double.isFinite(changePct)) {
            return Severity.MINOR;
        }
        double magnitude = Math.abs(changePct);
        if (magnitude >= critical) {
            return Severity.CRITICAL;
        }
        if (magnitude >= major) {
            return Severity.MAJOR;
        }
        if (magnitude >= moderate) {
            return Severity.MODERATE;
        }
        return Severity.MINOR;
    }
}
