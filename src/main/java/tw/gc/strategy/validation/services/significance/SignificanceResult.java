package tw.gc.strategy.validation.services.significance;

import tw.gc.strategy.validation.enums.ThresholdMode;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.ValidationOutcome;

/**
 * Bonferroni significance verdict for a single strategy metric.
 */
public record SignificanceResult(
    ValidationStatus status,
    String reason,
    Double metric,
    int strategyCount,
    int observations,
    double adjustedAlpha,
    double threshold,
    double parametricThreshold,
    Double bootstrapThreshold,
    ThresholdMode thresholdMode
) implements ValidationOutcome {

    public SignificanceResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public boolean significant() {
        return status == ValidationStatus.PASSED;
    }

    @Override
    public Double metricValue() {
        return metric;
    }
}
