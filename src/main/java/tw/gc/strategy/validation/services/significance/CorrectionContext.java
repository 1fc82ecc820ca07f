package tw.gc.strategy.validation.services.significance;

import tw.gc.strategy.validation.enums.ThresholdMode;

/**
 * Bonferroni correction for one family of N tests over T observations.
 *
 * @param strategyCount number of strategies tested (N)
 * @param alpha family-wise significance level
 * @param adjustedAlpha {@code alpha / N}
 * @param observations observation count T the threshold is computed for
 * @param parametricThreshold z(1 - adjustedAlpha / 2) / sqrt(T), not floored
 * @param bootstrapThreshold bootstrap-derived threshold, {@code null} unless computed
 * @param conservativeFloor minimum threshold ever applied
 * @param thresholdMode which threshold {@link #threshold()} applies
 */
public record CorrectionContext(
    int strategyCount,
    double alpha,
    double adjustedAlpha,
    int observations,
    double parametricThreshold,
    BootstrapThreshold bootstrapThreshold,
    double conservativeFloor,
    ThresholdMode thresholdMode
) {
    public CorrectionContext {
        if (strategyCount < 1) {
            throw new IllegalArgumentException("strategyCount must be >= 1, got: " + strategyCount);
        }
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be within (0, 1), got: " + alpha);
        }
        if (observations < 1) {
            throw new IllegalArgumentException("observations must be >= 1, got: " + observations);
        }
        if (thresholdMode == ThresholdMode.BOOTSTRAP && bootstrapThreshold == null) {
            throw new IllegalArgumentException("BOOTSTRAP mode requires a bootstrap threshold");
        }
    }

    /**
     * Threshold a metric must strictly exceed: the chosen threshold, floored.
     */
    public double threshold() {
        double chosen = thresholdMode == ThresholdMode.BOOTSTRAP
            ? bootstrapThreshold.threshold()
            : parametricThreshold;
        return Math.max(conservativeFloor, chosen);
    }

    /**
     * Parametric threshold floored at the conservative minimum.
     */
    public double conservativeParametricThreshold() {
        return Math.max(conservativeFloor, parametricThreshold);
    }

    /**
     * Exact family-wise error rate {@code 1 - (1 - adjustedAlpha)^N}, never above alpha.
     */
    public double familyWiseErrorRate() {
        return 1.0 - Math.pow(1.0 - adjustedAlpha, strategyCount);
    }

    /**
     * Expected number of false discoveries among N null strategies.
     */
    public double expectedFalseDiscoveries() {
        return adjustedAlpha * strategyCount;
    }
}
