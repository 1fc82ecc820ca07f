package tw.gc.strategy.validation.services.walkforward;

import tw.gc.strategy.validation.enums.ValidationStatus;

/**
 * Outcome of evaluating a single walk-forward window.
 *
 * @param window the evaluated window
 * @param testMetric out-of-sample metric, {@code null} when the evaluation failed
 * @param trainMetric in-sample metric, {@code null} when not requested or not available
 * @param errorStatus why the window failed, {@code null} on success
 * @param error failure message, {@code null} on success
 */
public record WindowEvaluation(
    WalkForwardWindow window,
    Double testMetric,
    Double trainMetric,
    ValidationStatus errorStatus,
    String error
) {
    public WindowEvaluation {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        if (testMetric == null && errorStatus == null) {
            throw new IllegalArgumentException("a window without test metric needs an error status");
        }
    }

    public static WindowEvaluation success(WalkForwardWindow window, double testMetric, Double trainMetric) {
        return new WindowEvaluation(window, testMetric, trainMetric, null, null);
    }

    public static WindowEvaluation failure(WalkForwardWindow window, ValidationStatus status, String error) {
        return new WindowEvaluation(window, null, null, status, error);
    }

    public boolean succeeded() {
        return testMetric != null;
    }

    /**
     * In-sample over out-of-sample metric. Above 2.0 usually means the training
     * period flatters the strategy.
     *
     * @return IS/OOS ratio, {@code POSITIVE_INFINITY} when OOS is not positive, NaN without IS metric
     */
    public double isOosRatio() {
        if (trainMetric == null || testMetric == null) {
            return Double.NaN;
        }
        if (testMetric <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return trainMetric / testMetric;
    }

    /**
     * Robustness score (0-100) of the out-of-sample metric relative to in-sample.
     *
     * <ul>
     *   <li>100 = OOS equals or exceeds IS</li>
     *   <li>60-80 = OOS degradation 20-40%</li>
     *   <li>&lt; 40 = severe degradation</li>
     * </ul>
     *
     * @return score, NaN without IS metric
     */
    public double robustnessScore() {
        if (trainMetric == null || testMetric == null) {
            return Double.NaN;
        }
        if (trainMetric <= 0) {
            return testMetric > 0 ? 50.0 : 0.0;
        }
        return Math.max(0, Math.min(100, testMetric / trainMetric * 100));
    }
}
