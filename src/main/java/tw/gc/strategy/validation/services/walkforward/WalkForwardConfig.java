package tw.gc.strategy.validation.services.walkforward;

import tw.gc.strategy.validation.config.ValidationProperties;

/**
 * Window geometry and pass criteria of the walk-forward analysis.
 *
 * <p>All lengths are counted in observations of the return series, not calendar days.
 */
public record WalkForwardConfig(
    int trainingWindow,
    int testWindow,
    int stepSize,
    int minWindows,
    int maxWindows,
    boolean evaluateTrainingWindows,
    double minMeanMetric,
    double minWinRate,
    double minWorstMetric,
    double maxMetricStd
) {
    public WalkForwardConfig {
        if (trainingWindow < 2) {
            throw new IllegalArgumentException("trainingWindow must be >= 2, got: " + trainingWindow);
        }
        if (testWindow < 2) {
            throw new IllegalArgumentException("testWindow must be >= 2, got: " + testWindow);
        }
        if (stepSize < 1) {
            throw new IllegalArgumentException("stepSize must be >= 1, got: " + stepSize);
        }
        if (minWindows < 1) {
            throw new IllegalArgumentException("minWindows must be >= 1, got: " + minWindows);
        }
        if (maxWindows != 0 && maxWindows < minWindows) {
            throw new IllegalArgumentException("maxWindows must be 0 or >= minWindows (%d), got: %d"
                .formatted(minWindows, maxWindows));
        }
        if (minWinRate < 0 || minWinRate > 1) {
            throw new IllegalArgumentException("minWinRate must be within [0, 1], got: " + minWinRate);
        }
    }

    public static WalkForwardConfig defaults() {
        return from(new ValidationProperties.WalkForward());
    }

    public static WalkForwardConfig from(ValidationProperties.WalkForward properties) {
        return new WalkForwardConfig(
            properties.getTrainingWindow(),
            properties.getTestWindow(),
            properties.getStepSize(),
            properties.getMinWindows(),
            properties.getMaxWindows(),
            properties.isEvaluateTrainingWindows(),
            properties.getMinMeanMetric(),
            properties.getMinWinRate(),
            properties.getMinWorstMetric(),
            properties.getMaxMetricStd()
        );
    }

    /**
     * Shortest series that can host the minimum number of windows:
     * {@code train + test + (minWindows - 1) * step}.
     */
    public int minimumRequiredPeriods() {
        return trainingWindow + testWindow + (minWindows - 1) * stepSize;
    }

    /**
     * Number of evaluator calls one window costs.
     */
    public int evaluationsPerWindow() {
        return evaluateTrainingWindows ? 2 : 1;
    }

    public WalkForwardConfig withMaxWindows(int newMaxWindows) {
        return new WalkForwardConfig(trainingWindow, testWindow, stepSize, minWindows, newMaxWindows,
            evaluateTrainingWindows, minMeanMetric, minWinRate, minWorstMetric, maxMetricStd);
    }

    public WalkForwardConfig withGeometry(int newTrainingWindow, int newTestWindow, int newStepSize) {
        return new WalkForwardConfig(newTrainingWindow, newTestWindow, newStepSize, minWindows, maxWindows,
            evaluateTrainingWindows, minMeanMetric, minWinRate, minWorstMetric, maxMetricStd);
    }
}
