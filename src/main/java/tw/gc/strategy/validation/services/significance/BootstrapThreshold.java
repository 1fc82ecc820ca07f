package tw.gc.strategy.validation.services.significance;

/**
 * Significance threshold estimated by block-bootstrapping simulated null returns,
 * next to the parametric one for comparison.
 *
 * @param threshold (1 - adjusted alpha) percentile of the null Sharpe distribution
 * @param parametricThreshold z(1 - adjusted alpha / 2) / sqrt(T), not floored
 * @param difference {@code threshold - parametricThreshold}
 * @param percentDifference difference relative to the parametric threshold, in percent
 * @param validSamples resamples with a finite Sharpe
 * @param iterations requested resamples
 * @param divergent true when |percentDifference| exceeds the warning level
 */
public record BootstrapThreshold(
    double threshold,
    double parametricThreshold,
    double difference,
    double percentDifference,
    int validSamples,
    int iterations,
    boolean divergent
) {
}
