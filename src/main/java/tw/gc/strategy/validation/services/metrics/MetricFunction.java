package tw.gc.strategy.validation.services.metrics;

/**
 * Scalar risk-adjusted metric over an array of period returns.
 *
 * <p>Implementations return {@link Double#NaN} when the metric is undefined for
 * the input (too few points, zero variance); callers treat a non-finite value as
 * a failed evaluation.
 */
@FunctionalInterface
public interface MetricFunction {

    double compute(double[] returns);
}
