package tw.gc.strategy.validation.services.bootstrap;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.ValidationOutcome;

/**
 * Block-bootstrap confidence interval of a strategy metric.
 *
 * @param pointEstimate metric on the original series, {@code null} when not computable
 * @param ciLower lower percentile of the resampled metrics, NaN when not computed
 * @param ciUpper upper percentile of the resampled metrics, NaN when not computed
 * @param iterations requested resamples
 * @param validIterations resamples that produced a finite metric
 * @param observations finite observations the interval is built on
 */
public record BootstrapResult(
    ValidationStatus status,
    String reason,
    Double pointEstimate,
    double ciLower,
    double ciUpper,
    double confidenceLevel,
    int iterations,
    int validIterations,
    int blockSize,
    int observations
) implements ValidationOutcome {

    public BootstrapResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    static BootstrapResult notEvaluable(ValidationStatus status, String reason, Double pointEstimate,
                                        BootstrapConfig config, int validIterations, int observations) {
        return new BootstrapResult(status, reason, pointEstimate, Double.NaN, Double.NaN,
            config.confidenceLevel(), config.iterations(), validIterations, config.blockSize(), observations);
    }

    public double ciWidth() {
        return ciUpper - ciLower;
    }

    @Override
    public Double metricValue() {
        return pointEstimate;
    }
}
