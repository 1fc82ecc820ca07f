package tw.gc.strategy.validation.services.significance;

/**
 * Point estimate and bootstrap CI lower bound checked against the same threshold.
 *
 * @param significant both the point estimate and the lower bound clear the threshold
 */
public record CombinedSignificance(
    double pointEstimate,
    double ciLower,
    double threshold,
    boolean pointSignificant,
    boolean lowerBoundSignificant,
    boolean significant
) {
}
