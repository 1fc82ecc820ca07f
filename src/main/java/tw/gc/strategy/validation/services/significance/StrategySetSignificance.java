package tw.gc.strategy.validation.services.significance;

import java.util.List;

/**
 * Screening of a whole strategy set against the Bonferroni threshold.
 *
 * @param estimatedFdr expected false discoveries over the significant count, 0 without discoveries
 * @param passed at least one significant strategy and an FDR below the configured maximum
 */
public record StrategySetSignificance(
    int totalStrategies,
    int significantCount,
    double threshold,
    double adjustedAlpha,
    double expectedFalseDiscoveries,
    double estimatedFdr,
    double familyWiseErrorRate,
    List<String> significantStrategies,
    boolean passed
) {
    public StrategySetSignificance {
        significantStrategies = List.copyOf(significantStrategies);
    }
}
