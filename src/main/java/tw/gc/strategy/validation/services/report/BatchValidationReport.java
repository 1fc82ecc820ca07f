package tw.gc.strategy.validation.services.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.services.significance.StrategySetSignificance;

/**
 * Reports of a batch of candidates validated in one run, with summary statistics.
 *
 * @param strategySet Bonferroni screening of the batch, {@code null} when no candidate had a metric
 */
public record BatchValidationReport(
    String runId,
    int strategyCount,
    List<CandidateValidationReport> candidates,
    StrategySetSignificance strategySet,
    long durationMs
) {
    public BatchValidationReport {
        candidates = List.copyOf(candidates);
    }

    public int totalCandidates() {
        return candidates.size();
    }

    public int passedCandidates() {
        return (int) candidates.stream().filter(CandidateValidationReport::passed).count();
    }

    public double passRate() {
        return candidates.isEmpty() ? 0.0 : (double) passedCandidates() / candidates.size();
    }

    /**
     * Number of candidates each validator passed.
     */
    public Map<ValidatorType, Integer> validatorPassCounts() {
        Map<ValidatorType, Integer> counts = new EnumMap<>(ValidatorType.class);
        for (CandidateValidationReport report : candidates) {
            report.outcomes().forEach((validator, outcome) ->
                counts.merge(validator, outcome.passed() ? 1 : 0, Integer::sum));
        }
        return counts;
    }

    /**
     * Mean candidate metric over candidates with a finite metric, {@code null} if none.
     */
    public Double meanMetric() {
        OptionalDouble mean = candidates.stream()
            .map(CandidateValidationReport::metric)
            .filter(Objects::nonNull)
            .filter(Double::isFinite)
            .mapToDouble(Double::doubleValue)
            .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }

    public List<CandidateValidationReport> passing() {
        return candidates.stream().filter(CandidateValidationReport::passed).toList();
    }

    /**
     * Returns a detailed report of the batch.
     */
    public String generateReport() {
        var sb = new StringBuilder();
        Double mean = meanMetric();
        sb.append("""
            ═══════════════════════════════════════════════════════════════
            Strategy Validation Report: run %s
            ═══════════════════════════════════════════════════════════════

            Summary:
              • Candidates:       %d (N = %d)
              • Passed:           %d (%.1f%%)
              • Mean Metric:      %s
              • Duration:         %dms

            Validator Pass Counts:
            """.formatted(
                runId,
                totalCandidates(), strategyCount,
                passedCandidates(), passRate() * 100,
                mean == null ? "n/a" : "%.3f".formatted(mean),
                durationMs));
        validatorPassCounts().forEach((validator, count) ->
            sb.append("  • %-14s %d/%d%n".formatted(validator.getCode(), count, totalCandidates())));

        if (strategySet != null) {
            sb.append("""

                Multiple Comparison:
                  • Significant:      %d/%d (threshold %.3f)
                  • Expected False:   %.2f
                  • Estimated FDR:    %.1f%%
                  • FWER:             %.4f
                """.formatted(
                    strategySet.significantCount(), strategySet.totalStrategies(), strategySet.threshold(),
                    strategySet.expectedFalseDiscoveries(), strategySet.estimatedFdr() * 100,
                    strategySet.familyWiseErrorRate()));
        }

        sb.append("\nCandidates:\n");
        for (CandidateValidationReport report : candidates) {
            sb.append("  ").append(report.passed() ? "✅ " : "❌ ").append(report.strategyId());
            if (!report.passed()) {
                sb.append(" failing: ").append(report.failingValidators().stream()
                    .map(ValidatorType::getCode).toList());
            }
            sb.append('\n');
        }
        sb.append("═══════════════════════════════════════════════════════════════\n");
        return sb.toString();
    }
}
