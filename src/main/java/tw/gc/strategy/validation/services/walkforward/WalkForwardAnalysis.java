package tw.gc.strategy.validation.services.walkforward;

import java.util.List;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.ValidationOutcome;

/**
 * Aggregate of a walk-forward analysis across all windows.
 *
 * <p>Aggregates are computed over successful windows only and are NaN when the
 * analysis never got that far.
 */
public record WalkForwardAnalysis(
    ValidationStatus status,
    String reason,
    List<WindowEvaluation> windows,
    int stepSize,
    int successfulWindows,
    double meanMetric,
    double stdMetric,
    double winRate,
    double worstMetric,
    double bestMetric,
    double avgRobustnessScore
) implements ValidationOutcome {

    public WalkForwardAnalysis {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        windows = List.copyOf(windows);
    }

    /**
     * Analysis that stopped before any aggregate could be computed.
     */
    public static WalkForwardAnalysis notEvaluable(ValidationStatus status, String reason,
                                                   List<WindowEvaluation> windows, int stepSize) {
        int successful = (int) windows.stream().filter(WindowEvaluation::succeeded).count();
        return new WalkForwardAnalysis(status, reason, windows, stepSize, successful,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    public int totalWindows() {
        return windows.size();
    }

    @Override
    public Double metricValue() {
        return Double.isFinite(meanMetric) ? meanMetric : null;
    }

    /**
     * Returns a detailed report of the analysis.
     */
    public String generateReport() {
        var sb = new StringBuilder();
        sb.append("""
            ═══════════════════════════════════════════════════════════════
            Walk-Forward Analysis Report
            ═══════════════════════════════════════════════════════════════

            Summary:
              • Status:             %s
              • Windows:            %d generated, %d successful (step %d)
              • Reason:             %s

            Out-of-Sample Metrics:
              • Mean:               %.3f
              • Std:                %.3f
              • Win Rate:           %.1f%%
              • Worst / Best:       %.3f / %.3f
              • Avg Robustness:     %s

            Windows:
            """.formatted(
                status,
                totalWindows(), successfulWindows, stepSize,
                reason,
                meanMetric,
                stdMetric,
                winRate * 100,
                worstMetric, bestMetric,
                Double.isNaN(avgRobustnessScore) ? "n/a" : "%.1f/100".formatted(avgRobustnessScore)
            ));

        for (WindowEvaluation window : windows) {
            sb.append("  ").append(window.succeeded() ? "✅ " : "❌ ")
                .append(window.window().describe())
                .append(window.succeeded()
                    ? " → %.3f".formatted(window.testMetric())
                    : " → %s".formatted(window.error()))
                .append('\n');
        }
        sb.append("═══════════════════════════════════════════════════════════════\n");
        return sb.toString();
    }
}
