package tw.gc.strategy.validation.model;

import tw.gc.strategy.validation.services.metrics.PeriodEvaluator;

/**
 * A strategy to validate, as handed over by the backtest collaborator.
 *
 * @param id identifier used in logs and reports
 * @param returns full backtest return series
 * @param evaluator period callback; {@code null} means periods are evaluated on {@code returns}
 * @param reportedMetric metric reported by the backtest engine; {@code null} means it is
 *        computed from {@code returns}
 */
public record StrategyCandidate(
    String id,
    ReturnSeries returns,
    PeriodEvaluator evaluator,
    Double reportedMetric
) {
    public StrategyCandidate {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (returns == null) {
            throw new IllegalArgumentException("returns cannot be null");
        }
    }

    public static StrategyCandidate of(String id, ReturnSeries returns) {
        return new StrategyCandidate(id, returns, null, null);
    }

    public StrategyCandidate withEvaluator(PeriodEvaluator periodEvaluator) {
        return new StrategyCandidate(id, returns, periodEvaluator, reportedMetric);
    }

    public StrategyCandidate withReportedMetric(double metric) {
        return new StrategyCandidate(id, returns, evaluator, metric);
    }
}
