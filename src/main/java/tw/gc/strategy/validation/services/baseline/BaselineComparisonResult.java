package tw.gc.strategy.validation.services.baseline;

import java.util.List;
import java.util.Map;

import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.ValidationOutcome;

/**
 * Candidate metric against the reference portfolios.
 *
 * @param improvements candidate metric minus baseline Sharpe, per available baseline
 * @param bestAlpha largest improvement, {@code null} without available baselines
 * @param worstImprovement smallest improvement, {@code null} without available baselines
 * @param unavailable baselines excluded because their simulation failed
 */
public record BaselineComparisonResult(
    ValidationStatus status,
    String reason,
    Double candidateMetric,
    List<BaselineRecord> baselines,
    Map<BaselinePortfolio, Double> improvements,
    Double bestAlpha,
    BaselinePortfolio bestBaseline,
    Double worstImprovement,
    BaselinePortfolio worstBaseline,
    List<BaselinePortfolio> unavailable
) implements ValidationOutcome {

    public BaselineComparisonResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        baselines = List.copyOf(baselines);
        improvements = Map.copyOf(improvements);
        unavailable = List.copyOf(unavailable);
    }

    static BaselineComparisonResult notEvaluable(ValidationStatus status, String reason, Double candidateMetric,
                                                 List<BaselineRecord> baselines) {
        return new BaselineComparisonResult(status, reason, candidateMetric, baselines, Map.of(),
            null, null, null, null,
            baselines.stream().filter(b -> !b.available()).map(BaselineRecord::baseline).toList());
    }

    @Override
    public Double metricValue() {
        return bestAlpha;
    }
}
