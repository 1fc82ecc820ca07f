package tw.gc.strategy.validation.services.datasplit;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.ValidationOutcome;

/**
 * Result of a train/validation/test split validation.
 *
 * @param status outcome
 * @param reason explanation of the outcome
 * @param periodMetrics metric per evaluated period
 * @param consistency 1 - std/mean of the period metrics, 0 when the mean is below epsilon
 * @param degradationRatio test metric / train metric, 0 when the train metric is not positive
 * @param skippedPeriods periods that could not be evaluated
 */
public record DataSplitResult(
    ValidationStatus status,
    String reason,
    Map<SplitPeriod, Double> periodMetrics,
    double consistency,
    double degradationRatio,
    List<SkippedPeriod> skippedPeriods
) implements ValidationOutcome {

    public DataSplitResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        periodMetrics = Map.copyOf(periodMetrics);
        skippedPeriods = List.copyOf(skippedPeriods);
    }

    /**
     * A period the evaluator could not produce a metric for.
     */
    public record SkippedPeriod(SplitPeriod period, ValidationStatus status, String reason) {
    }

    /**
     * Labels of the periods that produced a finite metric, in chronological order.
     */
    public List<String> periodsTested() {
        return Arrays.stream(SplitPeriod.values())
            .filter(periodMetrics::containsKey)
            .map(SplitPeriod::getLabel)
            .toList();
    }

    public Double trainMetric() {
        return periodMetrics.get(SplitPeriod.TRAIN);
    }

    public Double validationMetric() {
        return periodMetrics.get(SplitPeriod.VALIDATION);
    }

    public Double testMetric() {
        return periodMetrics.get(SplitPeriod.TEST);
    }

    @Override
    public Double metricValue() {
        return testMetric();
    }
}
