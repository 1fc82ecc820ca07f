package tw.gc.strategy.validation.services.metrics;

import java.time.LocalDate;

import tw.gc.strategy.validation.exceptions.InsufficientDataException;
import tw.gc.strategy.validation.model.PeriodBounds;
import tw.gc.strategy.validation.model.ReturnSeries;

/**
 * Evaluates periods directly on a precomputed return series.
 */
public class ReturnSeriesPeriodEvaluator implements PeriodEvaluator {

    private final ReturnSeries series;
    private final MetricFunction metric;
    private final int minObservations;

    public ReturnSeriesPeriodEvaluator(ReturnSeries series, MetricFunction metric, int minObservations) {
        if (series == null || metric == null) {
            throw new IllegalArgumentException("series and metric must be non-null");
        }
        if (minObservations < 2) {
            throw new IllegalArgumentException("minObservations must be >= 2, got: " + minObservations);
        }
        this.series = series;
        this.metric = metric;
        this.minObservations = minObservations;
    }

    @Override
    public double evaluate(LocalDate start, LocalDate end) {
        PeriodBounds bounds = new PeriodBounds(start, end);
        ReturnSeries period = series.slice(bounds);
        double[] values = period.finiteValues();
        if (values.length < minObservations) {
            throw new InsufficientDataException(values.length, minObservations, "period " + bounds);
        }
        return metric.compute(values);
    }

    public int getMinObservations() {
        return minObservations;
    }
}
