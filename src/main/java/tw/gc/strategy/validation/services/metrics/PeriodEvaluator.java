package tw.gc.strategy.validation.services.metrics;

import java.time.LocalDate;

import tw.gc.strategy.validation.model.PeriodBounds;

/**
 * Callback supplied by the backtest-execution collaborator: evaluates the
 * strategy over a date range and returns its risk-adjusted metric.
 *
 * <p>Implementations signal an upstream failure with
 * {@link tw.gc.strategy.validation.exceptions.PeriodEvaluationException} and a
 * data shortage with {@link tw.gc.strategy.validation.exceptions.InsufficientDataException}.
 * The call may block; timeouts belong to the caller wrapping it.
 */
@FunctionalInterface
public interface PeriodEvaluator {

    double evaluate(LocalDate start, LocalDate end);

    default double evaluate(PeriodBounds bounds) {
        return evaluate(bounds.start(), bounds.end());
    }
}
