package tw.gc.strategy.validation.exceptions;

import java.time.LocalDate;

import tw.gc.strategy.validation.enums.ValidationStatus;

/**
 * The external backtest callback raised or timed out while evaluating a period.
 */
public class PeriodEvaluationException extends ValidationException {

    public PeriodEvaluationException(String message) {
        super(message);
    }

    public PeriodEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    public PeriodEvaluationException(LocalDate start, LocalDate end, Throwable cause) {
        super("Backtest evaluation failed for %s → %s: %s".formatted(start, end, cause.getMessage()), cause);
    }

    @Override
    public ValidationStatus status() {
        return ValidationStatus.UNAVAILABLE;
    }
}
