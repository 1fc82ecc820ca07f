package tw.gc.strategy.validation.exceptions;

import tw.gc.strategy.validation.enums.ValidationStatus;

/**
 * Input that cannot carry a meaningful metric: zero variance, no finite values,
 * or too many resamples without a finite metric.
 */
public class DegenerateInputException extends ValidationException {

    public DegenerateInputException(String message) {
        super(message);
    }

    @Override
    public ValidationStatus status() {
        return ValidationStatus.DEGENERATE_INPUT;
    }
}
