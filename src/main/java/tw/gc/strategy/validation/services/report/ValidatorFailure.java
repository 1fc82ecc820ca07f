package tw.gc.strategy.validation.services.report;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.model.ValidationOutcome;

/**
 * Outcome of a validator that did not return a result of its own, because it
 * threw or because a precondition of the pipeline was not met.
 */
public record ValidatorFailure(
    ValidatorType validator,
    ValidationStatus status,
    String reason
) implements ValidationOutcome {

    public ValidatorFailure {
        if (validator == null || status == null) {
            throw new IllegalArgumentException("validator and status must be non-null");
        }
        if (status == ValidationStatus.PASSED) {
            throw new IllegalArgumentException("a validator failure cannot pass");
        }
    }

    @Override
    public Double metricValue() {
        return null;
    }
}
