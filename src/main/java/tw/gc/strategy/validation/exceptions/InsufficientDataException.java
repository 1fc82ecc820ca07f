package tw.gc.strategy.validation.exceptions;

import tw.gc.strategy.validation.enums.ValidationStatus;

/**
 * Fewer observations than a validator's minimum.
 */
public class InsufficientDataException extends ValidationException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required, String context) {
        super("Insufficient data for %s: %d observations available, %d required"
            .formatted(context, available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }

    @Override
    public ValidationStatus status() {
        return ValidationStatus.INSUFFICIENT_DATA;
    }
}
