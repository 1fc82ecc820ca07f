package tw.gc.strategy.validation.exceptions;

import tw.gc.strategy.validation.enums.ValidationStatus;

/**
 * Base type for conditions a validator recovers from locally and reports as a
 * structured, non-passing result.
 */
public abstract class ValidationException extends RuntimeException {

    protected ValidationException(String message) {
        super(message);
    }

    protected ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Status a validator reports when it catches this exception.
     */
    public abstract ValidationStatus status();
}
