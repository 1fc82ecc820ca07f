package tw.gc.strategy.validation.model;

import tw.gc.strategy.validation.enums.ValidationStatus;

/**
 * Common contract of every validator result.
 */
public interface ValidationOutcome {

    ValidationStatus status();

    /**
     * Human-readable explanation of the status.
     */
    String reason();

    /**
     * Point estimate of the validator's headline metric, or {@code null} when it
     * could not be computed.
     */
    Double metricValue();

    default boolean passed() {
        return status().isPassed();
    }
}
