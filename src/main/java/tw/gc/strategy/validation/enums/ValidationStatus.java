package tw.gc.strategy.validation.enums;

/**
 * Outcome of a single validator invocation.
 *
 * <p>{@link #UNAVAILABLE} means the strategy could not be evaluated (the backtest
 * callback failed), which is deliberately kept apart from {@link #FAILED}
 * ("the strategy is not good enough").
 */
public enum ValidationStatus {
    PASSED,
    FAILED,
    INSUFFICIENT_DATA,
    DEGENERATE_INPUT,
    UNAVAILABLE;

    public boolean isPassed() {
        return this == PASSED;
    }

    /**
     * True when the validator produced a statistical verdict, pass or fail.
     */
    public boolean isEvaluated() {
        return this == PASSED || this == FAILED;
    }
}
