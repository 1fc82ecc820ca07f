package tw.gc.strategy.validation.enums;

/**
 * Which significance threshold the multiple-comparison corrector applies.
 */
public enum ThresholdMode {
    /** Normal approximation, z(1 - alpha/2) / sqrt(T). */
    PARAMETRIC,
    /** Empirical percentile of block-bootstrapped null returns. */
    BOOTSTRAP
}
