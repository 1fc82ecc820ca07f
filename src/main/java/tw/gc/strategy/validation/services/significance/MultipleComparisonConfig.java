package tw.gc.strategy.validation.services.significance;

import java.util.Random;

import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ThresholdMode;

/**
 * Settings of the Bonferroni correction and of its bootstrap-derived threshold.
 *
 * @param strategyCount size of the screened universe, 0 to use the number of candidates
 * @param seed fixed RNG seed for the null simulation, {@code null} for a fresh random source
 */
public record MultipleComparisonConfig(
    double alpha,
    int strategyCount,
    double conservativeFloor,
    ThresholdMode thresholdMode,
    double marketVolatility,
    int bootstrapIterations,
    int blockSize,
    double divergenceWarningPercent,
    double maxFalseDiscoveryRate,
    Long seed
) {
    public MultipleComparisonConfig {
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be within (0, 1), got: " + alpha);
        }
        if (strategyCount < 0) {
            throw new IllegalArgumentException("strategyCount must be >= 0, got: " + strategyCount);
        }
        if (thresholdMode == null) {
            throw new IllegalArgumentException("thresholdMode cannot be null");
        }
        if (!(marketVolatility > 0)) {
            throw new IllegalArgumentException("marketVolatility must be positive, got: " + marketVolatility);
        }
        if (bootstrapIterations < 1) {
            throw new IllegalArgumentException("bootstrapIterations must be >= 1, got: " + bootstrapIterations);
        }
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1, got: " + blockSize);
        }
    }

    public static MultipleComparisonConfig defaults() {
        return from(new ValidationProperties.MultipleComparison());
    }

    public static MultipleComparisonConfig from(ValidationProperties.MultipleComparison properties) {
        return new MultipleComparisonConfig(
            properties.getAlpha(),
            properties.getStrategyCount(),
            properties.getConservativeFloor(),
            properties.getThresholdMode(),
            properties.getMarketVolatility(),
            properties.getBootstrapIterations(),
            properties.getBlockSize(),
            properties.getDivergenceWarningPercent(),
            properties.getMaxFalseDiscoveryRate(),
            properties.getSeed()
        );
    }

    /**
     * Number of hypotheses to correct for when {@code candidates} strategies are validated together.
     */
    public int effectiveStrategyCount(int candidates) {
        return Math.max(1, Math.max(strategyCount, candidates));
    }

    public Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }

    public MultipleComparisonConfig withThresholdMode(ThresholdMode mode) {
        return new MultipleComparisonConfig(alpha, strategyCount, conservativeFloor, mode, marketVolatility,
            bootstrapIterations, blockSize, divergenceWarningPercent, maxFalseDiscoveryRate, seed);
    }

    public MultipleComparisonConfig withSeed(long newSeed) {
        return new MultipleComparisonConfig(alpha, strategyCount, conservativeFloor, thresholdMode, marketVolatility,
            bootstrapIterations, blockSize, divergenceWarningPercent, maxFalseDiscoveryRate, newSeed);
    }
}
