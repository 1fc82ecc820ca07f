package tw.gc.strategy.validation.services.bootstrap;

import java.util.Random;

import tw.gc.strategy.validation.config.ValidationProperties;

/**
 * Settings of the block-bootstrap confidence interval.
 *
 * @param seed fixed RNG seed, {@code null} for a fresh random source per call
 */
public record BootstrapConfig(
    int blockSize,
    int iterations,
    double confidenceLevel,
    int minObservations,
    double minLowerBound,
    double maxFailedIterationRatio,
    Long seed
) {
    public BootstrapConfig {
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1, got: " + blockSize);
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1, got: " + iterations);
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("confidenceLevel must be within (0, 1), got: " + confidenceLevel);
        }
        if (minObservations < 2) {
            throw new IllegalArgumentException("minObservations must be >= 2, got: " + minObservations);
        }
        if (maxFailedIterationRatio < 0 || maxFailedIterationRatio > 1) {
            throw new IllegalArgumentException("maxFailedIterationRatio must be within [0, 1], got: "
                + maxFailedIterationRatio);
        }
    }

    public static BootstrapConfig defaults() {
        return from(new ValidationProperties.Bootstrap());
    }

    public static BootstrapConfig from(ValidationProperties.Bootstrap properties) {
        return new BootstrapConfig(
            properties.getBlockSize(),
            properties.getIterations(),
            properties.getConfidenceLevel(),
            properties.getMinObservations(),
            properties.getMinLowerBound(),
            properties.getMaxFailedIterationRatio(),
            properties.getSeed()
        );
    }

    public Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }

    public BootstrapConfig withSeed(long newSeed) {
        return new BootstrapConfig(blockSize, iterations, confidenceLevel, minObservations,
            minLowerBound, maxFailedIterationRatio, newSeed);
    }

    public BootstrapConfig withIterations(int newIterations) {
        return new BootstrapConfig(blockSize, newIterations, confidenceLevel, minObservations,
            minLowerBound, maxFailedIterationRatio, seed);
    }
}
