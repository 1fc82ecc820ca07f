package tw.gc.strategy.validation.services.bootstrap;

import java.util.Random;

import tw.gc.strategy.validation.services.metrics.MetricFunction;

/**
 * Moving-block resampler preserving short-range autocorrelation.
 *
 * <p>Overlapping contiguous blocks are drawn with replacement, each starting
 * uniformly in {@code [0, n - blockSize]}, until the resample has the original
 * length; the last block is truncated. A block longer than the series is
 * shortened to the series length.
 */
public final class BlockResampler {

    private final int blockSize;

    public BlockResampler(int blockSize) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1, got: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public double[] resample(double[] values, Random random) {
        int n = values.length;
        double[] resampled = new double[n];
        if (n == 0) {
            return resampled;
        }
        int block = Math.min(blockSize, n);
        int maxStart = n - block;
        int filled = 0;
        while (filled < n) {
            int start = random.nextInt(maxStart + 1);
            int length = Math.min(block, n - filled);
            System.arraycopy(values, start, resampled, filled, length);
            filled += length;
        }
        return resampled;
    }

    /**
     * Metric of {@code iterations} resamples, in draw order. Entries are NaN
     * where the metric was undefined for a resample.
     */
    public double[] distribution(double[] values, MetricFunction metric, int iterations, Random random) {
        double[] results = new double[iterations];
        for (int i = 0; i < iterations; i++) {
            results[i] = metric.compute(resample(values, random));
        }
        return results;
    }
}
