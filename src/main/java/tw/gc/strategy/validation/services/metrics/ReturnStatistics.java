package tw.gc.strategy.validation.services.metrics;

import java.util.Arrays;

/**
 * Descriptive statistics shared by the validators.
 */
public final class ReturnStatistics {

    /** Relative spread below which a sample counts as constant. */
    static final double ZERO_SPREAD_TOLERANCE = 1e-12;

    private ReturnStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Standard deviation with Bessel's correction (ddof = 1). Exactly 0 when all values are equal.
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        if (allEqual(values)) {
            return 0.0;
        }
        double mean = mean(values);
        double squaredSum = 0.0;
        for (double v : values) {
            squaredSum += (v - mean) * (v - mean);
        }
        return Math.sqrt(squaredSum / (values.length - 1));
    }

    /**
     * True when {@code std} is zero up to rounding error relative to the magnitude of {@code mean}.
     */
    public static boolean isZeroSpread(double std, double mean) {
        return std <= ZERO_SPREAD_TOLERANCE * Math.max(Math.abs(mean), ZERO_SPREAD_TOLERANCE);
    }

    private static boolean allEqual(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) {
                return false;
            }
        }
        return true;
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(Double.NaN);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(Double.NaN);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values sample, not modified
     * @param percentile in [0, 100]
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (percentile < 0.0 || percentile > 100.0) {
            throw new IllegalArgumentException("percentile must be within [0, 100], got: " + percentile);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = rank - lower;
        return sorted[lower] + weight * (sorted[upper] - sorted[lower]);
    }

    /**
     * Maximum drawdown of the compounded equity curve, as a non-positive fraction.
     */
    public static double maxDrawdown(double[] returns) {
        if (returns.length < 2) {
            return 0.0;
        }
        double equity = 1.0;
        double peak = 1.0;
        double maxDrawdown = 0.0;
        for (double r : returns) {
            equity *= 1.0 + r;
            if (equity > peak) {
                peak = equity;
            }
            double drawdown = (equity - peak) / peak;
            if (drawdown < maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    /**
     * (1 + mean period return)^252 - 1.
     */
    public static double annualizedReturn(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        return Math.pow(1.0 + mean(returns), SharpeRatio.PERIODS_PER_YEAR) - 1.0;
    }

    /**
     * Inverse of the standard normal CDF (Acklam's rational approximation,
     * relative error below 1.15e-9).
     */
    public static double inverseNormalCdf(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new IllegalArgumentException("p must be within (0, 1), got: " + p);
        }
        final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
            1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
            6.680131188771972e+01, -1.328068155288572e+01};
        final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
            -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
            3.754408661907416e+00};
        final double low = 0.02425;
        final double high = 1 - low;

        if (p < low) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        if (p > high) {
            double q = Math.sqrt(-2 * Math.log(1 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
            / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1);
    }
}
