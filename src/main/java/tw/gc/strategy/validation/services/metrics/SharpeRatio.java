package tw.gc.strategy.validation.services.metrics;

/**
 * Sharpe ratio metrics with a zero risk-free rate.
 */
public final class SharpeRatio {

    /** Trading periods per year used for annualization. */
    public static final double PERIODS_PER_YEAR = 252.0;

    private static final MetricFunction ANNUALIZED = returns -> perPeriod(returns) * Math.sqrt(PERIODS_PER_YEAR);

    private static final MetricFunction PER_PERIOD = SharpeRatio::perPeriod;

    private SharpeRatio() {
    }

    /**
     * mean / sample std × sqrt(252).
     */
    public static MetricFunction annualized() {
        return ANNUALIZED;
    }

    /**
     * mean / sample std, the unit in which a null Sharpe has variance 1/T.
     */
    public static MetricFunction perPeriodMetric() {
        return PER_PERIOD;
    }

    static double perPeriod(double[] returns) {
        if (returns.length < 2) {
            return Double.NaN;
        }
        double std = ReturnStatistics.sampleStdDev(returns);
        double mean = ReturnStatistics.mean(returns);
        if (!Double.isFinite(std) || ReturnStatistics.isZeroSpread(std, mean)) {
            return Double.NaN;
        }
        return mean / std;
    }
}
