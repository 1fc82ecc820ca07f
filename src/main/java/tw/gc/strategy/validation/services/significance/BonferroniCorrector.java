package tw.gc.strategy.validation.services.significance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ThresholdMode;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.exceptions.DegenerateInputException;
import tw.gc.strategy.validation.services.bootstrap.BlockResampler;
import tw.gc.strategy.validation.services.bootstrap.BootstrapResult;
import tw.gc.strategy.validation.services.metrics.ReturnStatistics;
import tw.gc.strategy.validation.services.metrics.SharpeRatio;

/**
 * Bonferroni Multiple-Comparison Corrector
 *
 * <p>Screening N strategies at a family-wise alpha of 5% expects {@code 0.05 × N}
 * false discoveries. Testing each strategy at {@code alpha / N} bounds the
 * probability of any false discovery by alpha:
 * <pre>
 *   N = 500, alpha = 0.05  →  adjusted alpha = 0.0001
 *   threshold = z(1 - 0.0001 / 2) / sqrt(252) ≈ 0.245  →  floored at 0.5
 * </pre>
 *
 * <p>The bootstrap threshold block-resamples simulated zero-mean market returns
 * and takes the {@code 1 - adjusted alpha} percentile of their Sharpe ratios,
 * which is more robust to fat tails than the normal approximation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BonferroniCorrector {

    private final ValidationProperties properties;

    public static double adjustedAlpha(double alpha, int strategyCount) {
        if (strategyCount < 1) {
            throw new IllegalArgumentException("strategyCount must be >= 1, got: " + strategyCount);
        }
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be within (0, 1), got: " + alpha);
        }
        return alpha / strategyCount;
    }

    /**
     * z(1 - adjustedAlpha / 2) / sqrt(T), without the conservative floor.
     */
    public static double parametricThreshold(double adjustedAlpha, int observations) {
        if (observations < 1) {
            throw new IllegalArgumentException("observations must be >= 1, got: " + observations);
        }
        double z = ReturnStatistics.inverseNormalCdf(1.0 - adjustedAlpha / 2.0);
        return z / Math.sqrt(observations);
    }

    public CorrectionContext createContext(int strategyCount, int observations) {
        return createContext(strategyCount, observations,
            MultipleComparisonConfig.from(properties.getMultipleComparison()));
    }

    /**
     * Builds the correction for N strategies over T observations. In BOOTSTRAP
     * mode the null simulation runs here, once per context.
     *
     * @throws DegenerateInputException when too many null resamples have no finite Sharpe
     */
    public CorrectionContext createContext(int strategyCount, int observations, MultipleComparisonConfig config) {
        double adjusted = adjustedAlpha(config.alpha(), strategyCount);
        double parametric = parametricThreshold(adjusted, observations);
        BootstrapThreshold bootstrap = config.thresholdMode() == ThresholdMode.BOOTSTRAP
            ? bootstrapThreshold(adjusted, observations, config, config.newRandom())
            : null;

        CorrectionContext context = new CorrectionContext(strategyCount, config.alpha(), adjusted, observations,
            parametric, bootstrap, config.conservativeFloor(), config.thresholdMode());
        log.info("📊 Bonferroni: N={} alpha={} adjusted={} T={} threshold={} ({})",
            strategyCount, config.alpha(), String.format("%.6f", adjusted), observations,
            String.format("%.4f", context.threshold()), config.thresholdMode());
        return context;
    }

    /**
     * Estimates the threshold under the null hypothesis of zero-mean returns with
     * market volatility.
     *
     * <p>T null returns ~ N(0, sigma / sqrt(252)) are drawn once, then
     * block-resampled; the per-period Sharpe of each resample forms the null
     * distribution.
     */
    public BootstrapThreshold bootstrapThreshold(double adjustedAlpha, int observations,
                                                 MultipleComparisonConfig config, Random random) {
        if (observations < 2) {
            throw new IllegalArgumentException("observations must be >= 2, got: " + observations);
        }
        double dailyVolatility = config.marketVolatility() / Math.sqrt(SharpeRatio.PERIODS_PER_YEAR);
        double[] nullReturns = new double[observations];
        for (int i = 0; i < observations; i++) {
            nullReturns[i] = random.nextGaussian() * dailyVolatility;
        }

        BlockResampler resampler = new BlockResampler(config.blockSize());
        double[] sharpes = Arrays.stream(resampler.distribution(
                nullReturns, SharpeRatio.perPeriodMetric(), config.bootstrapIterations(), random))
            .filter(Double::isFinite)
            .toArray();

        int iterations = config.bootstrapIterations();
        if (sharpes.length < iterations * 0.9) {
            throw new DegenerateInputException("Bootstrap null distribution degenerate: %d of %d valid samples"
                .formatted(sharpes.length, iterations));
        }

        double threshold = ReturnStatistics.percentile(sharpes, (1.0 - adjustedAlpha) * 100);
        double parametric = parametricThreshold(adjustedAlpha, observations);
        double difference = threshold - parametric;
        double percentDifference = parametric > 0 ? difference / parametric * 100 : 0.0;
        boolean divergent = Math.abs(percentDifference) > config.divergenceWarningPercent();

        log.info("   Bootstrap threshold: {} | Parametric: {} | Difference: {} ({}%)",
            String.format("%.4f", threshold), String.format("%.4f", parametric),
            String.format("%+.4f", difference), String.format("%+.1f", percentDifference));
        if (divergent) {
            log.warn("⚠️ Bootstrap and parametric thresholds differ by {}%; returns are likely non-normal",
                String.format("%+.1f", percentDifference));
        }
        return new BootstrapThreshold(threshold, parametric, difference, percentDifference,
            sharpes.length, iterations, divergent);
    }

    /**
     * True when the metric is finite and strictly above the context's threshold.
     */
    public boolean isSignificant(double metric, CorrectionContext context) {
        return Double.isFinite(metric) && metric > context.threshold();
    }

    public SignificanceResult evaluate(double metric, CorrectionContext context) {
        Double bootstrap = context.bootstrapThreshold() != null ? context.bootstrapThreshold().threshold() : null;
        if (!Double.isFinite(metric)) {
            return new SignificanceResult(ValidationStatus.DEGENERATE_INPUT,
                "Metric is not finite (%s)".formatted(metric), null,
                context.strategyCount(), context.observations(), context.adjustedAlpha(),
                context.threshold(), context.parametricThreshold(), bootstrap, context.thresholdMode());
        }

        boolean significant = isSignificant(metric, context);
        String reason = "%.3f %s threshold %.3f (N=%d, adjusted alpha=%.6f)".formatted(
            metric, significant ? ">" : "<=", context.threshold(), context.strategyCount(), context.adjustedAlpha());
        log.info("{} Bonferroni: {}", significant ? "✅" : "❌", reason);

        return new SignificanceResult(
            significant ? ValidationStatus.PASSED : ValidationStatus.FAILED,
            reason,
            metric,
            context.strategyCount(),
            context.observations(),
            context.adjustedAlpha(),
            context.threshold(),
            context.parametricThreshold(),
            bootstrap,
            context.thresholdMode());
    }

    /**
     * Screens a whole strategy set, estimating how many of the discoveries are false.
     *
     * @param metricsById metric per strategy id, in report order
     */
    public StrategySetSignificance screenStrategySet(Map<String, Double> metricsById, CorrectionContext context) {
        double maxFdr = properties.getMultipleComparison().getMaxFalseDiscoveryRate();
        if (metricsById.isEmpty()) {
            log.warn("⚠️ Empty strategy set");
            return new StrategySetSignificance(0, 0, context.threshold(), context.adjustedAlpha(),
                0.0, 0.0, context.familyWiseErrorRate(), List.of(), false);
        }

        List<String> significant = new ArrayList<>();
        metricsById.forEach((id, metric) -> {
            if (metric != null && isSignificant(metric, context)) {
                significant.add(id);
            }
        });

        double expected = context.adjustedAlpha() * metricsById.size();
        double fdr = significant.isEmpty() ? 0.0 : expected / Math.max(1, significant.size());
        boolean passed = !significant.isEmpty() && fdr < maxFdr;

        log.info("{} Strategy set: {}/{} significant, expected false discoveries {}, estimated FDR {}%",
            passed ? "✅" : "❌", significant.size(), metricsById.size(),
            String.format("%.2f", expected), String.format("%.1f", fdr * 100));

        return new StrategySetSignificance(metricsById.size(), significant.size(), context.threshold(),
            context.adjustedAlpha(), expected, fdr, context.familyWiseErrorRate(), significant, passed);
    }

    /**
     * Checks the point estimate and the bootstrap CI lower bound against the same threshold.
     * A bootstrap result without an interval never counts as significant.
     */
    public CombinedSignificance combinedCheck(double pointEstimate, BootstrapResult interval,
                                              CorrectionContext context) {
        double threshold = context.threshold();
        double lower = interval.ciLower();
        boolean pointSignificant = isSignificant(pointEstimate, context);
        boolean lowerSignificant = Double.isFinite(lower) && lower > 0 && lower >= threshold;
        return new CombinedSignificance(pointEstimate, lower, threshold,
            pointSignificant, lowerSignificant, pointSignificant && lowerSignificant);
    }
}
