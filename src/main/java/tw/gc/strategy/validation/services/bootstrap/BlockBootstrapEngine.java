package tw.gc.strategy.validation.services.bootstrap;

import java.util.Arrays;
import java.util.Random;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.ReturnSeries;
import tw.gc.strategy.validation.services.metrics.MetricFunction;
import tw.gc.strategy.validation.services.metrics.ReturnStatistics;

/**
 * Block-Bootstrap Confidence Interval Engine
 *
 * <p>Resamples the return series with overlapping blocks (21 periods by default,
 * roughly one trading month) and reports the percentile interval of the metric.
 * The strategy passes when the lower bound is positive and at least 0.5.
 *
 * <p>Every call takes its randomness from an explicit {@link Random}; a fixed
 * seed reproduces the interval exactly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BlockBootstrapEngine {

    private final ValidationProperties properties;

    public BootstrapResult estimate(ReturnSeries returns, MetricFunction metric) {
        BootstrapConfig config = BootstrapConfig.from(properties.getBootstrap());
        return estimate(returns.values(), metric, config, config.newRandom());
    }

    public BootstrapResult estimate(double[] returns, MetricFunction metric, BootstrapConfig config) {
        return estimate(returns, metric, config, config.newRandom());
    }

    public BootstrapResult estimate(double[] returns, MetricFunction metric, BootstrapConfig config, Random random) {
        double[] finite = Arrays.stream(returns).filter(Double::isFinite).toArray();
        int dropped = returns.length - finite.length;

        if (returns.length > 0 && finite.length == 0) {
            return notEvaluable(ValidationStatus.DEGENERATE_INPUT,
                "All %d observations are non-finite".formatted(returns.length), null, config, 0, 0);
        }
        if (dropped > 0) {
            log.warn("⚠️ Dropped {} non-finite observations of {}", dropped, returns.length);
        }
        if (finite.length < config.minObservations()) {
            return notEvaluable(ValidationStatus.INSUFFICIENT_DATA,
                "Insufficient data: %d observations, %d required".formatted(finite.length, config.minObservations()),
                null, config, 0, finite.length);
        }

        double std = ReturnStatistics.sampleStdDev(finite);
        if (!Double.isFinite(std) || ReturnStatistics.isZeroSpread(std, ReturnStatistics.mean(finite))) {
            return notEvaluable(ValidationStatus.DEGENERATE_INPUT,
                "Zero variance return series", null, config, 0, finite.length);
        }
        double pointEstimate = metric.compute(finite);
        if (!Double.isFinite(pointEstimate)) {
            return notEvaluable(ValidationStatus.DEGENERATE_INPUT,
                "Metric is not finite on the original series (%s)".formatted(pointEstimate),
                null, config, 0, finite.length);
        }

        BlockResampler resampler = new BlockResampler(config.blockSize());
        double[] distribution = resampler.distribution(finite, metric, config.iterations(), random);
        double[] valid = Arrays.stream(distribution).filter(Double::isFinite).toArray();

        int failed = config.iterations() - valid.length;
        double failedRatio = (double) failed / config.iterations();
        if (failedRatio > config.maxFailedIterationRatio()) {
            log.error("❌ {} of {} bootstrap iterations produced no finite metric", failed, config.iterations());
            return notEvaluable(ValidationStatus.DEGENERATE_INPUT,
                "Too many failed iterations: %d of %d (%.1f%% > %.1f%%)".formatted(
                    failed, config.iterations(), failedRatio * 100, config.maxFailedIterationRatio() * 100),
                pointEstimate, config, valid.length, finite.length);
        }
        if (failed > 0) {
            log.warn("⚠️ {} of {} bootstrap iterations skipped (non-finite metric)", failed, config.iterations());
        }

        double tail = (1.0 - config.confidenceLevel()) / 2.0;
        double lower = ReturnStatistics.percentile(valid, tail * 100);
        double upper = ReturnStatistics.percentile(valid, (1.0 - tail) * 100);

        boolean passed = lower > 0 && lower >= config.minLowerBound();
        String reason = passed
            ? "%.0f%% CI [%.3f, %.3f] excludes the %.2f floor".formatted(
                config.confidenceLevel() * 100, lower, upper, config.minLowerBound())
            : "CI lower bound %.3f below %.2f".formatted(lower, Math.max(0.0, config.minLowerBound()));

        log.info("{} Bootstrap: point={} CI=[{}, {}] ({} iterations, block {})",
            passed ? "✅" : "❌",
            String.format("%.3f", pointEstimate), String.format("%.3f", lower), String.format("%.3f", upper),
            valid.length, config.blockSize());

        return new BootstrapResult(
            passed ? ValidationStatus.PASSED : ValidationStatus.FAILED,
            reason,
            pointEstimate,
            lower,
            upper,
            config.confidenceLevel(),
            config.iterations(),
            valid.length,
            config.blockSize(),
            finite.length);
    }

    private BootstrapResult notEvaluable(ValidationStatus status, String reason, Double pointEstimate,
                                         BootstrapConfig config, int validIterations, int observations) {
        log.warn("⚠️ Bootstrap not evaluable: {}", reason);
        return BootstrapResult.notEvaluable(status, reason, pointEstimate, config, validIterations, observations);
    }
}
