package tw.gc.strategy.validation.services.baseline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.PeriodBounds;
import tw.gc.strategy.validation.model.ReturnSeries;
import tw.gc.strategy.validation.services.metrics.ReturnStatistics;
import tw.gc.strategy.validation.services.metrics.SharpeRatio;

/**
 * Baseline Comparison Service
 *
 * <p>Compares the candidate's metric against simple reference portfolios over the
 * same date range:
 * <ul>
 *   <li>Buy-and-hold of a broad-index proxy</li>
 *   <li>Equal-weight top N</li>
 *   <li>Risk parity (inverse volatility)</li>
 * </ul>
 *
 * <p>The candidate passes when it beats at least one baseline by more than 0.5
 * Sharpe and no baseline beats it by 1.0 or more. Baseline records are cached per
 * run, so a range shared by many candidates is simulated once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BaselineComparator {

    private final ValidationProperties properties;

    public BaselineComparisonResult compare(double candidateMetric, ReturnSeries candidateReturns,
                                            BaselineSimulator simulator, BaselineCache cache) {
        return compare(candidateMetric, candidateReturns, simulator, cache,
            BaselineConfig.from(properties.getBaseline()));
    }

    /**
     * Compares over the candidate's own date range, or over its trailing
     * {@code lookbackPeriods} observations when configured.
     */
    public BaselineComparisonResult compare(double candidateMetric, ReturnSeries candidateReturns,
                                            BaselineSimulator simulator, BaselineCache cache,
                                            BaselineConfig config) {
        if (candidateReturns.size() < 2) {
            return BaselineComparisonResult.notEvaluable(ValidationStatus.INSUFFICIENT_DATA,
                "Candidate series has %d observations; a comparison range needs 2".formatted(candidateReturns.size()),
                null, List.of());
        }
        return compare(candidateMetric, comparisonBounds(candidateReturns, config), simulator, cache, config);
    }

    public BaselineComparisonResult compare(double candidateMetric, PeriodBounds bounds,
                                            BaselineSimulator simulator, BaselineCache cache,
                                            BaselineConfig config) {
        List<BaselineRecord> records = new ArrayList<>(config.portfolios().size());
        for (BaselinePortfolio portfolio : config.portfolios()) {
            records.add(cache.getOrCompute(BaselineRecord.cacheKey(portfolio, bounds),
                () -> computeRecord(portfolio, bounds, simulator)));
        }

        if (!Double.isFinite(candidateMetric)) {
            return BaselineComparisonResult.notEvaluable(ValidationStatus.DEGENERATE_INPUT,
                "Candidate metric is not finite (%s)".formatted(candidateMetric), null, records);
        }

        Map<BaselinePortfolio, Double> improvements = new EnumMap<>(BaselinePortfolio.class);
        List<BaselinePortfolio> unavailable = new ArrayList<>();
        BaselinePortfolio best = null;
        BaselinePortfolio worst = null;
        for (BaselineRecord record : records) {
            if (!record.available()) {
                unavailable.add(record.baseline());
                continue;
            }
            double improvement = candidateMetric - record.sharpe();
            improvements.put(record.baseline(), improvement);
            log.debug("   Improvement vs {}: {}", record.baseline().getDescription(), String.format("%+.4f", improvement));
            if (best == null || improvement > improvements.get(best)) {
                best = record.baseline();
            }
            if (worst == null || improvement < improvements.get(worst)) {
                worst = record.baseline();
            }
        }

        if (improvements.isEmpty()) {
            log.warn("⚠️ No baseline available for {}", bounds);
            return BaselineComparisonResult.notEvaluable(ValidationStatus.UNAVAILABLE,
                "No baseline available: %s".formatted(records.stream()
                    .map(r -> r.baseline().getCode() + " (" + r.failureReason() + ")").toList()),
                candidateMetric, records);
        }

        double bestAlpha = improvements.get(best);
        double worstImprovement = improvements.get(worst);

        List<String> failures = new ArrayList<>();
        if (!(bestAlpha > config.minImprovement())) {
            failures.add("best improvement %+.3f vs %s <= %.2f"
                .formatted(bestAlpha, best.getCode(), config.minImprovement()));
        }
        if (!(worstImprovement > config.maxUnderperformance())) {
            failures.add("underperforms %s by %.3f".formatted(worst.getCode(), -worstImprovement));
        }

        boolean passed = failures.isEmpty();
        String reason = passed
            ? "beats %s by %+.3f, worst %+.3f vs %s".formatted(best.getCode(), bestAlpha, worstImprovement,
                worst.getCode())
            : String.join("; ", failures);
        if (!unavailable.isEmpty()) {
            reason += " (unavailable: %s)".formatted(unavailable.stream().map(BaselinePortfolio::getCode).toList());
        }

        log.info("{} Baseline: metric={} best alpha={} vs {}",
            passed ? "✅" : "❌", String.format("%.3f", candidateMetric),
            String.format("%+.3f", bestAlpha), best.getCode());

        return new BaselineComparisonResult(
            passed ? ValidationStatus.PASSED : ValidationStatus.FAILED,
            reason,
            candidateMetric,
            records,
            improvements,
            bestAlpha,
            best,
            worstImprovement,
            worst,
            unavailable);
    }

    /**
     * Date range the baselines are simulated over.
     */
    public PeriodBounds comparisonBounds(ReturnSeries candidateReturns, BaselineConfig config) {
        int size = candidateReturns.size();
        int from = config.lookbackPeriods() > 0 && size > config.lookbackPeriods()
            ? size - config.lookbackPeriods()
            : 0;
        return candidateReturns.boundsOf(from, size);
    }

    BaselineRecord computeRecord(BaselinePortfolio portfolio, PeriodBounds bounds, BaselineSimulator simulator) {
        log.info("   Calculating {} baseline for {}", portfolio.getDescription(), bounds);
        try {
            ReturnSeries series = simulator.simulate(portfolio, bounds);
            double[] returns = series.finiteValues();
            double sharpe = SharpeRatio.annualized().compute(returns);
            if (!Double.isFinite(sharpe)) {
                return BaselineRecord.unavailable(portfolio, bounds,
                    "degenerate baseline series (%d observations)".formatted(returns.length));
            }
            BaselineRecord record = BaselineRecord.available(portfolio, bounds, sharpe,
                ReturnStatistics.annualizedReturn(returns), ReturnStatistics.maxDrawdown(returns), returns.length);
            log.info("   ✅ {}: Sharpe={}, Return={}%, MDD={}%", portfolio.getDescription(),
                String.format("%.4f", sharpe), String.format("%.2f", record.annualReturn() * 100),
                String.format("%.2f", record.maxDrawdown() * 100));
            return record;
        } catch (RuntimeException e) {
            log.error("   ❌ {} calculation failed: {}", portfolio.getDescription(), e.getMessage());
            return BaselineRecord.unavailable(portfolio, bounds, e.getMessage());
        }
    }
}
