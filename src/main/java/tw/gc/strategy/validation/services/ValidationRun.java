package tw.gc.strategy.validation.services;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

import tw.gc.strategy.validation.services.baseline.BaselineCache;
import tw.gc.strategy.validation.services.baseline.BaselineSimulator;
import tw.gc.strategy.validation.services.baseline.InMemoryBaselineCache;
import tw.gc.strategy.validation.services.significance.CorrectionContext;

/**
 * State shared by all candidates validated together: the number of strategies the
 * Bonferroni correction accounts for, its contexts per observation count and the
 * baseline cache. Nothing outlives the run.
 */
public final class ValidationRun {

    private final String id;
    private final int strategyCount;
    private final BaselineSimulator baselineSimulator;
    private final BaselineCache baselineCache;
    private final Map<Integer, CorrectionContext> correctionContexts = new ConcurrentHashMap<>();

    ValidationRun(int strategyCount, BaselineSimulator baselineSimulator, BaselineCache baselineCache) {
        if (strategyCount < 1) {
            throw new IllegalArgumentException("strategyCount must be >= 1, got: " + strategyCount);
        }
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.strategyCount = strategyCount;
        this.baselineSimulator = baselineSimulator;
        this.baselineCache = baselineCache;
    }

    public String getId() {
        return id;
    }

    public int getStrategyCount() {
        return strategyCount;
    }

    /**
     * Simulator of the reference portfolios, {@code null} when none is configured.
     */
    public BaselineSimulator getBaselineSimulator() {
        return baselineSimulator;
    }

    public BaselineCache getBaselineCache() {
        return baselineCache;
    }

    /**
     * Correction for this run's N over {@code observations} periods, built once per observation count.
     */
    CorrectionContext correctionContext(int observations, IntFunction<CorrectionContext> factory) {
        return correctionContexts.computeIfAbsent(observations, factory::apply);
    }

    static ValidationRun create(int strategyCount, BaselineSimulator baselineSimulator) {
        return new ValidationRun(strategyCount, baselineSimulator, new InMemoryBaselineCache());
    }

    @Override
    public String toString() {
        return "ValidationRun[%s, N=%d]".formatted(id, strategyCount);
    }
}
