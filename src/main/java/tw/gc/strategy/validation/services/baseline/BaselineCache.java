package tw.gc.strategy.validation.services.baseline;

import java.util.function.Supplier;

/**
 * Write-once store of baseline records shared by all candidates of a run.
 */
public interface BaselineCache {

    /**
     * Returns the record stored under {@code key}, computing and storing it on first
     * access. Concurrent callers with the same key observe a single computation.
     */
    BaselineRecord getOrCompute(String key, Supplier<BaselineRecord> supplier);

    int size();
}
