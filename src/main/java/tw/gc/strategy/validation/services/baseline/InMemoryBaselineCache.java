package tw.gc.strategy.validation.services.baseline;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link BaselineCache} living for one validation run.
 */
@Slf4j
public class InMemoryBaselineCache implements BaselineCache {

    private final Map<String, BaselineRecord> records = new ConcurrentHashMap<>();

    @Override
    public BaselineRecord getOrCompute(String key, Supplier<BaselineRecord> supplier) {
        BaselineRecord cached = records.get(key);
        if (cached != null) {
            log.debug("⚡ Baseline {} served from cache", cached.baseline().getCode());
            return cached;
        }
        return records.computeIfAbsent(key, k -> supplier.get());
    }

    @Override
    public int size() {
        return records.size();
    }
}
