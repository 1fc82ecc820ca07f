package tw.gc.strategy.validation.services.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.model.PeriodBounds;

import static org.assertj.core.api.Assertions.*;

class BaselineRecordTest {

    private final PeriodBounds bounds = PeriodBounds.of("2023-01-01", "2024-12-31");

    @Test
    @DisplayName("should derive a stable 32-character hex cache key")
    void shouldHashCacheKey() {
        String key = BaselineRecord.cacheKey(BaselinePortfolio.RISK_PARITY, bounds);

        assertThat(key).hasSize(32).matches("[0-9a-f]{32}");
        assertThat(BaselineRecord.cacheKey(BaselinePortfolio.RISK_PARITY, bounds)).isEqualTo(key);
        assertThat(BaselineRecord.cacheKey(BaselinePortfolio.BUY_AND_HOLD_INDEX, bounds)).isNotEqualTo(key);
        assertThat(BaselineRecord.cacheKey(BaselinePortfolio.RISK_PARITY, PeriodBounds.of("2023-01-01", "2024-12-30")))
            .isNotEqualTo(key);
    }

    @Test
    @DisplayName("should carry NaN metrics when unavailable")
    void shouldBuildUnavailableRecord() {
        BaselineRecord record = BaselineRecord.unavailable(BaselinePortfolio.EQUAL_WEIGHT_TOP_N, bounds, "offline");

        assertThat(record.available()).isFalse();
        assertThat(record.sharpe()).isNaN();
        assertThat(record.failureReason()).isEqualTo("offline");
    }

    @Test
    @DisplayName("should reject an available record without a finite Sharpe")
    void shouldRejectNaNSharpe() {
        assertThatThrownBy(() -> BaselineRecord.available(BaselinePortfolio.RISK_PARITY, bounds,
            Double.NaN, 0.0, 0.0, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
