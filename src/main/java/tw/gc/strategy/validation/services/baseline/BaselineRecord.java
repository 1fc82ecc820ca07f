package tw.gc.strategy.validation.services.baseline;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.model.PeriodBounds;

/**
 * Performance of a reference portfolio over a date range.
 *
 * @param cacheKey hash of the baseline id and the bounds, see {@link #cacheKey(BaselinePortfolio, PeriodBounds)}
 * @param sharpe annualized Sharpe ratio, NaN when unavailable
 * @param annualReturn (1 + mean period return)^252 - 1
 * @param maxDrawdown non-positive fraction
 * @param available false when the simulation failed; metrics are then NaN
 * @param failureReason why the simulation failed, {@code null} when available
 */
public record BaselineRecord(
    BaselinePortfolio baseline,
    PeriodBounds bounds,
    String cacheKey,
    double sharpe,
    double annualReturn,
    double maxDrawdown,
    int observations,
    boolean available,
    String failureReason
) {
    public BaselineRecord {
        if (baseline == null || bounds == null) {
            throw new IllegalArgumentException("baseline and bounds must be non-null");
        }
        if (available && !Double.isFinite(sharpe)) {
            throw new IllegalArgumentException("an available baseline needs a finite Sharpe, got: " + sharpe);
        }
    }

    public static BaselineRecord available(BaselinePortfolio baseline, PeriodBounds bounds, double sharpe,
                                           double annualReturn, double maxDrawdown, int observations) {
        return new BaselineRecord(baseline, bounds, cacheKey(baseline, bounds),
            sharpe, annualReturn, maxDrawdown, observations, true, null);
    }

    public static BaselineRecord unavailable(BaselinePortfolio baseline, PeriodBounds bounds, String reason) {
        return new BaselineRecord(baseline, bounds, cacheKey(baseline, bounds),
            Double.NaN, Double.NaN, Double.NaN, 0, false, reason);
    }

    /**
     * MD5 hex digest of {@code code|start|end}.
     */
    public static String cacheKey(BaselinePortfolio baseline, PeriodBounds bounds) {
        String raw = "%s|%s|%s".formatted(baseline.getCode(), bounds.start(), bounds.end());
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not supported by this JVM", e);
        }
    }
}
