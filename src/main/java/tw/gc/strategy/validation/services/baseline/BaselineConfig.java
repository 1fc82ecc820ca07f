package tw.gc.strategy.validation.services.baseline;

import java.util.List;

import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.BaselinePortfolio;

/**
 * Baselines to compare against and the comparison criteria.
 *
 * @param lookbackPeriods trailing candidate observations defining the comparison range, 0 for all
 */
public record BaselineConfig(
    List<BaselinePortfolio> portfolios,
    double minImprovement,
    double maxUnderperformance,
    int lookbackPeriods
) {
    public BaselineConfig {
        if (portfolios == null || portfolios.isEmpty()) {
            throw new IllegalArgumentException("at least one baseline portfolio is required");
        }
        if (lookbackPeriods < 0) {
            throw new IllegalArgumentException("lookbackPeriods must be >= 0, got: " + lookbackPeriods);
        }
        portfolios = List.copyOf(portfolios);
    }

    public static BaselineConfig defaults() {
        return from(new ValidationProperties.Baseline());
    }

    public static BaselineConfig from(ValidationProperties.Baseline properties) {
        return new BaselineConfig(
            properties.getPortfolios().stream().map(BaselinePortfolio::fromCode).distinct().toList(),
            properties.getMinImprovement(),
            properties.getMaxUnderperformance(),
            properties.getLookbackPeriods()
        );
    }
}
