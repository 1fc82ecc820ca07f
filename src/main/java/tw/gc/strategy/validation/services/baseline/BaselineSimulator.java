package tw.gc.strategy.validation.services.baseline;

import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.model.PeriodBounds;
import tw.gc.strategy.validation.model.ReturnSeries;

/**
 * Produces the period returns of a reference portfolio over a date range.
 *
 * <p>Implementations may throw any runtime exception; the comparator reports
 * the baseline as unavailable and carries on with the others.
 */
@FunctionalInterface
public interface BaselineSimulator {

    ReturnSeries simulate(BaselinePortfolio portfolio, PeriodBounds bounds);
}
