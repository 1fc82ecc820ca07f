package tw.gc.strategy.validation.enums;

/**
 * Reference portfolios a candidate strategy is compared against.
 */
public enum BaselinePortfolio {
    /**
     * Passive buy-and-hold of a broad-index proxy (e.g. 0050.TW).
     */
    BUY_AND_HOLD_INDEX("buy_and_hold", "Buy-and-Hold Index"),

    /**
     * Equal-weight basket of the top N constituents.
     */
    EQUAL_WEIGHT_TOP_N("equal_weight", "Equal-Weight Top N"),

    /**
     * Inverse-volatility weighted basket.
     */
    RISK_PARITY("risk_parity", "Risk Parity");

    private final String code;
    private final String description;

    BaselinePortfolio(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse from code string (e.g., "buy_and_hold", "risk_parity")
     */
    public static BaselinePortfolio fromCode(String code) {
        for (BaselinePortfolio baseline : values()) {
            if (baseline.code.equalsIgnoreCase(code) || baseline.name().equalsIgnoreCase(code)) {
                return baseline;
            }
        }
        throw new IllegalArgumentException("Unknown baseline portfolio: " + code);
    }
}
