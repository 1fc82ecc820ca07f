package tw.gc.strategy.validation.enums;

/**
 * The validators a candidate runs through, in pipeline order.
 */
public enum ValidatorType {
    DATA_SPLIT("data_split"),
    WALK_FORWARD("walk_forward"),
    BONFERRONI("bonferroni"),
    BOOTSTRAP("bootstrap"),
    BASELINE("baseline");

    private final String code;

    ValidatorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ValidatorType fromCode(String code) {
        for (ValidatorType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown validator: " + code);
    }
}
