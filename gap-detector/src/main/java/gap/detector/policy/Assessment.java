package gap.detector.policy;

public enum Assessment {
    CANNOT_START("Implementation cannot start: must-define decisions are open"),
    MANY_CONFIRMATIONS_NEEDED("Many decisions still need confirmation"),
    GOOD("Requirements are in good shape"),
    NEEDS_IMPROVEMENT("Requirements need improvement"),
    INSUFFICIENT("Requirements are insufficient");

    private final String description;

    Assessment(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
