package gap.detector.model;

public enum FindingCategory {
    ACTION_TYPE_CHECKLIST("action-type checklist"),
    DATA_DEFINITION_MISSING("missing data definition"),
    BEHAVIOR_AMBIGUITY("behavioral ambiguity"),
    ERROR_HANDLING_MISSING("missing error handling"),
    NON_FUNCTIONAL_AMBIGUITY("non-functional ambiguity"),
    UNKNOWN_TERM("unknown term");

    private final String label;

    FindingCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
