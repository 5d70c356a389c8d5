package gap.detector.model;

public enum Criticality {
    MUST_DEFINE("must-define", "before implementation starts", 3),
    SHOULD_CONFIRM("should-confirm", "before design sign-off", 2),
    CAN_DECIDE_LATER("can-decide-later", "during implementation", 1);

    private final String label;
    private final String decisionTiming;
    private final int priority;

    Criticality(String label, String decisionTiming, int priority) {
        this.label = label;
        this.decisionTiming = decisionTiming;
        this.priority = priority;
    }

    public String label() {
        return label;
    }

    public String decisionTiming() {
        return decisionTiming;
    }

    public int priority() {
        return priority;
    }
}
