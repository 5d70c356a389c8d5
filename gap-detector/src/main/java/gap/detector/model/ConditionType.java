package gap.detector.model;

public enum ConditionType {
    PRECONDITION,
    POSTCONDITION,
    INVARIANT
}
