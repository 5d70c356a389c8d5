package gap.detector.model;

public enum RequirementType {
    FUNCTIONAL,
    NON_FUNCTIONAL
}
