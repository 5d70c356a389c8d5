package gap.detector.model;

public enum DefinitionStatus {
    DEFINED,
    PARTIALLY_DEFINED,
    UNDEFINED
}
