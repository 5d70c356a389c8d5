package gap.detector.model;

public enum EntityKind {
    ACTOR,
    OBJECT,
    DATA,
    SYSTEM
}
