package gap.detector.model;

public enum SentenceType {
    REQUIREMENT,
    CONSTRAINT,
    EXPLANATION,
    EXAMPLE
}
