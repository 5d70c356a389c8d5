package gap.detector.model;

public enum DetectionMethod {
    RULE_BASED,
    TEMPLATE_DRIVEN,
    MODEL_BASED,
    SEMANTIC_ANALYSIS,
    PATTERN_MATCHING
}
