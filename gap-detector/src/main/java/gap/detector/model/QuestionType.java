package gap.detector.model;

public enum QuestionType {
    CLARIFICATION,
    SPECIFICATION,
    CONSTRAINT,
    EXCEPTION
}
