package gap.detector.model;

public record Sentence(
        String id,
        String text,
        int lineNumber,
        int startChar,
        int endChar,
        SentenceType type
) {}
