package gap.detector.model;

public record FindingContext(String sourceText, String surroundingText, String sentenceId, int lineNumber) {
    public FindingContext {
        sourceText = sourceText == null ? "" : sourceText;
        surroundingText = surroundingText == null ? "" : surroundingText;
        lineNumber = Math.max(1, lineNumber);
    }

    public static FindingContext of(String sourceText, Sentence sentence) {
        if (sentence == null) {
            return new FindingContext(sourceText, "", null, 1);
        }
        return new FindingContext(sourceText, sentence.text(), sentence.id(), sentence.lineNumber());
    }
}
