package gap.detector.model;

import java.util.List;

public record Question(String text, QuestionType type, List<String> suggestedAnswers, String reference) {
    public Question {
        suggestedAnswers = suggestedAnswers == null ? List.of() : List.copyOf(suggestedAnswers);
    }

    public static Question of(String text, QuestionType type, String... suggestedAnswers) {
        return new Question(text, type, List.of(suggestedAnswers), null);
    }
}
