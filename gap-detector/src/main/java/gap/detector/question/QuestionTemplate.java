package gap.detector.question;

import java.util.List;

public record QuestionTemplate(String key, String text, List<String> suggestedAnswers) {
    public QuestionTemplate {
        suggestedAnswers = suggestedAnswers == null ? List.of() : List.copyOf(suggestedAnswers);
    }
}
