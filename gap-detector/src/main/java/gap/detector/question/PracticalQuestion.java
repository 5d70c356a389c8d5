package gap.detector.question;

import gap.detector.checklist.ChecklistOption;
import gap.detector.model.Criticality;

import java.util.List;

public record PracticalQuestion(
        String elementId,
        String title,
        String question,
        List<ChecklistOption> options,
        String explanation,
        Criticality urgency,
        String whoToAsk,
        List<String> examples,
        String defaultAssumption,
        List<String> suggestedAnswers
) {
    public PracticalQuestion {
        options = options == null ? List.of() : List.copyOf(options);
        examples = examples == null ? List.of() : List.copyOf(examples);
        suggestedAnswers = suggestedAnswers == null ? List.of() : List.copyOf(suggestedAnswers);
        explanation = explanation == null ? "" : explanation;
    }
}
