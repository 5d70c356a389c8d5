package gap.detector.question;

import gap.detector.checklist.ChecklistContext;
import gap.detector.checklist.ChecklistItem;
import gap.detector.checklist.ChecklistOption;
import gap.detector.model.Affects;
import gap.detector.model.Criticality;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class QuestionGenerator {

    public PracticalQuestion generateQuestion(ChecklistItem item, ChecklistContext context) {
        ChecklistContext ctx = context == null ? ChecklistContext.empty() : context;
        Optional<QuestionTemplate> template = QuestionTemplates.find(item.questionTemplateKey());

        return new PracticalQuestion(
                item.id(),
                item.title(),
                questionText(item, template, ctx),
                item.options(),
                explanation(item),
                item.criticality() == null ? Criticality.SHOULD_CONFIRM : item.criticality(),
                whoToAsk(item),
                item.examples(),
                ctx.fill(item.defaultAssumption()),
                suggestedAnswers(item, template)
        );
    }

    public List<PracticalQuestion> generateAll(List<ChecklistItem> items, ChecklistContext context) {
        List<PracticalQuestion> questions = new ArrayList<>(items.size());
        for (ChecklistItem item : items) {
            questions.add(generateQuestion(item, context));
        }
        return questions;
    }

    private static String questionText(ChecklistItem item, Optional<QuestionTemplate> template,
                                       ChecklistContext context) {
        if (item.questionTemplate() != null && !item.questionTemplate().isBlank()) {
            return context.fill(item.questionTemplate());
        }
        if (template.isPresent()) {
            return context.fill(template.get().text());
        }
        if (item.question() != null && !item.question().isBlank()) {
            return context.fill(item.question());
        }
        return item.title();
    }

    private static String explanation(ChecklistItem item) {
        List<String> parts = new ArrayList<>();
        if (hasText(item.whyCritical())) {
            parts.add("Why it matters:\n" + item.whyCritical());
        }
        if (hasText(item.changeCostIfLater())) {
            parts.add("Cost of changing later:\n" + item.changeCostIfLater());
        }
        if (hasText(item.whyOptional())) {
            parts.add("Note:\n" + item.whyOptional());
        }
        return String.join("\n\n", parts);
    }

    static String whoToAsk(ChecklistItem item) {
        Affects affects = item.affects();
        if (affects.security()) {
            return "security team and line manager";
        }
        if (affects.dataModel()) {
            return "product owner and architect";
        }
        if (affects.externalSystem()) {
            return "integration owner and infrastructure team";
        }
        if (item.criticality() == Criticality.MUST_DEFINE) {
            return "product owner and line manager";
        }
        if (item.criticality() == Criticality.SHOULD_CONFIRM) {
            return "product owner";
        }
        return "the team can decide";
    }

    private static List<String> suggestedAnswers(ChecklistItem item, Optional<QuestionTemplate> template) {
        if (!item.options().isEmpty()) {
            List<String> labels = new ArrayList<>();
            for (ChecklistOption option : item.options()) {
                labels.add(option.label());
            }
            return labels;
        }
        return template.map(QuestionTemplate::suggestedAnswers).orElse(List.of());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
