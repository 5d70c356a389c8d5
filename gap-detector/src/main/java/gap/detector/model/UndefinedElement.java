package gap.detector.model;

import java.util.List;
import java.util.Objects;

public record UndefinedElement(
        String id,
        FindingCategory category,
        String subcategory,
        String relatedEntityId,
        String relatedActionId,
        String relatedRequirementId,
        String title,
        String description,
        List<Question> questions,
        Detection detection,
        FindingContext context,
        Severity severity,
        CriticalityResult criticality
) {
    public UndefinedElement {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(detection, "detection");
        if (questions == null || questions.isEmpty()) {
            throw new IllegalArgumentException("finding " + id + " needs at least one question");
        }
        questions = List.copyOf(questions);
        subcategory = subcategory == null ? "" : subcategory;
        description = description == null ? "" : description;
        context = context == null ? new FindingContext("", "", null, 1) : context;
        severity = severity == null ? Severity.MEDIUM : severity;
    }

    public UndefinedElement withId(String newId) {
        return new UndefinedElement(newId, category, subcategory, relatedEntityId, relatedActionId,
                relatedRequirementId, title, description, questions, detection, context, severity, criticality);
    }

    public boolean hasCriticality() {
        return criticality != null;
    }
}
