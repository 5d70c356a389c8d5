package gap.detector.checklist;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChecklistTemplate(
        @JsonProperty("action_type") String actionType,
        @JsonProperty("checklist") List<ChecklistItem> checklist
) {
    private static final ChecklistTemplate EMPTY = new ChecklistTemplate(null, List.of());

    public ChecklistTemplate {
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
    }

    public static ChecklistTemplate empty() {
        return EMPTY;
    }
}
