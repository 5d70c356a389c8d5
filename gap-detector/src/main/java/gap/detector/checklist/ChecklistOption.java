package gap.detector.checklist;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChecklistOption(
        @JsonProperty("value") String value,
        @JsonProperty("label") String label,
        @JsonProperty("pros") List<String> pros,
        @JsonProperty("cons") List<String> cons,
        @JsonProperty("implementation") String implementation,
        @JsonProperty("warning") String warning
) {
    public ChecklistOption {
        value = value == null ? "" : value;
        label = label == null ? value : label;
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
    }
}
