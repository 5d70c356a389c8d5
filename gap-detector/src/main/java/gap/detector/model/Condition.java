package gap.detector.model;

import java.util.List;

public record Condition(
        String description,
        ConditionType type,
        boolean defined,
        boolean ambiguous,
        List<String> entityIds
) {
    public Condition {
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
    }
}
