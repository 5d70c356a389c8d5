package gap.detector.model;

import java.util.List;

public record Requirement(
        String id,
        String sentenceId,
        int lineNumber,
        String text,
        RequirementType type,
        double completenessScore,
        double ambiguityScore,
        List<String> relatedEntityIds,
        List<String> relatedActionIds,
        List<String> missingElements
) {
    public Requirement {
        if (completenessScore < 0.0 || completenessScore > 1.0) {
            throw new IllegalArgumentException("completenessScore out of range: " + completenessScore);
        }
        if (ambiguityScore < 0.0 || ambiguityScore > 1.0) {
            throw new IllegalArgumentException("ambiguityScore out of range: " + ambiguityScore);
        }
        relatedEntityIds = relatedEntityIds == null ? List.of() : List.copyOf(relatedEntityIds);
        relatedActionIds = relatedActionIds == null ? List.of() : List.copyOf(relatedActionIds);
        missingElements = missingElements == null ? List.of() : List.copyOf(missingElements);
    }
}
