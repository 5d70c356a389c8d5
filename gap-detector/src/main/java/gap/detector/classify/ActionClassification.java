package gap.detector.classify;

import gap.detector.model.Severity;

import java.util.List;
import java.util.Objects;

public record ActionClassification(
        ActionType actionType,
        double confidence,
        List<String> matchedKeywords,
        Severity baseSeverity,
        List<String> detectedEntities,
        int votes
) {
    public ActionClassification {
        Objects.requireNonNull(actionType, "actionType");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        detectedEntities = detectedEntities == null ? List.of() : List.copyOf(detectedEntities);
        baseSeverity = baseSeverity == null ? actionType.baseSeverity() : baseSeverity;
    }

    public static ActionClassification unknown(List<String> detectedEntities) {
        return new ActionClassification(ActionType.UNKNOWN, 0.0, List.of(), Severity.LOW, detectedEntities, 0);
    }

    public boolean isKnown() {
        return actionType.isKnown();
    }
}
