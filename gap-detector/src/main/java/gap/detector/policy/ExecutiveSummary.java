package gap.detector.policy;

import java.util.List;

public record ExecutiveSummary(
        Assessment assessment,
        int totalFindings,
        int mustDefineCount,
        int shouldConfirmCount,
        int canDecideLaterCount,
        int highRiskCount,
        double averageCompleteness,
        double averageAmbiguity,
        List<String> keyFindings
) {
    public ExecutiveSummary {
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
    }
}
