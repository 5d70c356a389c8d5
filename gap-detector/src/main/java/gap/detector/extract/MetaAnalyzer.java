package gap.detector.extract;

import gap.detector.model.FindingCategory;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.UndefinedElement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class MetaAnalyzer {
    static final int MAX_CRITICAL_GAPS = 5;
    static final double AMBIGUITY_THRESHOLD = 0.6;
    static final double COMPLETENESS_THRESHOLD = 0.5;

    public MetaAnalysis analyze(ParsedRequirement parsed, List<UndefinedElement> elements) {
        double completeness = parsed.statistics().avgCompletenessScore();

        List<String> criticalGaps = new ArrayList<>();
        for (UndefinedElement element : elements) {
            if (criticalGaps.size() == MAX_CRITICAL_GAPS) {
                break;
            }
            if (element.severity().isHighRisk()) {
                criticalGaps.add(element.title());
            }
        }

        List<String> recommendations = new ArrayList<>();
        if (parsed.statistics().avgAmbiguityScore() > AMBIGUITY_THRESHOLD) {
            recommendations.add("Quantify non-functional requirements with concrete numeric targets.");
        }
        long errorHandlingGaps = elements.stream()
                .filter(e -> e.category() == FindingCategory.ERROR_HANDLING_MISSING)
                .count();
        if (errorHandlingGaps > 0) {
            recommendations.add("Error handling is missing in " + errorHandlingGaps
                    + " place(s). Review failure scenarios exhaustively.");
        }
        if (completeness < COMPLETENESS_THRESHOLD) {
            recommendations.add("Overall requirements detail is low. "
                    + "Clarify entity definitions, processing flow, and constraints.");
        }
        return new MetaAnalysis(completeness, criticalGaps, recommendations);
    }
}
