package gap.detector.extract;

import gap.detector.model.Detection;
import gap.detector.model.DetectionMethod;
import gap.detector.model.Document;
import gap.detector.model.FindingCategory;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.ParsingStatistics;
import gap.detector.model.Question;
import gap.detector.model.QuestionType;
import gap.detector.model.Severity;
import gap.detector.model.UndefinedElement;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetaAnalyzerTest {
    private final MetaAnalyzer analyzer = new MetaAnalyzer();

    private static ParsedRequirement parsed(double completeness, double ambiguity) {
        return new ParsedRequirement("DOC-TEST", Instant.now(), "1.0.0", Document.of("text"),
                List.of(), List.of(), List.of(), List.of(),
                new ParsingStatistics(1, 0, 0, 1, completeness, ambiguity));
    }

    private static UndefinedElement element(int n, FindingCategory category, Severity severity) {
        return new UndefinedElement(String.format("UE-%03d", n), category, "", null, null, null,
                "Finding " + n, "", List.of(Question.of("?", QuestionType.CLARIFICATION)),
                new Detection(DetectionMethod.RULE_BASED, 0.8, ""), null, severity, null);
    }

    @Test
    void shouldListAtMostFiveHighRiskTitlesInEmissionOrder() {
        List<UndefinedElement> elements = new ArrayList<>();
        elements.add(element(1, FindingCategory.DATA_DEFINITION_MISSING, Severity.MEDIUM));
        for (int n = 2; n <= 8; n++) {
            elements.add(element(n, FindingCategory.BEHAVIOR_AMBIGUITY, n % 2 == 0 ? Severity.HIGH : Severity.CRITICAL));
        }

        MetaAnalysis analysis = analyzer.analyze(parsed(0.8, 0.1), elements);

        assertEquals(List.of("Finding 2", "Finding 3", "Finding 4", "Finding 5", "Finding 6"), analysis.criticalGaps());
        assertTrue(analysis.recommendations().isEmpty());
        assertEquals(0.8, analysis.overallCompleteness());
    }

    @Test
    void shouldAccumulateRecommendationsInRuleOrder() {
        List<UndefinedElement> elements = List.of(
                element(1, FindingCategory.ERROR_HANDLING_MISSING, Severity.MEDIUM),
                element(2, FindingCategory.ERROR_HANDLING_MISSING, Severity.MEDIUM));

        MetaAnalysis analysis = analyzer.analyze(parsed(0.3, 0.7), elements);

        assertEquals(List.of(
                "Quantify non-functional requirements with concrete numeric targets.",
                "Error handling is missing in 2 place(s). Review failure scenarios exhaustively.",
                "Overall requirements detail is low. Clarify entity definitions, processing flow, and constraints."
        ), analysis.recommendations());
    }

    @Test
    void shouldKeepBoundaryValuesOutOfRecommendations() {
        MetaAnalysis analysis = analyzer.analyze(parsed(0.5, 0.6), List.of());

        assertTrue(analysis.recommendations().isEmpty());
        assertTrue(analysis.criticalGaps().isEmpty());
    }
}
