package gap.detector.parse;

import gap.detector.model.Entity;
import gap.detector.model.ParsingStatistics;
import gap.detector.model.Requirement;
import gap.detector.model.RequirementType;
import gap.detector.model.Sentence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequirementScorerTest {
    private final SentenceSegmenter segmenter = new SentenceSegmenter();
    private final EntityRecognizer recognizer = new EntityRecognizer();
    private final RequirementScorer scorer = new RequirementScorer();

    @Test
    void shouldAddCompletenessChecks() {
        String text = "The user can add an item if stock remains, otherwise an error is shown";
        List<Entity> entities = recognizer.recognize(text, segmenter.segment(text));

        assertEquals(0.9, scorer.completeness(text, entities));
        assertEquals(0.0, scorer.completeness("Nothing relevant here", List.of()));
    }

    @Test
    void shouldScoreVagueWordingAndOpenConditions() {
        assertEquals(0.9, scorer.ambiguity(
                "When many users access the system, it shall operate fast and respond quickly"));
        assertEquals(0.6, scorer.ambiguity("The page should be fast, large and show many rows"));
        assertEquals(0.0, scorer.ambiguity("If the amount is more than 100, reject the order"));
    }

    @Test
    void shouldClipAmbiguityAtOne() {
        assertEquals(1.0, scorer.ambiguity("fast slow large small many few quickly promptly"));
    }

    @Test
    void shouldNameMissingElements() {
        assertEquals(
                List.of("behavior on error", "whether deletion is supported", "data type and format"),
                scorer.missingElements("The user can add data"));
        assertTrue(scorer.missingElements("The user can delete data of any type on error").isEmpty());
    }

    @Test
    void shouldOnlyScoreRequirementSentencesAndAverageThem() {
        String content = "The user can add an item. The system shall operate fast. Orders are listed here.";
        List<Sentence> sentences = segmenter.segment(content);
        List<Entity> entities = recognizer.recognize(content, sentences);

        List<Requirement> requirements = scorer.evaluate(sentences, entities, List.of());
        ParsingStatistics statistics = scorer.statistics(sentences, entities, List.of(), requirements);

        assertEquals(2, requirements.size());
        assertEquals("REQ-001", requirements.get(0).id());
        assertEquals(RequirementType.FUNCTIONAL, requirements.get(0).type());
        assertEquals(RequirementType.NON_FUNCTIONAL, requirements.get(1).type());
        assertEquals(3, statistics.totalSentences());
        assertEquals(2, statistics.totalRequirements());
        double expected = (requirements.get(0).completenessScore() + requirements.get(1).completenessScore()) / 2;
        assertEquals(expected, statistics.avgCompletenessScore(), 1e-9);
    }

    @Test
    void shouldCreditAndPenaliseCaseClauses() {
        String text = "In the case of a timeout, the user can retry the order.";
        List<Entity> entities = recognizer.recognize(text, segmenter.segment(text));

        assertEquals(0.7, scorer.completeness(text, entities));
        assertEquals(0.3, scorer.ambiguity(text));
    }

    @Test
    void shouldRoundAveragesToTwoDecimals() {
        List<Requirement> requirements = List.of(
                requirement("REQ-001", 0.3, 0.2),
                requirement("REQ-002", 0.3, 0.2),
                requirement("REQ-003", 0.4, 0.0));

        ParsingStatistics statistics = scorer.statistics(List.of(), List.of(), List.of(), requirements);

        assertEquals(0.33, statistics.avgCompletenessScore());
        assertEquals(0.13, statistics.avgAmbiguityScore());
    }

    private static Requirement requirement(String id, double completeness, double ambiguity) {
        return new Requirement(id, "S-001", 1, "text", RequirementType.FUNCTIONAL, completeness, ambiguity,
                null, null, null);
    }
}
