package gap.detector.parse;

import gap.detector.model.Action;
import gap.detector.model.Condition;
import gap.detector.model.ConditionType;
import gap.detector.model.Entity;
import gap.detector.model.Sentence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionExtractorTest {
    private final SentenceSegmenter segmenter = new SentenceSegmenter();
    private final EntityRecognizer recognizer = new EntityRecognizer();
    private final ActionExtractor extractor = new ActionExtractor();

    private List<Action> extract(String content) {
        List<Sentence> sentences = segmenter.segment(content);
        List<Entity> entities = recognizer.recognize(content, sentences);
        return extractor.extract(sentences, entities);
    }

    @Test
    void shouldPairSubjectAndObjectAroundModal() {
        List<Action> actions = extract("The customer can register the product.");

        assertEquals(1, actions.size());
        Action action = actions.get(0);
        assertEquals("A-001", action.id());
        assertEquals("S-001", action.sentenceId());
        assertEquals("register", action.verb());
        assertEquals("E-001", action.subjectId());
        assertEquals("E-002", action.objectId());
    }

    @Test
    void shouldFallBackToVerbObjectWithUnknownSubject() {
        Action action = extract("Delete the order.").get(0);

        assertEquals("delete", action.verb());
        assertEquals(Action.UNKNOWN_ENTITY, action.subjectId());
        assertEquals("E-001", action.objectId());
    }

    @Test
    void shouldUseFallbackVerbAndUnknownSentinel() {
        Action action = extract("The report will summarise the month.").get(0);

        assertEquals("process", action.verb());
        assertEquals(Action.UNKNOWN_ENTITY, action.subjectId());
        assertEquals(Action.UNKNOWN_ENTITY, action.objectId());
    }

    @Test
    void shouldExtractAtMostOneActionPerSentence() {
        List<Action> actions = extract("The user must delete the item and show the cart. Nothing happens here.");

        assertEquals(1, actions.size());
        assertEquals("delete", actions.get(0).verb());
    }

    @Test
    void shouldMarkEveryConditionAmbiguousAndUndefined() {
        Action action = extract("When the cart is empty, the user can add an item.").get(0);

        assertEquals(1, action.preconditions().size());
        Condition condition = action.preconditions().get(0);
        assertEquals("the cart is empty", condition.description());
        assertEquals(ConditionType.PRECONDITION, condition.type());
        assertTrue(condition.ambiguous());
        assertFalse(condition.defined());
        assertEquals(1, condition.entityIds().size());
    }

    @Test
    void shouldFlagErrorLanguageAsMentionedButNotDefined() {
        Action action = extract("The user can update the account unless an error occurs.").get(0);

        assertTrue(action.errorHandling().mentioned());
        assertFalse(action.errorHandling().defined());
    }

    @Test
    void shouldReadCaseClausesWithAndWithoutArticle() {
        Action withArticle = extract("In the case of a timeout, the user can retry the order.").get(0);
        Action withoutArticle = extract("In case of failure, the user can retry the order.").get(0);

        assertEquals(List.of("a timeout"),
                withArticle.preconditions().stream().map(Condition::description).toList());
        assertEquals(List.of("failure"),
                withoutArticle.preconditions().stream().map(Condition::description).toList());
    }
}
