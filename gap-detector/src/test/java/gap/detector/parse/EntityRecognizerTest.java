package gap.detector.parse;

import gap.detector.model.Attribute;
import gap.detector.model.DefinitionStatus;
import gap.detector.model.Entity;
import gap.detector.model.EntityKind;
import gap.detector.model.Sentence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityRecognizerTest {
    private final SentenceSegmenter segmenter = new SentenceSegmenter();
    private final EntityRecognizer recognizer = new EntityRecognizer();

    private List<Entity> recognize(String content) {
        List<Sentence> sentences = segmenter.segment(content);
        return recognizer.recognize(content, sentences);
    }

    @Test
    void shouldRecognizeVocabularyEntitiesInVocabularyOrder() {
        List<Entity> entities = recognize("The product is paid by payment. Customers view the product.");

        assertEquals(List.of("customer", "product", "payment"), entities.stream().map(Entity::name).toList());
        assertEquals("E-001", entities.get(0).id());
        assertEquals(EntityKind.ACTOR, entities.get(0).kind());
        assertEquals(EntityKind.OBJECT, entities.get(1).kind());
        assertEquals(EntityKind.DATA, entities.get(2).kind());
    }

    @Test
    void shouldCollectOneMentionPerSentence() {
        Entity product = recognize("The product is paid by payment. Customers view the product.").get(1);

        assertEquals(2, product.mentions().size());
        assertEquals("S-001", product.mentions().get(0).sentenceId());
        assertEquals(4, product.mentions().get(0).position());
        assertEquals("S-002", product.mentions().get(1).sentenceId());
    }

    @Test
    void shouldStartUndefinedWithDefaultAmbiguity() {
        Entity user = recognize("A user signs in.").get(0);

        assertEquals(DefinitionStatus.UNDEFINED, user.definitionStatus());
        assertEquals(0.7, user.ambiguityScore());
    }

    @Test
    void shouldNotMatchInsideOtherWords() {
        assertTrue(recognize("The username field is shown.").isEmpty());
    }

    @Test
    void shouldTrackMentionedAndDefinedAttributes() {
        List<Entity> entities = recognize(
                "The user's email is a string of at most 255 characters. The user can change the name of the user.");

        List<Attribute> attributes = entities.get(0).attributes();
        assertEquals(List.of("name", "email"), attributes.stream().map(Attribute::name).toList());

        Attribute name = attributes.get(0);
        assertTrue(name.mentioned());
        assertFalse(name.defined());
        assertEquals("S-002", name.sentenceId());

        Attribute email = attributes.get(1);
        assertTrue(email.defined());
        assertEquals("S-001", email.sentenceId());
    }

    @Test
    void shouldShareAttributePatternsAcrossCalls() {
        assertSame(LexicalCues.attributeCues("customer"), LexicalCues.attributeCues("customer"));

        Attribute address = recognize("The address of each customer is required.").get(0).attributes().get(0);
        assertEquals("address", address.name());
        assertFalse(address.defined());
    }
}
