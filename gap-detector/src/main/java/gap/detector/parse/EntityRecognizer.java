package gap.detector.parse;

import gap.detector.model.Attribute;
import gap.detector.model.DefinitionStatus;
import gap.detector.model.Entity;
import gap.detector.model.Mention;
import gap.detector.model.Sentence;

import java.util.ArrayList;
import java.util.List;

public class EntityRecognizer {
    static final double DEFAULT_AMBIGUITY = 0.7;

    public List<Entity> recognize(String content, List<Sentence> sentences) {
        List<Entity> entities = new ArrayList<>();
        for (String term : LexicalCues.entityTerms()) {
            Cue cue = LexicalCues.entityCue(term);
            if (!cue.foundIn(content)) {
                continue;
            }
            List<Mention> mentions = new ArrayList<>();
            for (Sentence sentence : sentences) {
                cue.firstMatch(sentence.text()).ifPresent(match ->
                        mentions.add(new Mention(sentence.id(), match.group(), match.start())));
            }
            entities.add(new Entity(
                    String.format("E-%03d", entities.size() + 1),
                    term,
                    LexicalCues.kindOf(term),
                    attributesOf(term, sentences),
                    mentions,
                    DefinitionStatus.UNDEFINED,
                    DEFAULT_AMBIGUITY
            ));
        }
        return entities;
    }

    private static List<Attribute> attributesOf(String entityName, List<Sentence> sentences) {
        List<Attribute> attributes = new ArrayList<>();
        for (AttributeCue attribute : LexicalCues.attributeCues(entityName)) {
            String firstSentenceId = null;
            boolean defined = false;
            for (Sentence sentence : sentences) {
                String text = sentence.text();
                if (attribute.foundIn(text)) {
                    if (firstSentenceId == null) {
                        firstSentenceId = sentence.id();
                    }
                    defined |= LexicalCues.FORMAT_CUES.anyIn(text);
                }
            }
            if (firstSentenceId != null) {
                attributes.add(new Attribute(attribute.term(), true, defined, firstSentenceId));
            }
        }
        return attributes;
    }
}
