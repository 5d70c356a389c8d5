package gap.detector.parse;

import gap.detector.model.Action;
import gap.detector.model.Condition;
import gap.detector.model.ConditionType;
import gap.detector.model.Entity;
import gap.detector.model.ErrorHandling;
import gap.detector.model.Sentence;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Pairs entities and verbs into at most one action per sentence and attaches the
 * sentence's condition clauses as preconditions.
 * <p>
 * Extracted conditions are always marked ambiguous and undefined: the extractor cannot
 * tell whether the text states how a condition is evaluated.
 */
public class ActionExtractor {

    public List<Action> extract(List<Sentence> sentences, List<Entity> entities) {
        List<Action> actions = new ArrayList<>();
        for (Sentence sentence : sentences) {
            String text = sentence.text();
            for (ActionPattern pattern : ActionPattern.values()) {
                Matcher matcher = pattern.matcher(text);
                if (!matcher.find()) {
                    continue;
                }
                String objectText = pattern.object(matcher);
                actions.add(new Action(
                        String.format("A-%03d", actions.size() + 1),
                        sentence.id(),
                        verbOf(text),
                        resolveEntity(pattern.subject(matcher), entities),
                        objectText.isEmpty() ? null : resolveEntity(objectText, entities),
                        conditionsOf(text, entities),
                        new ErrorHandling(LexicalCues.ERROR_LANGUAGE.anyIn(text), false)
                ));
                break;
            }
        }
        return actions;
    }

    static String verbOf(String text) {
        return LexicalCues.VERBS.firstIn(text).map(Cue::term).orElse(LexicalCues.FALLBACK_VERB);
    }

    static String resolveEntity(String text, List<Entity> entities) {
        for (Entity entity : entities) {
            if (LexicalCues.entityCue(entity.name()).foundIn(text)) {
                return entity.id();
            }
        }
        return Action.UNKNOWN_ENTITY;
    }

    static List<Condition> conditionsOf(String text, List<Entity> entities) {
        List<Condition> conditions = new ArrayList<>();
        for (ConditionClause clause : ConditionClause.values()) {
            clause.find(text).ifPresent(description -> conditions.add(new Condition(
                    description,
                    ConditionType.PRECONDITION,
                    false,
                    true,
                    entityIdsIn(description, entities)
            )));
        }
        return conditions;
    }

    private static List<String> entityIdsIn(String text, List<Entity> entities) {
        return entities.stream()
                .filter(entity -> LexicalCues.entityCue(entity.name()).foundIn(text))
                .map(Entity::id)
                .toList();
    }
}
