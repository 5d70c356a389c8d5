package gap.detector.parse;

import gap.detector.model.Action;
import gap.detector.model.Entity;
import gap.detector.model.ParsingStatistics;
import gap.detector.model.Requirement;
import gap.detector.model.RequirementType;
import gap.detector.model.Sentence;
import gap.detector.model.SentenceType;

import java.util.ArrayList;
import java.util.List;

public class RequirementScorer {
    static final double ENTITY_WEIGHT = 0.3;
    static final double VERB_WEIGHT = 0.3;
    // A condition that cannot be verified only earns partial credit.
    static final double CONDITION_WEIGHT = 0.1;
    static final double ERROR_WEIGHT = 0.2;

    static final double VAGUE_ADJECTIVE_WEIGHT = 0.2;
    static final double VAGUE_ADVERB_WEIGHT = 0.2;
    static final double OPEN_CONDITION_WEIGHT = 0.3;

    static final String MISSING_ERROR_BEHAVIOR = "behavior on error";
    static final String MISSING_DELETION = "whether deletion is supported";
    static final String MISSING_DATA_FORMAT = "data type and format";

    public List<Requirement> evaluate(List<Sentence> sentences, List<Entity> entities, List<Action> actions) {
        List<Requirement> requirements = new ArrayList<>();
        for (Sentence sentence : sentences) {
            if (sentence.type() != SentenceType.REQUIREMENT) {
                continue;
            }
            String text = sentence.text();
            requirements.add(new Requirement(
                    String.format("REQ-%03d", requirements.size() + 1),
                    sentence.id(),
                    sentence.lineNumber(),
                    text,
                    LexicalCues.NON_FUNCTIONAL.anyIn(text) ? RequirementType.NON_FUNCTIONAL : RequirementType.FUNCTIONAL,
                    completeness(text, entities),
                    ambiguity(text),
                    entities.stream()
                            .filter(entity -> LexicalCues.entityCue(entity.name()).foundIn(text))
                            .map(Entity::id)
                            .toList(),
                    actions.stream()
                            .filter(action -> sentence.id().equals(action.sentenceId()))
                            .map(Action::id)
                            .toList(),
                    missingElements(text)
            ));
        }
        return requirements;
    }

    public double completeness(String text, List<Entity> entities) {
        double score = 0.0;
        if (entities.stream().anyMatch(entity -> LexicalCues.entityCue(entity.name()).foundIn(text))) {
            score += ENTITY_WEIGHT;
        }
        if (LexicalCues.ACTION_VERBS.anyIn(text) || LexicalCues.CAPABILITY.anyIn(text)) {
            score += VERB_WEIGHT;
        }
        if (LexicalCues.CONDITION_MARKERS.anyIn(text)) {
            score += CONDITION_WEIGHT;
        }
        if (LexicalCues.ERROR_LANGUAGE.anyIn(text)) {
            score += ERROR_WEIGHT;
        }
        return clip(score);
    }

    public double ambiguity(String text) {
        double score = LexicalCues.VAGUE_ADJECTIVES.countIn(text) * VAGUE_ADJECTIVE_WEIGHT
                + LexicalCues.VAGUE_ADVERBS.countIn(text) * VAGUE_ADVERB_WEIGHT;
        if (LexicalCues.CONDITION_MARKERS.anyIn(text) && !LexicalCues.hasComparison(text)) {
            score += OPEN_CONDITION_WEIGHT;
        }
        return clip(score);
    }

    public List<String> missingElements(String text) {
        List<String> missing = new ArrayList<>();
        if (LexicalCues.CAN.anyIn(text) && !LexicalCues.ERROR_LANGUAGE.anyIn(text)) {
            missing.add(MISSING_ERROR_BEHAVIOR);
        }
        if (LexicalCues.CREATE_VERBS.anyIn(text) && !LexicalCues.DELETE.anyIn(text)) {
            missing.add(MISSING_DELETION);
        }
        if (LexicalCues.DATA_WORDS.anyIn(text) && !LexicalCues.TYPE_WORDS.anyIn(text)) {
            missing.add(MISSING_DATA_FORMAT);
        }
        return missing;
    }

    public ParsingStatistics statistics(List<Sentence> sentences, List<Entity> entities,
                                        List<Action> actions, List<Requirement> requirements) {
        double avgCompleteness = requirements.stream().mapToDouble(Requirement::completenessScore).average().orElse(0.0);
        double avgAmbiguity = requirements.stream().mapToDouble(Requirement::ambiguityScore).average().orElse(0.0);
        return new ParsingStatistics(
                sentences.size(),
                entities.size(),
                actions.size(),
                requirements.size(),
                round(avgCompleteness),
                round(avgAmbiguity)
        );
    }

    private static double clip(double score) {
        return Math.max(0.0, Math.min(1.0, round(score)));
    }

    static double round(double score) {
        return Math.round(score * 100.0) / 100.0;
    }
}
