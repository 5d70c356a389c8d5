package gap.detector.classify;

import gap.detector.parse.CueSet;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword-vote classifier over the whole document text.
 * <p>
 * Each category scores one vote per distinct keyword present. The highest score wins;
 * ties go to the category declared first in {@link ActionType}.
 */
@Component
public class ActionTypeClassifier {
    static final double VOTES_FOR_FULL_CONFIDENCE = 3.0;

    // Independent of the parser's vocabulary so the classifier works on raw text alone.
    static final CueSet ENTITY_VOCABULARY = CueSet.of(
            "user", "product", "cart", "order", "payment", "account", "profile", "comment",
            "image", "file", "data", "information", "record", "item");

    public ActionClassification classify(String text) {
        String content = text == null ? "" : text;
        List<String> entities = ENTITY_VOCABULARY.termsIn(content);

        ActionType best = null;
        int bestVotes = 0;
        for (ActionType type : ActionType.values()) {
            if (!type.isKnown()) {
                continue;
            }
            int votes = type.keywords().countIn(content);
            if (votes > bestVotes) {
                best = type;
                bestVotes = votes;
            }
        }

        if (best == null) {
            return ActionClassification.unknown(entities);
        }
        return new ActionClassification(
                best,
                Math.min(bestVotes / VOTES_FOR_FULL_CONFIDENCE, 1.0),
                best.keywords().termsIn(content),
                best.baseSeverity(),
                entities,
                bestVotes
        );
    }

    public Map<ActionType, Integer> votes(String text) {
        String content = text == null ? "" : text;
        Map<ActionType, Integer> votes = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            if (type.isKnown()) {
                votes.put(type, type.keywords().countIn(content));
            }
        }
        return votes;
    }

    public List<String> criticalConcerns(ActionType type) {
        return type.criticalConcerns();
    }

    public double severityMultiplier(ActionType type) {
        return type.severityMultiplier();
    }
}
