package gap.detector.parse;

import java.util.List;
import java.util.regex.Pattern;

final class AttributeCue {
    private final String term;
    private final Pattern possessive;
    private final Pattern ofForm;

    private AttributeCue(Cue entity, Cue attribute) {
        this.term = attribute.term();
        this.possessive = Pattern.compile(Cue.LEFT_EDGE + "(?:" + entity.core() + ")(?:'s)?\\s+(?:"
                + attribute.core() + ")" + Cue.RIGHT_EDGE, Cue.FLAGS);
        this.ofForm = Pattern.compile(Cue.LEFT_EDGE + "(?:" + attribute.core()
                + ")\\s+of\\s+(?:the\\s+|a\\s+|an\\s+|each\\s+)?(?:" + entity.core() + ")" + Cue.RIGHT_EDGE,
                Cue.FLAGS);
    }

    static List<AttributeCue> forEntity(Cue entity) {
        return LexicalCues.ATTRIBUTES.cues().stream()
                .map(attribute -> new AttributeCue(entity, attribute))
                .toList();
    }

    String term() {
        return term;
    }

    boolean foundIn(String text) {
        return text != null && (possessive.matcher(text).find() || ofForm.matcher(text).find());
    }
}
