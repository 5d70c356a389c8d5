package gap.detector.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Surface patterns for action extraction, tried in declaration order; the first match wins.
 */
enum ActionPattern {
    SUBJECT_MODAL_VERB_OBJECT(
            "^(.+?)\\s+(?:can|shall|will|must|should|is able to|are able to)\\s+(?:be able to\\s+)?"
                    + "[\\p{L}-]+\\s+(.+)$",
            1, 2),
    VERB_OBJECT(
            Cue.LEFT_EDGE + "(?:" + LexicalCues.ACTION_VERBS.alternation() + ")" + Cue.RIGHT_EDGE + "\\s+(.+)$",
            0, 1);

    private final Pattern pattern;
    private final int subjectGroup;
    private final int objectGroup;

    ActionPattern(String regex, int subjectGroup, int objectGroup) {
        this.pattern = Pattern.compile(regex, Cue.FLAGS);
        this.subjectGroup = subjectGroup;
        this.objectGroup = objectGroup;
    }

    Matcher matcher(String text) {
        return pattern.matcher(text);
    }

    String subject(Matcher matcher) {
        return subjectGroup == 0 ? "" : matcher.group(subjectGroup).strip();
    }

    String object(Matcher matcher) {
        return matcher.group(objectGroup).strip();
    }
}
