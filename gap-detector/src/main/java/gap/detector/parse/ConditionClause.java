package gap.detector.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Condition markers, tried in declaration order. Each marker contributes at most one clause,
 * which runs up to the next comma or the end of the sentence.
 */
enum ConditionClause {
    IN_CASE("in\\s+(?:the\\s+)?case(?:\\s+of|\\s+that)?"),
    WHEN("when(?:ever)?"),
    ON_THE_OCCASION("on the occasion of"),
    IF("if");

    private final Pattern pattern;

    ConditionClause(String marker) {
        this.pattern = Pattern.compile(Cue.LEFT_EDGE + marker + "\\s+([^,]+)", Cue.FLAGS);
    }

    Optional<String> find(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String clause = matcher.group(1).strip();
        return clause.isEmpty() ? Optional.empty() : Optional.of(clause);
    }
}
