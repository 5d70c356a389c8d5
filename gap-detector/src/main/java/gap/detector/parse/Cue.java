package gap.detector.parse;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lexical cue matched as a whole word or phrase, case-insensitively, with simple
 * English inflection ({@code -s}, {@code -es}, {@code -d}, {@code -ed}, {@code -ing}).
 */
public final class Cue {
    static final String LEFT_EDGE = "(?<![\\p{L}\\p{N}])";
    static final String RIGHT_EDGE = "(?![\\p{L}\\p{N}])";
    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String term;
    private final String core;
    private final Pattern pattern;

    private Cue(String term, String core) {
        this.term = term;
        this.core = core;
        this.pattern = Pattern.compile(LEFT_EDGE + "(?:" + core + ")" + RIGHT_EDGE, FLAGS);
    }

    public static Cue of(String term) {
        String lower = term.toLowerCase(Locale.ROOT);
        StringBuilder core = new StringBuilder(Pattern.quote(lower)).append("(?:s|es|d|ed|ing)?");
        if (lower.length() > 2 && lower.endsWith("e")) {
            core.append('|').append(Pattern.quote(lower.substring(0, lower.length() - 1) + "ing"));
        }
        return new Cue(term, core.toString());
    }

    public static Cue exact(String term) {
        return new Cue(term, Pattern.quote(term.toLowerCase(Locale.ROOT)));
    }

    public String term() {
        return term;
    }

    String core() {
        return core;
    }

    public boolean foundIn(String text) {
        return text != null && pattern.matcher(text).find();
    }

    public Optional<MatchResult> firstMatch(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.toMatchResult()) : Optional.empty();
    }

    @Override
    public String toString() {
        return term;
    }
}
