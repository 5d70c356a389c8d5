package gap.detector.parse;

import gap.detector.model.Sentence;
import gap.detector.model.SentenceType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class SentenceSegmenter {
    // ASCII terminators only end a sentence before whitespace or line end, so "1.5" stays whole.
    static final Pattern TERMINATOR = Pattern.compile("[.!?](?=\\s|$)|[。！？]");
    private static final String COMMENT_PREFIX = "#";

    public List<Sentence> segment(String content) {
        List<Sentence> sentences = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return sentences;
        }

        int lineStart = 0;
        int lineNumber = 0;
        for (String line : content.split("\n", -1)) {
            lineNumber++;
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                int segmentStart = 0;
                Matcher matcher = TERMINATOR.matcher(line);
                while (matcher.find()) {
                    addSegment(sentences, line, segmentStart, matcher.start(), lineNumber, lineStart);
                    segmentStart = matcher.end();
                }
                addSegment(sentences, line, segmentStart, line.length(), lineNumber, lineStart);
            }
            lineStart += line.length() + 1;
        }
        return sentences;
    }

    private static void addSegment(List<Sentence> sentences, String line, int from, int to,
                                   int lineNumber, int lineStart) {
        String raw = line.substring(from, to);
        String text = raw.strip();
        if (text.isEmpty()) {
            return;
        }
        int start = lineStart + from + raw.indexOf(text);
        sentences.add(new Sentence(
                String.format("S-%03d", sentences.size() + 1),
                text,
                lineNumber,
                start,
                start + text.length(),
                classify(text)
        ));
    }

    public static SentenceType classify(String text) {
        if (LexicalCues.CAPABILITY.anyIn(text)) {
            return SentenceType.REQUIREMENT;
        }
        if (LexicalCues.OBLIGATION.anyIn(text)) {
            return SentenceType.CONSTRAINT;
        }
        if (LexicalCues.EXAMPLE_MARKERS.anyIn(text)) {
            return SentenceType.EXAMPLE;
        }
        return SentenceType.EXPLANATION;
    }
}
