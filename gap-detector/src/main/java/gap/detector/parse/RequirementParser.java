package gap.detector.parse;

import gap.detector.model.Action;
import gap.detector.model.Document;
import gap.detector.model.DocumentMetadata;
import gap.detector.model.Entity;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.Requirement;
import gap.detector.model.Sentence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Component
public class RequirementParser {
    private static final Logger log = LoggerFactory.getLogger(RequirementParser.class);
    public static final String VERSION = "1.0.0";

    private final SentenceSegmenter segmenter = new SentenceSegmenter();
    private final EntityRecognizer entityRecognizer = new EntityRecognizer();
    private final ActionExtractor actionExtractor = new ActionExtractor();
    private final RequirementScorer scorer = new RequirementScorer();

    public ParsedRequirement parse(String text, DocumentMetadata metadata) {
        return parse(new Document(text, metadata));
    }

    public ParsedRequirement parse(String text) {
        return parse(Document.of(text));
    }

    public ParsedRequirement parse(Document document) {
        String content = document.content();
        List<Sentence> sentences = segmenter.segment(content);
        List<Entity> entities = entityRecognizer.recognize(content, sentences);
        List<Action> actions = actionExtractor.extract(sentences, entities);
        List<Requirement> requirements = scorer.evaluate(sentences, entities, actions);

        ParsedRequirement parsed = new ParsedRequirement(
                newDocumentId(),
                Instant.now(),
                VERSION,
                document,
                sentences,
                entities,
                actions,
                requirements,
                scorer.statistics(sentences, entities, actions, requirements)
        );
        log.debug("Parsed {}: sentences={} entities={} actions={} requirements={}",
                parsed.documentId(), sentences.size(), entities.size(), actions.size(), requirements.size());
        return parsed;
    }

    private static String newDocumentId() {
        return "DOC-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
