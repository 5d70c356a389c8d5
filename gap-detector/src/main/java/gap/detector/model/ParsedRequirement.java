package gap.detector.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record ParsedRequirement(
        String documentId,
        Instant parsedAt,
        String parserVersion,
        Document document,
        List<Sentence> sentences,
        List<Entity> entities,
        List<Action> actions,
        List<Requirement> requirements,
        ParsingStatistics statistics
) {
    public ParsedRequirement {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(document, "document");
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        entities = entities == null ? List.of() : List.copyOf(entities);
        actions = actions == null ? List.of() : List.copyOf(actions);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        statistics = statistics == null ? ParsingStatistics.empty() : statistics;
    }

    public String content() {
        return document.content();
    }
}
