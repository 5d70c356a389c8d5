package gap.detector.extract;

import gap.detector.classify.ActionClassification;
import gap.detector.model.UndefinedElement;

import java.time.Instant;
import java.util.List;

public record UndefinedElementSet(
        String documentId,
        Instant analyzedAt,
        String extractorVersion,
        ActionClassification classification,
        List<UndefinedElement> elements,
        FindingStatistics statistics,
        MetaAnalysis metaAnalysis,
        String detectorStatus
) {
    public UndefinedElementSet {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }
}
