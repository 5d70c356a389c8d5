package gap.detector.extract;

import gap.detector.model.Criticality;
import gap.detector.model.FindingCategory;
import gap.detector.model.Severity;
import gap.detector.model.UndefinedElement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record FindingStatistics(
        int total,
        Map<FindingCategory, Integer> byCategory,
        Map<Severity, Integer> bySeverity,
        Map<Criticality, Integer> byCriticality,
        Map<String, Integer> byConfidence
) {
    public static final String HIGH_CONFIDENCE = "high";
    public static final String MEDIUM_CONFIDENCE = "medium";
    public static final String LOW_CONFIDENCE = "low";

    public static FindingStatistics of(List<UndefinedElement> elements) {
        Map<FindingCategory, Integer> byCategory = new EnumMap<>(FindingCategory.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<Criticality, Integer> byCriticality = new EnumMap<>(Criticality.class);
        Map<String, Integer> byConfidence = new LinkedHashMap<>();
        byConfidence.put(HIGH_CONFIDENCE, 0);
        byConfidence.put(MEDIUM_CONFIDENCE, 0);
        byConfidence.put(LOW_CONFIDENCE, 0);

        for (UndefinedElement element : elements) {
            byCategory.merge(element.category(), 1, Integer::sum);
            bySeverity.merge(element.severity(), 1, Integer::sum);
            if (element.hasCriticality()) {
                byCriticality.merge(element.criticality().criticality(), 1, Integer::sum);
            }
            byConfidence.merge(band(element.detection().confidence()), 1, Integer::sum);
        }
        return new FindingStatistics(
                elements.size(),
                Collections.unmodifiableMap(byCategory),
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(byCriticality),
                Collections.unmodifiableMap(byConfidence)
        );
    }

    static String band(double confidence) {
        if (confidence >= 0.8) {
            return HIGH_CONFIDENCE;
        }
        if (confidence >= 0.6) {
            return MEDIUM_CONFIDENCE;
        }
        return LOW_CONFIDENCE;
    }

    public int count(FindingCategory category) {
        return byCategory.getOrDefault(category, 0);
    }

    public int count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0);
    }

    public int count(Criticality criticality) {
        return byCriticality.getOrDefault(criticality, 0);
    }

    public int highRiskCount() {
        return count(Severity.HIGH) + count(Severity.CRITICAL);
    }
}
