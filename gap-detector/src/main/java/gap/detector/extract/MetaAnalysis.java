package gap.detector.extract;

import java.util.List;

public record MetaAnalysis(double overallCompleteness, List<String> criticalGaps, List<String> recommendations) {
    public MetaAnalysis {
        criticalGaps = criticalGaps == null ? List.of() : List.copyOf(criticalGaps);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
