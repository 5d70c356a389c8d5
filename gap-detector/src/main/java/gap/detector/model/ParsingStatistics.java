package gap.detector.model;

public record ParsingStatistics(
        int totalSentences,
        int totalEntities,
        int totalActions,
        int totalRequirements,
        double avgCompletenessScore,
        double avgAmbiguityScore
) {
    public static ParsingStatistics empty() {
        return new ParsingStatistics(0, 0, 0, 0, 0.0, 0.0);
    }
}
