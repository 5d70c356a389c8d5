package gap.detector.service;

import gap.detector.model.ParsingStatistics;

public record ParsingSummary(String documentId, String parserVersion, ParsingStatistics statistics) {}
