package gap.detector.service;

import gap.detector.classify.ActionClassification;
import gap.detector.extract.MetaAnalysis;
import gap.detector.extract.UndefinedElementSet;
import gap.detector.policy.ExecutiveSummary;

import java.time.Instant;

public record AnalysisReport(
        String reportId,
        Instant generatedAt,
        String systemVersion,
        ActionClassification classification,
        ParsingSummary parsing,
        UndefinedElementSet findings,
        ExecutiveSummary executiveSummary,
        MetaAnalysis metaAnalysis
) {}
