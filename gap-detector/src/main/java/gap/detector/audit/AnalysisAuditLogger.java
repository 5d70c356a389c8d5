package gap.detector.audit;

import gap.detector.extract.UndefinedElementSet;
import gap.detector.model.ParsedRequirement;
import gap.detector.policy.ExecutiveSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnalysisAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AnalysisAuditLogger.class);

    public void logAnalysis(
            String reportId,
            ParsedRequirement parsed,
            UndefinedElementSet findings,
            ExecutiveSummary summary,
            long processingMs
    ) {
        log.info(
                "event=gap_analysis report_id={} document_id={} sentences={} requirements={} action_type={} confidence={} findings={} must_define={} should_confirm={} high_risk={} assessment={} detector={} processing_ms={}",
                reportId,
                parsed.documentId(),
                parsed.statistics().totalSentences(),
                parsed.statistics().totalRequirements(),
                findings.classification().actionType(),
                findings.classification().confidence(),
                findings.size(),
                summary.mustDefineCount(),
                summary.shouldConfirmCount(),
                summary.highRiskCount(),
                summary.assessment(),
                findings.detectorStatus(),
                processingMs
        );
    }
}
