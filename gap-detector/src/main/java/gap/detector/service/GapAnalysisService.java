package gap.detector.service;

import gap.detector.audit.AnalysisAuditLogger;
import gap.detector.classify.ActionClassification;
import gap.detector.classify.ActionTypeClassifier;
import gap.detector.extract.UndefinedElementSet;
import gap.detector.extract.UndefinedExtractor;
import gap.detector.model.DocumentMetadata;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.UndefinedElement;
import gap.detector.parse.RequirementParser;
import gap.detector.policy.ExecutiveSummary;
import gap.detector.policy.ExecutiveSummaryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.TimeUnit;

@Service
public class GapAnalysisService {
    public static final String SYSTEM_VERSION = "1.0.0";

    private static final DateTimeFormatter REPORT_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final RequirementParser parser;
    private final ActionTypeClassifier classifier;
    private final UndefinedExtractor extractor;
    private final ExecutiveSummaryPolicy summaryPolicy;
    private final AnalysisAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public GapAnalysisService(
            RequirementParser parser,
            ActionTypeClassifier classifier,
            UndefinedExtractor extractor,
            ExecutiveSummaryPolicy summaryPolicy,
            AnalysisAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this(parser, classifier, extractor, summaryPolicy, auditLogger, meterRegistry, Clock.systemDefaultZone());
    }

    GapAnalysisService(
            RequirementParser parser,
            ActionTypeClassifier classifier,
            UndefinedExtractor extractor,
            ExecutiveSummaryPolicy summaryPolicy,
            AnalysisAuditLogger auditLogger,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.parser = parser;
        this.classifier = classifier;
        this.extractor = extractor;
        this.summaryPolicy = summaryPolicy;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public AnalysisReport analyze(String text) {
        return analyze(text, DocumentMetadata.empty());
    }

    public AnalysisReport analyze(String text, DocumentMetadata metadata) {
        long startNs = System.nanoTime();
        ParsedRequirement parsed = parser.parse(text, metadata);
        ActionClassification classification = classifier.classify(parsed.content());
        UndefinedElementSet findings = extractor.extract(parsed, classification);
        ExecutiveSummary summary = summaryPolicy.summarize(parsed.statistics(), findings);
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        Instant now = clock.instant();
        String reportId = "REPORT-" + REPORT_ID_FORMAT.format(now.atZone(clock.getZone()));

        recordMetrics(classification, findings, processingMs);
        auditLogger.logAnalysis(reportId, parsed, findings, summary, processingMs);

        return new AnalysisReport(
                reportId,
                now,
                SYSTEM_VERSION,
                classification,
                new ParsingSummary(parsed.documentId(), parsed.parserVersion(), parsed.statistics()),
                findings,
                summary,
                findings.metaAnalysis()
        );
    }

    private void recordMetrics(ActionClassification classification, UndefinedElementSet findings, long processingMs) {
        Counter.builder("gap_detector_analysis_total")
                .tag("action_type", classification.actionType().name())
                .register(meterRegistry)
                .increment();

        for (UndefinedElement element : findings.elements()) {
            Counter.builder("gap_detector_findings_total")
                    .tag("severity", element.severity().name())
                    .register(meterRegistry)
                    .increment();
        }

        Timer.builder("gap_detector_analysis_latency")
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }
}
