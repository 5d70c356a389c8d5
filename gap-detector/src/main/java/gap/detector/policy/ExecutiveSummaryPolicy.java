package gap.detector.policy;

import gap.detector.extract.FindingStatistics;
import gap.detector.extract.UndefinedElementSet;
import gap.detector.model.Criticality;
import gap.detector.model.ParsingStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ExecutiveSummaryPolicy {
    static final double GOOD_COMPLETENESS = 0.7;
    static final double ACCEPTABLE_COMPLETENESS = 0.5;
    static final int MANY_FINDINGS = 10;
    static final double HIGH_AMBIGUITY = 0.6;

    private final int manyConfirmationsThreshold;

    public ExecutiveSummaryPolicy(
            @Value("${gap.detector.summary.many-confirmations-threshold:3}") int manyConfirmationsThreshold
    ) {
        if (manyConfirmationsThreshold < 1) {
            throw new IllegalArgumentException(
                    "many-confirmations-threshold must be positive: " + manyConfirmationsThreshold);
        }
        this.manyConfirmationsThreshold = manyConfirmationsThreshold;
    }

    public ExecutiveSummary summarize(ParsingStatistics parsing, UndefinedElementSet findings) {
        FindingStatistics stats = findings.statistics();
        int mustDefine = stats.count(Criticality.MUST_DEFINE);
        int shouldConfirm = stats.count(Criticality.SHOULD_CONFIRM);
        int canDecideLater = stats.count(Criticality.CAN_DECIDE_LATER);
        int highRisk = stats.highRiskCount();
        double completeness = parsing.avgCompletenessScore();
        double ambiguity = parsing.avgAmbiguityScore();

        List<String> keyFindings = new ArrayList<>();
        if (stats.total() > MANY_FINDINGS) {
            keyFindings.add(stats.total() + " undefined elements were found; the requirements need substantial detail.");
        }
        if (highRisk > 0) {
            keyFindings.add(highRisk + " high-risk undefined element(s) need priority attention.");
        }
        if (ambiguity > HIGH_AMBIGUITY) {
            keyFindings.add("The requirements contain a lot of ambiguous wording.");
        }

        return new ExecutiveSummary(
                assess(mustDefine, shouldConfirm, completeness),
                stats.total(),
                mustDefine,
                shouldConfirm,
                canDecideLater,
                highRisk,
                completeness,
                ambiguity,
                keyFindings
        );
    }

    Assessment assess(int mustDefine, int shouldConfirm, double completeness) {
        if (mustDefine > 0) {
            return Assessment.CANNOT_START;
        }
        if (shouldConfirm >= manyConfirmationsThreshold) {
            return Assessment.MANY_CONFIRMATIONS_NEEDED;
        }
        if (completeness >= GOOD_COMPLETENESS) {
            return Assessment.GOOD;
        }
        if (completeness >= ACCEPTABLE_COMPLETENESS) {
            return Assessment.NEEDS_IMPROVEMENT;
        }
        return Assessment.INSUFFICIENT;
    }
}
