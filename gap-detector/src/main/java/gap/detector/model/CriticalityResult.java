package gap.detector.model;

import java.util.Objects;

public record CriticalityResult(
        String itemId,
        double score,
        Criticality criticality,
        String recommendedDecisionTiming,
        String reason,
        String changeCostIfLater,
        String defaultAssumption,
        Affects affects
) {
    public CriticalityResult {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(criticality, "criticality");
        if (Double.isNaN(score) || score < 0.0 || score > 10.0) {
            throw new IllegalArgumentException("score must be within [0,10]: " + score);
        }
        recommendedDecisionTiming = recommendedDecisionTiming == null
                ? criticality.decisionTiming()
                : recommendedDecisionTiming;
        reason = reason == null ? "" : reason;
        changeCostIfLater = changeCostIfLater == null ? "" : changeCostIfLater;
        affects = affects == null ? Affects.NONE : affects;
    }
}
