package gap.detector.checklist;

import gap.detector.classify.ActionType;
import gap.detector.model.Affects;
import gap.detector.model.Criticality;
import gap.detector.model.CriticalityResult;
import gap.detector.parse.CueSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores checklist items and resolves their criticality tier.
 * <p>
 * Score, clipped to [0,10]: data model +3, external system +2, security +3, change cost
 * +0.5..+3, detection phase (production +2, testing +1.5, design +1). An explicit tier on
 * the item raises the score to at least 5 (must-define) or 3 (should-confirm) and wins
 * over the score when resolving the tier.
 */
@Component
public class CriticalityJudge {
    static final double MAX_SCORE = 10.0;
    static final double MUST_DEFINE_THRESHOLD = 5.0;
    static final double SHOULD_CONFIRM_THRESHOLD = 3.0;

    private static final Pattern NUMBER = Pattern.compile("\\d[\\d,]*(?:\\.\\d+)?");
    private static final CueSet VERY_HIGH_COST = CueSet.of("very high", "redesign", "rewrite");
    private static final CueSet HIGH_COST = CueSet.of("high");
    private static final CueSet MEDIUM_COST = CueSet.of("medium");

    private final ChecklistTemplateRepository templates;

    public CriticalityJudge(ChecklistTemplateRepository templates) {
        this.templates = templates;
    }

    public CriticalityResult judge(ChecklistItem item, ActionType actionType, ChecklistContext context) {
        ChecklistContext ctx = context == null ? ChecklistContext.empty() : context;
        double score = score(item);
        Criticality criticality = resolve(score, item);
        return new CriticalityResult(
                item.id(),
                score,
                criticality,
                criticality.decisionTiming(),
                ctx.fill(item.whyCritical()),
                item.changeCostIfLater(),
                ctx.fill(item.defaultAssumption()),
                item.affects()
        );
    }

    /**
     * Judges every checklist item of the category, must-define items first. Items of equal
     * tier keep their template order.
     */
    public List<JudgedItem> judgeAll(ActionType actionType, ChecklistContext context) {
        List<JudgedItem> judged = new ArrayList<>();
        for (ChecklistItem item : templates.checklistFor(actionType)) {
            judged.add(new JudgedItem(item, judge(item, actionType, context)));
        }
        judged.sort(Comparator.comparingInt((JudgedItem j) -> j.result().criticality().priority()).reversed());
        return judged;
    }

    public double score(ChecklistItem item) {
        double score = 0.0;
        Affects affects = item.affects();
        if (affects.dataModel()) {
            score += 3.0;
        }
        if (affects.externalSystem()) {
            score += 2.0;
        }
        if (affects.security()) {
            score += 3.0;
        }
        score += changeCostPoints(item.changeCostIfLater());
        score += detectionPhasePoints(item.detectionPhase());

        if (item.criticality() == Criticality.MUST_DEFINE) {
            score = Math.max(score, MUST_DEFINE_THRESHOLD);
        } else if (item.criticality() == Criticality.SHOULD_CONFIRM) {
            score = Math.max(score, SHOULD_CONFIRM_THRESHOLD);
        }
        return Math.min(score, MAX_SCORE);
    }

    public Criticality resolve(double score, ChecklistItem item) {
        if (item.criticality() != null) {
            return item.criticality();
        }
        if (score >= MUST_DEFINE_THRESHOLD) {
            return Criticality.MUST_DEFINE;
        }
        if (score >= SHOULD_CONFIRM_THRESHOLD) {
            return Criticality.SHOULD_CONFIRM;
        }
        return Criticality.CAN_DECIDE_LATER;
    }

    /**
     * The largest number in the text is read as rework hours; without a number,
     * magnitude words decide.
     */
    static double changeCostPoints(String changeCost) {
        if (changeCost == null || changeCost.isBlank()) {
            return 0.5;
        }
        double hours = -1;
        Matcher matcher = NUMBER.matcher(changeCost);
        while (matcher.find()) {
            hours = Math.max(hours, Double.parseDouble(matcher.group().replace(",", "")));
        }
        if (hours >= 0) {
            if (hours >= 200) {
                return 3.0;
            } else if (hours >= 100) {
                return 2.5;
            } else if (hours >= 40) {
                return 2.0;
            } else if (hours >= 20) {
                return 1.5;
            } else if (hours >= 10) {
                return 1.0;
            }
            return 0.5;
        }
        if (VERY_HIGH_COST.anyIn(changeCost)) {
            return 3.0;
        }
        if (HIGH_COST.anyIn(changeCost)) {
            return 2.5;
        }
        if (MEDIUM_COST.anyIn(changeCost)) {
            return 2.0;
        }
        return 0.5;
    }

    static double detectionPhasePoints(DetectionPhase phase) {
        if (phase == null) {
            return 0.0;
        }
        switch (phase) {
            case PRODUCTION:
                return 2.0;
            case TESTING:
                return 1.5;
            case DESIGN:
                return 1.0;
            default:
                return 0.0;
        }
    }
}
