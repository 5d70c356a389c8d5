package gap.detector.checklist;

import gap.detector.classify.ActionType;
import gap.detector.model.Affects;
import gap.detector.model.Criticality;
import gap.detector.model.CriticalityResult;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CriticalityJudgeTest {
    private final CriticalityJudge judge = new CriticalityJudge(
            new ChecklistTemplateRepository(new DefaultResourceLoader(), "classpath:checklists/"));

    private CriticalityResult judge(Criticality override, Affects affects, String cost, DetectionPhase phase) {
        return judge.judge(ChecklistItem.of("T-1", "Test item", override, affects, cost, phase),
                ActionType.DELETE, ChecklistContext.empty());
    }

    @Test
    void shouldClipScoreAtTen() {
        CriticalityResult result = judge(null, new Affects(true, true, true), "300 hours", DetectionPhase.PRODUCTION);

        assertEquals(10.0, result.score());
        assertEquals(Criticality.MUST_DEFINE, result.criticality());
        assertEquals("before implementation starts", result.recommendedDecisionTiming());
    }

    @Test
    void shouldResolveTierFromScoreWithoutOverride() {
        assertEquals(Criticality.MUST_DEFINE,
                judge(null, new Affects(false, true, false), "medium", DetectionPhase.DESIGN).criticality());
        assertEquals(Criticality.SHOULD_CONFIRM,
                judge(null, new Affects(false, true, false), "small", DetectionPhase.DESIGN).criticality());
        CriticalityResult low = judge(null, Affects.NONE, "small", DetectionPhase.IMPLEMENTATION);
        assertEquals(0.5, low.score());
        assertEquals(Criticality.CAN_DECIDE_LATER, low.criticality());
        assertEquals("during implementation", low.recommendedDecisionTiming());
    }

    @Test
    void shouldLetOverrideWinAndRaiseScoreFloor() {
        CriticalityResult mustDefine = judge(Criticality.MUST_DEFINE, Affects.NONE, "", DetectionPhase.IMPLEMENTATION);
        assertEquals(5.0, mustDefine.score());
        assertEquals(Criticality.MUST_DEFINE, mustDefine.criticality());

        CriticalityResult shouldConfirm =
                judge(Criticality.SHOULD_CONFIRM, Affects.NONE, "", DetectionPhase.IMPLEMENTATION);
        assertEquals(3.0, shouldConfirm.score());
        assertEquals("before design sign-off", shouldConfirm.recommendedDecisionTiming());

        CriticalityResult later =
                judge(Criticality.CAN_DECIDE_LATER, new Affects(true, false, true), "rewrite", DetectionPhase.PRODUCTION);
        assertEquals(10.0, later.score());
        assertEquals(Criticality.CAN_DECIDE_LATER, later.criticality());
    }

    @Test
    void shouldReadChangeCostMagnitude() {
        assertEquals(3.0, CriticalityJudge.changeCostPoints("about 1,200 hours"));
        assertEquals(2.5, CriticalityJudge.changeCostPoints("100 hours"));
        assertEquals(2.0, CriticalityJudge.changeCostPoints("between 8 and 40 hours"));
        assertEquals(1.5, CriticalityJudge.changeCostPoints("20h"));
        assertEquals(1.0, CriticalityJudge.changeCostPoints("Medium: 16 hours"));
        assertEquals(0.5, CriticalityJudge.changeCostPoints("High: 2 hours"));
        assertEquals(3.0, CriticalityJudge.changeCostPoints("Very high, needs a redesign"));
        assertEquals(2.5, CriticalityJudge.changeCostPoints("High"));
        assertEquals(2.0, CriticalityJudge.changeCostPoints("medium"));
        assertEquals(0.5, CriticalityJudge.changeCostPoints("negligible"));
        assertEquals(0.5, CriticalityJudge.changeCostPoints(null));
    }

    @Test
    void shouldFillContextIntoReasonAndAssumption() {
        ChecklistItem item = new ChecklistItem("T-2", "Deletion", null, Criticality.MUST_DEFINE, null, null, null,
                "{entity} is deleted logically", null, null, null, "Deleting {entity} changes {api_name}",
                null, null, null);

        CriticalityResult result = judge.judge(item, ActionType.DELETE,
                new ChecklistContext("user", null, List.of()));

        assertEquals("user is deleted logically", result.defaultAssumption());
        assertEquals("Deleting user changes {api_name}", result.reason());
        assertEquals("T-2", result.itemId());
    }

    @Test
    void shouldOrderJudgedChecklistByTierKeepingTemplateOrder() {
        List<JudgedItem> judged = judge.judgeAll(ActionType.DELETE, ChecklistContext.empty());

        assertEquals(List.of("DEL-001", "DEL-003", "DEL-005", "DEL-002", "DEL-004"),
                judged.stream().map(j -> j.item().id()).toList());
        for (JudgedItem item : judged) {
            assertTrue(item.result().score() >= 0.0 && item.result().score() <= 10.0);
        }
        assertTrue(judge.judgeAll(ActionType.UNKNOWN, ChecklistContext.empty()).isEmpty());
    }
}
