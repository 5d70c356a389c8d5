package gap.detector.checklist;

import gap.detector.classify.ActionType;
import gap.detector.model.Criticality;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChecklistTemplateRepositoryTest {
    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    private ChecklistTemplateRepository repository(String location) {
        return new ChecklistTemplateRepository(resourceLoader, location);
    }

    @Test
    void shouldLoadDeletionChecklistFromClasspath() {
        List<ChecklistItem> items = repository("classpath:checklists/").checklistFor(ActionType.DELETE);

        assertEquals(5, items.size());
        ChecklistItem first = items.get(0);
        assertEquals("DEL-001", first.id());
        assertEquals(Criticality.MUST_DEFINE, first.criticality());
        assertTrue(first.affects().dataModel());
        assertEquals(DetectionPhase.PRODUCTION, first.detectionPhase());
        assertEquals("delete_method", first.questionTemplateKey());
        assertEquals(List.of("Logical deletion", "Physical deletion"),
                first.options().stream().map(ChecklistOption::label).toList());
        assertEquals("cascade_delete", items.get(1).questionTemplateKey());
    }

    @Test
    void shouldShipAChecklistForEveryKnownCategory() {
        ChecklistTemplateRepository repository = repository("classpath:checklists");

        for (ActionType type : ActionType.values()) {
            if (type.isKnown()) {
                ChecklistTemplate template = repository.load(type);
                assertEquals(type.name(), template.actionType(), type.name());
                assertFalse(template.checklist().isEmpty(), type.name());
            }
        }
    }

    @Test
    void shouldDegradeToEmptyChecklistWhenTemplateIsMissing() {
        assertTrue(repository("classpath:no-such-checklists/").checklistFor(ActionType.DELETE).isEmpty());
        assertTrue(repository("classpath:custom-checklists/").checklistFor(ActionType.SEARCH).isEmpty());
        assertTrue(repository("classpath:checklists/").checklistFor(ActionType.UNKNOWN).isEmpty());
    }

    @Test
    void shouldApplyDefaultsToSparseItems() {
        ChecklistItem item = repository("classpath:custom-checklists/").checklistFor(ActionType.NOTIFICATION).get(0);

        assertEquals("N-1", item.id());
        assertFalse(item.affects().dataModel());
        assertEquals(DetectionPhase.IMPLEMENTATION, item.detectionPhase());
        assertEquals("", item.changeCostIfLater());
        assertTrue(item.options().isEmpty());
    }

    @Test
    void shouldFailOnMalformedTemplates() {
        ChecklistTemplateRepository repository = repository("classpath:broken-checklists/");

        assertThrows(ChecklistTemplateException.class, () -> repository.load(ActionType.DELETE));
        assertThrows(ChecklistTemplateException.class, () -> repository.load(ActionType.UPDATE));
        assertThrows(ChecklistTemplateException.class, () -> repository.load(ActionType.SEARCH));
        ChecklistTemplateException missingTitle =
                assertThrows(ChecklistTemplateException.class, () -> repository.load(ActionType.CREATE));
        assertTrue(missingTitle.getMessage().contains("item #1"));
    }

    @Test
    void shouldServeRepeatedLoadsFromCache() {
        ChecklistTemplateRepository repository = repository("classpath:checklists/");

        assertSame(repository.load(ActionType.SEARCH), repository.load(ActionType.SEARCH));
        assertSame(repository.load(ActionType.UNKNOWN), repository.load(ActionType.UNKNOWN));
    }
}
