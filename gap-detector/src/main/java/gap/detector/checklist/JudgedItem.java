package gap.detector.checklist;

import gap.detector.model.CriticalityResult;

public record JudgedItem(ChecklistItem item, CriticalityResult result) {}
