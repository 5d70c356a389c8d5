package gap.detector.checklist;

import com.fasterxml.jackson.annotation.JsonProperty;
import gap.detector.model.Affects;
import gap.detector.model.Criticality;

import java.util.List;

public record ChecklistItem(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("category") String category,
        @JsonProperty("criticality") Criticality criticality,
        @JsonProperty("affects") Affects affects,
        @JsonProperty("change_cost_if_later") String changeCostIfLater,
        @JsonProperty("detection_phase") DetectionPhase detectionPhase,
        @JsonProperty("default_assumption") String defaultAssumption,
        @JsonProperty("question") String question,
        @JsonProperty("question_template") String questionTemplate,
        @JsonProperty("question_template_key") String questionTemplateKey,
        @JsonProperty("why_critical") String whyCritical,
        @JsonProperty("why_optional") String whyOptional,
        @JsonProperty("options") List<ChecklistOption> options,
        @JsonProperty("examples") List<String> examples
) {
    public ChecklistItem {
        category = category == null ? "" : category;
        affects = affects == null ? Affects.NONE : affects;
        changeCostIfLater = changeCostIfLater == null ? "" : changeCostIfLater;
        detectionPhase = detectionPhase == null ? DetectionPhase.IMPLEMENTATION : detectionPhase;
        options = options == null ? List.of() : List.copyOf(options);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public static ChecklistItem of(String id, String title, Criticality criticality, Affects affects,
                                   String changeCostIfLater, DetectionPhase detectionPhase) {
        return new ChecklistItem(id, title, null, criticality, affects, changeCostIfLater, detectionPhase,
                null, null, null, null, null, null, null, null);
    }
}
