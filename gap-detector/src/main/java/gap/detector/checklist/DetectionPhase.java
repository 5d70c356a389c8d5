package gap.detector.checklist;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DetectionPhase {
    @JsonProperty("requirement_definition") REQUIREMENT_DEFINITION,
    @JsonProperty("design") DESIGN,
    @JsonProperty("implementation") IMPLEMENTATION,
    @JsonProperty("testing") TESTING,
    @JsonProperty("production") PRODUCTION
}
