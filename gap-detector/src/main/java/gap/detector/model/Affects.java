package gap.detector.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Affects(
        @JsonProperty("data_model") boolean dataModel,
        @JsonProperty("external_system") boolean externalSystem,
        @JsonProperty("security") boolean security
) {
    public static final Affects NONE = new Affects(false, false, false);
}
