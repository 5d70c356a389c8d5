package gap.detector.model;

import java.util.List;
import java.util.Objects;

public record Action(
        String id,
        String sentenceId,
        String verb,
        String subjectId,
        String objectId,
        List<Condition> preconditions,
        ErrorHandling errorHandling
) {
    public static final String UNKNOWN_ENTITY = "UNKNOWN";

    public Action {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(verb, "verb");
        subjectId = subjectId == null ? UNKNOWN_ENTITY : subjectId;
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        errorHandling = errorHandling == null ? new ErrorHandling(false, false) : errorHandling;
    }
}
