package gap.detector.model;

import java.util.List;
import java.util.Objects;

public record Entity(
        String id,
        String name,
        EntityKind kind,
        List<Attribute> attributes,
        List<Mention> mentions,
        DefinitionStatus definitionStatus,
        double ambiguityScore
) {
    public Entity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
        definitionStatus = definitionStatus == null ? DefinitionStatus.UNDEFINED : definitionStatus;
    }
}
