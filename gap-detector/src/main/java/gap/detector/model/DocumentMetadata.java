package gap.detector.model;

import java.time.Instant;
import java.util.List;

public record DocumentMetadata(
        Instant createdAt,
        String createdBy,
        String version,
        String source,
        List<String> tags
) {
    public DocumentMetadata {
        version = version == null || version.isBlank() ? "1.0.0" : version;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, null, null, null, List.of());
    }
}
