package gap.detector.model;

public record Document(String content, DocumentMetadata metadata) {
    public Document {
        content = content == null ? "" : content;
        metadata = metadata == null ? DocumentMetadata.empty() : metadata;
    }

    public static Document of(String content) {
        return new Document(content, null);
    }
}
