package gap.detector.model;

public record Attribute(String name, boolean mentioned, boolean defined, String sentenceId) {}
