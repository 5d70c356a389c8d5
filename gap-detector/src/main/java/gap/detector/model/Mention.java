package gap.detector.model;

public record Mention(String sentenceId, String text, int position) {}
