package gap.detector.model;

public record ErrorHandling(boolean mentioned, boolean defined) {}
