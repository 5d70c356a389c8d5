package gap.detector.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHighRisk() {
        return this == HIGH || this == CRITICAL;
    }
}
