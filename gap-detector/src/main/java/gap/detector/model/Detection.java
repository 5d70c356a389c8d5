package gap.detector.model;

import java.util.Objects;

public record Detection(DetectionMethod method, double confidence, String reasoning) {
    public Detection {
        Objects.requireNonNull(method, "method");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        reasoning = reasoning == null ? "" : reasoning;
    }
}
