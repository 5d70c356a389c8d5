package gap.detector.detector;

import gap.detector.classify.ActionClassification;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.UndefinedElement;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(prefix = "gap.detector.model", name = "provider", havingValue = "none", matchIfMissing = true)
public class NoopFindingDetector implements AdditionalFindingDetector {
    @Override
    public List<UndefinedElement> findAdditional(
            ParsedRequirement parsed,
            ActionClassification classification,
            List<UndefinedElement> existing
    ) {
        return List.of();
    }
}
