package gap.detector.detector;

import gap.detector.classify.ActionClassification;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.UndefinedElement;

import java.util.List;

public interface AdditionalFindingDetector {
    List<UndefinedElement> findAdditional(
            ParsedRequirement parsed,
            ActionClassification classification,
            List<UndefinedElement> existing
    );
}
