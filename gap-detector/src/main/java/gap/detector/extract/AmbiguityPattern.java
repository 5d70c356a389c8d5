package gap.detector.extract;

import gap.detector.model.FindingCategory;
import gap.detector.parse.CueSet;

import java.util.Optional;

enum AmbiguityPattern {
    PERFORMANCE(FindingCategory.NON_FUNCTIONAL_AMBIGUITY, "performance",
            CueSet.of("fast", "slow", "high-speed", "low-speed")),
    BOUNDARY(FindingCategory.NON_FUNCTIONAL_AMBIGUITY, "boundary condition",
            CueSet.of("large", "small", "many", "few", "appropriate", "sufficient")),
    SECURITY(FindingCategory.NON_FUNCTIONAL_AMBIGUITY, "security",
            CueSet.of("secure", "securely", "safe", "safely")),
    TIMING(FindingCategory.BEHAVIOR_AMBIGUITY, "timing",
            CueSet.of("quickly", "promptly", "as needed", "at any time", "periodically", "immediately")),
    EXECUTION_CONDITION(FindingCategory.BEHAVIOR_AMBIGUITY, "execution condition",
            CueSet.of("when", "whenever", "if", "in case", "in the case"));

    static final String GENERAL_SUBCATEGORY = "general";

    private final FindingCategory category;
    private final String subcategory;
    private final CueSet cues;

    AmbiguityPattern(FindingCategory category, String subcategory, CueSet cues) {
        this.category = category;
        this.subcategory = subcategory;
        this.cues = cues;
    }

    FindingCategory category() {
        return category;
    }

    String subcategory() {
        return subcategory;
    }

    CueSet cues() {
        return cues;
    }

    static Optional<AmbiguityPattern> match(String text) {
        for (AmbiguityPattern pattern : values()) {
            if (pattern.cues.anyIn(text)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
