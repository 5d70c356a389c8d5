package gap.detector.extract;

import gap.detector.checklist.ChecklistContext;
import gap.detector.checklist.CriticalityJudge;
import gap.detector.checklist.JudgedItem;
import gap.detector.classify.ActionClassification;
import gap.detector.classify.ActionType;
import gap.detector.classify.ActionTypeClassifier;
import gap.detector.detector.AdditionalFindingDetector;
import gap.detector.model.Action;
import gap.detector.model.Attribute;
import gap.detector.model.Condition;
import gap.detector.model.Criticality;
import gap.detector.model.CriticalityResult;
import gap.detector.model.DefinitionStatus;
import gap.detector.model.Detection;
import gap.detector.model.DetectionMethod;
import gap.detector.model.Entity;
import gap.detector.model.FindingCategory;
import gap.detector.model.FindingContext;
import gap.detector.model.ParsedRequirement;
import gap.detector.model.Question;
import gap.detector.model.QuestionType;
import gap.detector.model.Requirement;
import gap.detector.model.Sentence;
import gap.detector.model.Severity;
import gap.detector.model.UndefinedElement;
import gap.detector.parse.Cue;
import gap.detector.question.PracticalQuestion;
import gap.detector.question.QuestionGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a parsed document into one flat list of findings.
 * <p>
 * Producers run in a fixed order: category checklist, entities, actions, requirements,
 * then the additional detector. Ids are assigned in that order, so extracting the same
 * document twice yields the same list.
 */
@Component
public class UndefinedExtractor {
    private static final Logger log = LoggerFactory.getLogger(UndefinedExtractor.class);

    public static final String VERSION = "1.0.0";
    public static final String DETECTOR_NONE = "NONE";
    public static final String DETECTOR_MERGED = "MERGED";
    public static final String DETECTOR_ERROR = "DETECTOR_ERROR";

    static final double AMBIGUITY_THRESHOLD = 0.6;

    private final ActionTypeClassifier classifier;
    private final CriticalityJudge judge;
    private final QuestionGenerator questionGenerator;
    private final AdditionalFindingDetector detector;
    private final MetaAnalyzer metaAnalyzer;

    public UndefinedExtractor(
            ActionTypeClassifier classifier,
            CriticalityJudge judge,
            QuestionGenerator questionGenerator,
            AdditionalFindingDetector detector,
            MetaAnalyzer metaAnalyzer
    ) {
        this.classifier = classifier;
        this.judge = judge;
        this.questionGenerator = questionGenerator;
        this.detector = detector;
        this.metaAnalyzer = metaAnalyzer;
    }

    public UndefinedElementSet extract(ParsedRequirement parsed) {
        return extract(parsed, null);
    }

    public UndefinedElementSet extract(ParsedRequirement parsed, ActionClassification classification) {
        ActionClassification resolved = classification != null
                ? classification
                : classifier.classify(parsed.content());

        Findings findings = new Findings();
        fromChecklist(parsed, resolved, findings);
        for (Entity entity : parsed.entities()) {
            fromEntity(entity, parsed, findings);
        }
        for (Action action : parsed.actions()) {
            fromAction(action, parsed, resolved.actionType(), findings);
        }
        for (Requirement requirement : parsed.requirements()) {
            fromRequirement(requirement, parsed, findings);
        }
        String detectorStatus = mergeAdditional(parsed, resolved, findings);

        List<UndefinedElement> elements = findings.elements();
        return new UndefinedElementSet(
                parsed.documentId(),
                Instant.now(),
                VERSION,
                resolved,
                elements,
                FindingStatistics.of(elements),
                metaAnalyzer.analyze(parsed, elements),
                detectorStatus
        );
    }

    private void fromChecklist(ParsedRequirement parsed, ActionClassification classification, Findings findings) {
        ActionType type = classification.actionType();
        if (!type.isKnown()) {
            return;
        }
        ChecklistContext context = ChecklistContext.from(classification, parsed.content());
        FindingContext findingContext = checklistContext(parsed, classification);

        for (JudgedItem judged : judge.judgeAll(type, context)) {
            PracticalQuestion practical = questionGenerator.generateQuestion(judged.item(), context);
            Criticality criticality = judged.result().criticality();
            String subcategory = judged.item().category().isBlank() ? type.label() : judged.item().category();
            String description = judged.result().reason().isBlank()
                    ? "The " + type.label() + " checklist item \"" + judged.item().title() + "\" is not addressed."
                    : judged.result().reason();

            findings.add(
                    FindingCategory.ACTION_TYPE_CHECKLIST,
                    subcategory,
                    null,
                    null,
                    null,
                    judged.item().title(),
                    description,
                    List.of(new Question(practical.question(), QuestionType.SPECIFICATION,
                            practical.suggestedAnswers(), judged.item().id())),
                    new Detection(DetectionMethod.TEMPLATE_DRIVEN, 0.9,
                            "Checklist item " + judged.item().id() + " for " + type.label()
                                    + " scored " + judged.result().score() + " (" + criticality.label() + ")"),
                    findingContext,
                    severityOf(criticality),
                    judged.result()
            );
        }
    }

    static Severity severityOf(Criticality criticality) {
        switch (criticality) {
            case MUST_DEFINE:
                return Severity.CRITICAL;
            case SHOULD_CONFIRM:
                return Severity.HIGH;
            default:
                return Severity.LOW;
        }
    }

    private static FindingContext checklistContext(ParsedRequirement parsed, ActionClassification classification) {
        String keyword = classification.matchedKeywords().isEmpty() ? "" : classification.matchedKeywords().get(0);
        for (Sentence sentence : parsed.sentences()) {
            if (classification.actionType().keywords().anyIn(sentence.text())) {
                return FindingContext.of(keyword, sentence);
            }
        }
        return FindingContext.of(keyword, null);
    }

    private void fromEntity(Entity entity, ParsedRequirement parsed, Findings findings) {
        FindingContext context = entityContext(entity, parsed);
        if (entity.definitionStatus() == DefinitionStatus.UNDEFINED) {
            findings.add(
                    FindingCategory.DATA_DEFINITION_MISSING,
                    "type definition",
                    entity.id(),
                    null,
                    null,
                    "Definition of " + entity.name() + " is unclear",
                    "The concrete data type and attributes of " + entity.name() + " are not defined.",
                    List.of(
                            Question.of("What is the data type of " + entity.name() + "?",
                                    QuestionType.SPECIFICATION, "String", "Integer", "UUID", "Object"),
                            Question.of("Which constraints apply to " + entity.name() + "?",
                                    QuestionType.CONSTRAINT, "Maximum length", "Required or optional", "Uniqueness")
                    ),
                    new Detection(DetectionMethod.RULE_BASED, 0.85,
                            "The entity is mentioned but never given a concrete definition"),
                    context,
                    Severity.MEDIUM,
                    null
            );
        }

        for (Attribute attribute : entity.attributes()) {
            if (!attribute.mentioned() || attribute.defined()) {
                continue;
            }
            findings.add(
                    FindingCategory.DATA_DEFINITION_MISSING,
                    "constraint",
                    entity.id(),
                    null,
                    null,
                    "Specification of the " + attribute.name() + " of " + entity.name() + " is unknown",
                    "The data type and constraints of " + attribute.name() + " are not defined.",
                    List.of(
                            Question.of("What is the data type of " + attribute.name() + "?",
                                    QuestionType.SPECIFICATION),
                            Question.of("What are the minimum and maximum values of " + attribute.name() + "?",
                                    QuestionType.CONSTRAINT)
                    ),
                    new Detection(DetectionMethod.RULE_BASED, 0.9,
                            "The attribute is mentioned without a type or format"),
                    attributeContext(entity, attribute, parsed, context),
                    Severity.MEDIUM,
                    null
            );
        }
    }

    private void fromAction(Action action, ParsedRequirement parsed, ActionType actionType, Findings findings) {
        FindingContext context = FindingContext.of(action.verb(), sentence(parsed, action.sentenceId()).orElse(null));

        for (Condition condition : action.preconditions()) {
            if (!condition.ambiguous()) {
                continue;
            }
            findings.add(
                    FindingCategory.BEHAVIOR_AMBIGUITY,
                    "execution condition",
                    null,
                    action.id(),
                    null,
                    "Execution condition of " + action.verb() + " is ambiguous",
                    "How \"" + condition.description() + "\" is determined is not stated.",
                    List.of(
                            Question.of("How exactly is \"" + condition.description() + "\" determined?",
                                    QuestionType.CLARIFICATION),
                            Question.of("Is the condition evaluated in real time or from a cache?",
                                    QuestionType.SPECIFICATION,
                                    "Real time", "Cache refreshed every minute", "Cache refreshed every 5 minutes")
                    ),
                    new Detection(DetectionMethod.SEMANTIC_ANALYSIS, 0.85,
                            "A condition clause is present without a concrete definition"),
                    context,
                    Severity.HIGH,
                    null
            );
        }

        // A known category brings its own checklist, which covers error handling.
        if (actionType.isKnown() || action.errorHandling().defined()) {
            return;
        }
        findings.add(
                FindingCategory.ERROR_HANDLING_MISSING,
                "user feedback",
                null,
                action.id(),
                null,
                "Error handling for " + action.verb() + " is undefined",
                "Behavior on failure and the feedback given to the user are not defined.",
                List.of(
                        Question.of("What happens when " + action.verb() + " fails?", QuestionType.EXCEPTION),
                        Question.of("What feedback does the user get on an error?", QuestionType.CLARIFICATION,
                                "Show an error message", "Log only", "Send a notification")
                ),
                new Detection(DetectionMethod.RULE_BASED, 0.8,
                        "Only the normal flow is described"),
                context,
                Severity.MEDIUM,
                null
        );
    }

    private void fromRequirement(Requirement requirement, ParsedRequirement parsed, Findings findings) {
        if (requirement.ambiguityScore() <= AMBIGUITY_THRESHOLD) {
            return;
        }
        Optional<AmbiguityPattern> pattern = AmbiguityPattern.match(requirement.text());
        FindingCategory category = pattern.map(AmbiguityPattern::category)
                .orElse(FindingCategory.NON_FUNCTIONAL_AMBIGUITY);
        String subcategory = pattern.map(AmbiguityPattern::subcategory)
                .orElse(AmbiguityPattern.GENERAL_SUBCATEGORY);

        Sentence sentence = sentence(parsed, requirement.sentenceId()).orElse(null);
        FindingContext context = sentence != null
                ? FindingContext.of(requirement.text(), sentence)
                : new FindingContext(requirement.text(), requirement.text(), requirement.sentenceId(),
                requirement.lineNumber());

        findings.add(
                category,
                subcategory,
                null,
                null,
                requirement.id(),
                ambiguityTitle(requirement.text(), pattern.orElse(null)),
                "\"" + requirement.text() + "\" contains vague wording.",
                ambiguityQuestions(pattern.orElse(null)),
                new Detection(DetectionMethod.PATTERN_MATCHING, 0.75,
                        "Ambiguity score " + requirement.ambiguityScore()),
                context,
                Severity.MEDIUM,
                null
        );
    }

    private static String ambiguityTitle(String text, AmbiguityPattern pattern) {
        if (pattern == AmbiguityPattern.PERFORMANCE) {
            String term = pattern.cues().firstIn(text).map(Cue::term).orElse("fast");
            return "Concrete criterion for \"" + term + "\" is not defined";
        }
        if (pattern == AmbiguityPattern.SECURITY) {
            return "Concrete security measures are not defined";
        }
        if (pattern == AmbiguityPattern.EXECUTION_CONDITION) {
            return "How the execution condition is judged is not defined";
        }
        return "Requirement wording is ambiguous";
    }

    private static List<Question> ambiguityQuestions(AmbiguityPattern pattern) {
        if (pattern == AmbiguityPattern.PERFORMANCE) {
            return List.of(
                    Question.of("What is the target response time? (e.g. within 500 ms)", QuestionType.SPECIFICATION),
                    Question.of("How many concurrent users are expected?", QuestionType.SPECIFICATION)
            );
        }
        if (pattern == AmbiguityPattern.SECURITY) {
            return List.of(
                    Question.of("Which concrete security measures are required? (CSRF, XSS, SQL injection, ...)",
                            QuestionType.SPECIFICATION),
                    Question.of("Which authentication and authorization scheme applies?", QuestionType.SPECIFICATION)
            );
        }
        return List.of(Question.of("Define a concrete criterion or numeric value.", QuestionType.CLARIFICATION));
    }

    private String mergeAdditional(ParsedRequirement parsed, ActionClassification classification, Findings findings) {
        List<UndefinedElement> additional;
        try {
            additional = detector.findAdditional(parsed, classification, findings.elements());
        } catch (RuntimeException e) {
            log.warn("event=additional_detector_failed document_id={} detector={} error={}",
                    parsed.documentId(), detector.getClass().getSimpleName(), e.toString());
            return DETECTOR_ERROR;
        }
        if (additional == null || additional.isEmpty()) {
            return DETECTOR_NONE;
        }
        int merged = 0;
        for (UndefinedElement element : additional) {
            if (findings.covers(element)) {
                continue;
            }
            findings.append(element);
            merged++;
        }
        log.debug("event=additional_findings_merged document_id={} offered={} merged={}",
                parsed.documentId(), additional.size(), merged);
        return DETECTOR_MERGED;
    }

    private static FindingContext entityContext(Entity entity, ParsedRequirement parsed) {
        if (!entity.mentions().isEmpty()) {
            Optional<Sentence> sentence = sentence(parsed, entity.mentions().get(0).sentenceId());
            if (sentence.isPresent()) {
                return FindingContext.of(entity.name(), sentence.get());
            }
        }
        return FindingContext.of(entity.name(), null);
    }

    private static FindingContext attributeContext(Entity entity, Attribute attribute, ParsedRequirement parsed,
                                                   FindingContext fallback) {
        return sentence(parsed, attribute.sentenceId())
                .map(s -> FindingContext.of(entity.name() + " " + attribute.name(), s))
                .orElse(fallback);
    }

    private static Optional<Sentence> sentence(ParsedRequirement parsed, String sentenceId) {
        if (sentenceId == null) {
            return Optional.empty();
        }
        return parsed.sentences().stream().filter(s -> sentenceId.equals(s.id())).findFirst();
    }

    static String normalizeTitle(String title) {
        return title.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static final class Findings {
        private final List<UndefinedElement> elements = new ArrayList<>();
        private final Set<String> titles = new HashSet<>();
        private final Set<String> sources = new HashSet<>();

        void add(FindingCategory category, String subcategory, String entityId, String actionId,
                 String requirementId, String title, String description, List<Question> questions,
                 Detection detection, FindingContext context, Severity severity,
                 CriticalityResult criticality) {
            append(new UndefinedElement(nextId(), category, subcategory, entityId, actionId, requirementId,
                    title, description, questions, detection, context, severity, criticality));
        }

        void append(UndefinedElement element) {
            UndefinedElement numbered = element.withId(nextId());
            elements.add(numbered);
            titles.add(normalizeTitle(numbered.title()));
            String source = numbered.context().sourceText();
            if (!source.isBlank()) {
                sources.add(numbered.category() + "|" + source);
            }
        }

        boolean covers(UndefinedElement element) {
            if (titles.contains(normalizeTitle(element.title()))) {
                return true;
            }
            String source = element.context().sourceText();
            return !source.isBlank() && sources.contains(element.category() + "|" + source);
        }

        List<UndefinedElement> elements() {
            return List.copyOf(elements);
        }

        private String nextId() {
            return String.format("UE-%03d", elements.size() + 1);
        }
    }
}
