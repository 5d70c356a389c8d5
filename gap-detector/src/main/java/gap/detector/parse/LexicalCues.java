package gap.detector.parse;

import gap.detector.model.EntityKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public final class LexicalCues {
    private LexicalCues() {}

    // Sentence typing, checked in this order: capability, obligation, example.
    public static final CueSet CAPABILITY = CueSet.of("can", "able to", "possible", "shall", "will", "allow");
    public static final CueSet OBLIGATION = CueSet.of(
            "must", "required", "need to", "needs to", "has to", "have to", "mandatory", "necessary");
    public static final CueSet EXAMPLE_MARKERS = CueSet.of("for example", "for instance", "such as", "etc");

    public static final CueSet ERROR_LANGUAGE = CueSet.of(
            "error", "fail", "failure", "cannot", "can't", "unable", "invalid", "exception");

    public static final CueSet VAGUE_ADJECTIVES = CueSet.of(
            "fast", "slow", "high-speed", "large", "small", "many", "few", "appropriate", "sufficient");
    public static final CueSet VAGUE_ADVERBS = CueSet.of(
            "quickly", "promptly", "as needed", "at any time", "periodically", "immediately");

    public static final CueSet CONDITION_MARKERS = CueSet.of(
            "in case", "in the case", "when", "whenever", "on the occasion of", "if");
    public static final CueSet COMPARISON_PHRASES = CueSet.of(
            "at least", "at most", "or more", "or less", "more than", "less than", "within");
    public static final List<String> COMPARISON_OPERATORS = List.of("=", ">", "<");
    public static final Pattern NUMERIC_TOKEN = Pattern.compile("\\p{Nd}");

    // Verb identity, first hit wins.
    public static final CueSet VERBS = CueSet.of(
            "add", "delete", "change", "confirm", "display", "register", "update", "retrieve", "send", "execute");
    public static final String FALLBACK_VERB = "process";
    // Verbs that open a verb-object action phrase.
    public static final CueSet ACTION_VERBS = CueSet.of(
            "add", "delete", "remove", "change", "confirm", "display", "register", "update", "retrieve",
            "send", "execute", "create", "edit", "show", "view");

    public static final CueSet CAN = CueSet.of("can");
    public static final CueSet CREATE_VERBS = CueSet.of("add", "register", "save", "create");
    public static final CueSet DELETE = CueSet.of("delete");
    public static final CueSet DATA_WORDS = CueSet.of("data", "information", "value");
    public static final CueSet TYPE_WORDS = CueSet.of("type", "format");

    public static final CueSet NON_FUNCTIONAL = CueSet.of(
            "performance", "fast", "response time", "secure", "available", "availability",
            "scalable", "throughput", "latency");

    public static final CueSet ATTRIBUTES = CueSet.of(
            "name", "email", "address", "phone number", "status", "password", "id", "quantity", "date");
    public static final CueSet FORMAT_CUES = CueSet.of(
            "format", "type", "length", "characters", "digits", "string", "integer", "numeric",
            "pattern", "maximum", "minimum");

    private static final Map<String, EntityKind> ENTITY_VOCABULARY = buildEntityVocabulary();
    private static final Map<String, Cue> ENTITY_CUES = buildEntityCues();
    private static final Map<String, List<AttributeCue>> ATTRIBUTE_CUES = buildAttributeCues();

    private static Map<String, EntityKind> buildEntityVocabulary() {
        Map<String, EntityKind> vocabulary = new LinkedHashMap<>();
        for (String term : List.of("user", "customer", "administrator", "operator", "member")) {
            vocabulary.put(term, EntityKind.ACTOR);
        }
        for (String term : List.of("product", "item", "cart", "order", "account")) {
            vocabulary.put(term, EntityKind.OBJECT);
        }
        for (String term : List.of("data", "information", "price", "amount", "inventory", "payment")) {
            vocabulary.put(term, EntityKind.DATA);
        }
        for (String term : List.of("system", "service", "application")) {
            vocabulary.put(term, EntityKind.SYSTEM);
        }
        return Collections.unmodifiableMap(vocabulary);
    }

    private static Map<String, Cue> buildEntityCues() {
        Map<String, Cue> cues = new LinkedHashMap<>();
        ENTITY_VOCABULARY.keySet().forEach(term -> cues.put(term, Cue.of(term)));
        return Collections.unmodifiableMap(cues);
    }

    private static Map<String, List<AttributeCue>> buildAttributeCues() {
        Map<String, List<AttributeCue>> cues = new LinkedHashMap<>();
        ENTITY_CUES.forEach((term, cue) -> cues.put(term, AttributeCue.forEntity(cue)));
        return Collections.unmodifiableMap(cues);
    }

    public static List<String> entityTerms() {
        return List.copyOf(ENTITY_VOCABULARY.keySet());
    }

    public static EntityKind kindOf(String term) {
        return ENTITY_VOCABULARY.getOrDefault(term, EntityKind.OBJECT);
    }

    public static Cue entityCue(String name) {
        Cue cue = ENTITY_CUES.get(name);
        return cue != null ? cue : Cue.of(name);
    }

    static List<AttributeCue> attributeCues(String entityName) {
        List<AttributeCue> cues = ATTRIBUTE_CUES.get(entityName);
        return cues != null ? cues : AttributeCue.forEntity(entityCue(entityName));
    }

    public static boolean hasComparison(String text) {
        if (text == null) {
            return false;
        }
        for (String operator : COMPARISON_OPERATORS) {
            if (text.contains(operator)) {
                return true;
            }
        }
        return COMPARISON_PHRASES.anyIn(text) || NUMERIC_TOKEN.matcher(text).find();
    }
}
