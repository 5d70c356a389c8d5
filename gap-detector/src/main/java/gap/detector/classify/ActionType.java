package gap.detector.classify;

import gap.detector.model.Severity;
import gap.detector.parse.CueSet;

import java.util.List;
import java.util.Locale;

public enum ActionType {
    DELETE("deletion", Severity.HIGH, 1.5,
            CueSet.of("delete", "remove", "erase", "clear", "purge", "discard", "destroy"),
            List.of("logical vs physical deletion", "recoverability", "cascade deletion scope",
                    "deletion permission", "deletion log")),
    CREATE("creation", Severity.MEDIUM, 1.0,
            CueSet.of("create", "add", "register", "generate", "insert", "sign up"),
            List.of("required fields", "validation", "duplicate check", "initial values")),
    UPDATE("update", Severity.MEDIUM, 1.2,
            CueSet.of("update", "change", "modify", "edit", "overwrite", "fix"),
            List.of("target identification", "partial vs full update", "update permission", "change history")),
    DISPLAY("display", Severity.LOW, 0.7,
            CueSet.of("display", "show", "view", "list", "detail", "browse", "screen"),
            List.of("display limit", "pagination", "sort order", "empty state")),
    AUTHENTICATION("authentication", Severity.CRITICAL, 1.8,
            CueSet.of("authenticate", "authentication", "login", "log in", "logout", "log out", "sign in",
                    "password", "token"),
            List.of("authentication method", "token expiry", "token storage", "session management")),
    EXTERNAL_API("external integration", Severity.HIGH, 1.4,
            CueSet.of("api", "integration", "integrate", "external", "webhook", "third-party", "slack",
                    "google", "twitter"),
            List.of("timeout", "retry strategy", "credential management", "fallback on error")),
    DATA_MIGRATION("data migration", Severity.HIGH, 1.6,
            CueSet.of("migrate", "migration", "transfer", "convert", "legacy", "import"),
            List.of("data volume", "rollback", "validation", "existing data")),
    BATCH_PROCESS("batch processing", Severity.MEDIUM, 1.3,
            CueSet.of("batch", "schedule", "scheduled", "periodic", "bulk", "nightly", "cron"),
            List.of("execution timing", "duration estimate", "failure notification", "rerun")),
    SEARCH("search", Severity.MEDIUM, 0.9,
            CueSet.of("search", "find", "filter", "narrow down", "query", "lookup"),
            List.of("searchable fields", "partial vs exact match", "search performance", "empty result")),
    NOTIFICATION("notification", Severity.MEDIUM, 1.1,
            CueSet.of("notify", "notification", "email", "alert", "announcement", "send"),
            List.of("notification timing", "send failure", "duplicate prevention", "opt-out")),
    IMPORT_EXPORT("import/export", Severity.MEDIUM, 1.2,
            CueSet.of("export", "download", "csv", "excel", "import", "upload"),
            List.of("file format", "size limit", "error rows", "character encoding")),
    UNKNOWN("unknown", Severity.LOW, 1.0, CueSet.of(), List.of());

    private final String label;
    private final Severity baseSeverity;
    private final double severityMultiplier;
    private final CueSet keywords;
    private final List<String> criticalConcerns;

    ActionType(String label, Severity baseSeverity, double severityMultiplier,
               CueSet keywords, List<String> criticalConcerns) {
        this.label = label;
        this.baseSeverity = baseSeverity;
        this.severityMultiplier = severityMultiplier;
        this.keywords = keywords;
        this.criticalConcerns = criticalConcerns;
    }

    public String label() {
        return label;
    }

    public Severity baseSeverity() {
        return baseSeverity;
    }

    public double severityMultiplier() {
        return severityMultiplier;
    }

    public CueSet keywords() {
        return keywords;
    }

    public List<String> criticalConcerns() {
        return criticalConcerns;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public String templateKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
