package gap.detector.question;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class QuestionTemplates {
    public static final String DELETE_METHOD = "delete_method";
    public static final String CASCADE_DELETE = "cascade_delete";
    public static final String API_TIMEOUT = "api_timeout";
    public static final String API_FALLBACK = "api_fallback";
    public static final String AUTHENTICATION_METHOD = "authentication_method";
    public static final String TOKEN_STORAGE = "token_storage";

    private static final Map<String, QuestionTemplate> TEMPLATES = build();

    private QuestionTemplates() {
    }

    public static Optional<QuestionTemplate> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(TEMPLATES.get(key));
    }

    public static Map<String, QuestionTemplate> all() {
        return TEMPLATES;
    }

    private static Map<String, QuestionTemplate> build() {
        Map<String, QuestionTemplate> templates = new LinkedHashMap<>();
        register(templates, DELETE_METHOD,
                "[Deletion method]\n"
                        + "How should deleting {entity} be implemented?\n\n"
                        + "A) Logical deletion (set a deleted_at flag)\n"
                        + "   - Pros: restorable, history is kept, usable for analytics\n"
                        + "   - Cons: storage grows, every query needs WHERE deleted_at IS NULL\n\n"
                        + "B) Physical deletion (remove the record)\n"
                        + "   - Pros: simple, saves storage, easier privacy compliance\n"
                        + "   - Cons: cannot be restored, no history\n\n"
                        + "Changing this later means redesigning the whole schema.",
                List.of("Logical deletion", "Physical deletion"));
        register(templates, CASCADE_DELETE,
                "[Related data]\n"
                        + "When {entity} is deleted, what happens to the following related data?\n\n"
                        + "{related_entities}\n\n"
                        + "A) Delete everything together (cascade)\n"
                        + "B) Keep it as orphaned data\n"
                        + "C) Keep it but invalidate references (anonymize)\n"
                        + "D) Let the user choose\n\n"
                        + "Deleted data cannot be restored.",
                List.of("Cascade delete", "Keep as orphaned data", "Keep and anonymize", "Let the user choose"));
        register(templates, API_TIMEOUT,
                "[External integration]\n"
                        + "After how many seconds should a call to {api_name} time out?\n\n"
                        + "A) 5 seconds (real-time use)\n"
                        + "B) 10 seconds (typical)\n"
                        + "C) 30 seconds (heavy processing)\n"
                        + "D) 60 seconds (batch use)\n\n"
                        + "Without a timeout a slow partner can stall the whole system.",
                List.of("5 seconds", "10 seconds", "30 seconds", "60 seconds"));
        register(templates, API_FALLBACK,
                "[External outage]\n"
                        + "What should happen when {api_name} does not respond?\n\n"
                        + "A) Return cached data\n"
                        + "B) Use default values\n"
                        + "C) Show an error screen\n"
                        + "D) Queue the request and retry later\n\n"
                        + "External systems do fail. Without a fallback users are affected directly.",
                List.of("Return cached data", "Use default values", "Show an error screen", "Queue and retry later"));
        register(templates, AUTHENTICATION_METHOD,
                "[Authentication method]\n"
                        + "Which authentication method should be used?\n\n"
                        + "A) JWT (JSON Web Token)\n"
                        + "   - Pros: stateless, scales easily\n"
                        + "   - Cons: hard to revoke\n\n"
                        + "B) Server-side sessions\n"
                        + "   - Pros: easy to manage, immediate revocation\n"
                        + "   - Cons: session state lives on the server\n\n"
                        + "C) OAuth 2.0\n"
                        + "   - Pros: standard, easy to integrate external identity providers\n"
                        + "   - Cons: complex to implement\n\n"
                        + "This is the root of the architecture. Changing it later means a full rebuild.",
                List.of("JWT", "Server-side sessions", "OAuth 2.0"));
        register(templates, TOKEN_STORAGE,
                "[Token storage]\n"
                        + "Where should the client keep the authentication token?\n\n"
                        + "A) Cookie (HttpOnly, Secure)\n"
                        + "   - Pros: resistant to XSS\n"
                        + "   - Cons: needs CSRF protection\n\n"
                        + "B) LocalStorage\n"
                        + "   - Pros: simple, large capacity\n"
                        + "   - Cons: exposed to XSS\n\n"
                        + "C) SessionStorage\n"
                        + "   - Pros: cleared when the tab closes\n"
                        + "   - Cons: not persistent\n\n"
                        + "This decision is directly tied to security.",
                List.of("HttpOnly cookie", "LocalStorage", "SessionStorage"));
        return Map.copyOf(templates);
    }

    private static void register(Map<String, QuestionTemplate> templates, String key, String text,
                                 List<String> answers) {
        templates.put(key, new QuestionTemplate(key, text, answers));
    }
}
