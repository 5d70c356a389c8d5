package gap.detector.checklist;

import gap.detector.classify.ActionClassification;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public record ChecklistContext(String entity, String integrationName, List<String> relatedEntities) {
    // LINE stays case-sensitive so the common word "line" is not read as the service.
    private static final Pattern NAMED_SERVICE = Pattern.compile(
            "(?<![\\p{L}\\p{N}])((?i:Slack|Google|Twitter|Stripe|GitHub)|LINE)(?![\\p{L}\\p{N}])");
    private static final List<String> SERVICE_NAMES = List.of("Slack", "Google", "Twitter", "LINE", "Stripe", "GitHub");

    public ChecklistContext {
        relatedEntities = relatedEntities == null ? List.of() : List.copyOf(relatedEntities);
    }

    public static ChecklistContext empty() {
        return new ChecklistContext(null, null, List.of());
    }

    public static ChecklistContext from(ActionClassification classification, String text) {
        List<String> entities = classification.detectedEntities();
        String primary = entities.isEmpty() ? null : entities.get(0);
        List<String> related = entities.size() > 1 ? entities.subList(1, entities.size()) : List.of();

        String integration = null;
        if (text != null) {
            Matcher matcher = NAMED_SERVICE.matcher(text);
            if (matcher.find()) {
                integration = canonicalServiceName(matcher.group(1));
            }
        }
        return new ChecklistContext(primary, integration, related);
    }

    private static String canonicalServiceName(String found) {
        return SERVICE_NAMES.stream().filter(found::equalsIgnoreCase).findFirst().orElse(found);
    }

    public String fill(String template) {
        if (template == null) {
            return null;
        }
        String filled = template;
        if (entity != null) {
            filled = filled.replace("{entity}", entity);
        }
        if (integrationName != null) {
            filled = filled.replace("{api_name}", integrationName);
        }
        if (!relatedEntities.isEmpty()) {
            filled = filled.replace("{related_entities}",
                    relatedEntities.stream().map(e -> "  - " + e).collect(Collectors.joining("\n")));
        }
        return filled;
    }
}
