package gap.detector.checklist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import gap.detector.classify.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through cache of category checklist templates, loaded from
 * {@code <location>/<category>.yaml}. A missing file yields an empty checklist;
 * a file that cannot be read as a template is a {@link ChecklistTemplateException}.
 * <p>
 * Templates are immutable, so two callers racing on the same category may both read
 * the file; whichever result lands in the cache first is served from then on.
 */
@Component
public class ChecklistTemplateRepository {
    private static final Logger log = LoggerFactory.getLogger(ChecklistTemplateRepository.class);

    private final ResourceLoader resourceLoader;
    private final String location;
    private final ObjectMapper yamlMapper = new YAMLMapper();
    private final Map<ActionType, ChecklistTemplate> cache = new ConcurrentHashMap<>();

    public ChecklistTemplateRepository(
            ResourceLoader resourceLoader,
            @Value("${gap.detector.checklist.location:classpath:checklists/}") String location
    ) {
        this.resourceLoader = resourceLoader;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    public ChecklistTemplate load(ActionType actionType) {
        ChecklistTemplate cached = cache.get(actionType);
        if (cached != null) {
            return cached;
        }
        ChecklistTemplate loaded = read(actionType);
        ChecklistTemplate previous = cache.putIfAbsent(actionType, loaded);
        return previous != null ? previous : loaded;
    }

    public List<ChecklistItem> checklistFor(ActionType actionType) {
        return load(actionType).checklist();
    }

    private ChecklistTemplate read(ActionType actionType) {
        if (!actionType.isKnown()) {
            return ChecklistTemplate.empty();
        }
        String path = location + actionType.templateKey() + ".yaml";
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            log.debug("event=checklist_template_missing action_type={} path={}", actionType, path);
            return ChecklistTemplate.empty();
        }

        ChecklistTemplate template;
        try (InputStream in = resource.getInputStream()) {
            template = yamlMapper.readValue(in, ChecklistTemplate.class);
        } catch (JsonProcessingException e) {
            throw new ChecklistTemplateException(
                    "Malformed checklist template " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ChecklistTemplateException("Cannot read checklist template " + path, e);
        }
        if (template == null) {
            throw new ChecklistTemplateException("Checklist template " + path + " is empty");
        }
        validate(template, path);
        log.debug("event=checklist_template_loaded action_type={} path={} items={}",
                actionType, path, template.checklist().size());
        return template;
    }

    private static void validate(ChecklistTemplate template, String path) {
        for (int i = 0; i < template.checklist().size(); i++) {
            ChecklistItem item = template.checklist().get(i);
            if (item == null || isBlank(item.id()) || isBlank(item.title())) {
                throw new ChecklistTemplateException(
                        "Checklist template " + path + " item #" + (i + 1) + " needs an id and a title");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
