package gap.detector.checklist;

public class ChecklistTemplateException extends RuntimeException {
    public ChecklistTemplateException(String message) {
        super(message);
    }

    public ChecklistTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
