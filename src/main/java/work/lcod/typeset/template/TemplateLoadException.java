package work.lcod.typeset.template;

/**
 * Raised when a template document cannot be read or does not have the expected shape.
 */
public final class TemplateLoadException extends RuntimeException {
    public TemplateLoadException(String message) {
        super(message);
    }

    public TemplateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
