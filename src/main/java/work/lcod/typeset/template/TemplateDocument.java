package work.lcod.typeset.template;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A loaded template: its display name and the raw event list.
 */
public record TemplateDocument(String name, List<Object> events) {
    public TemplateDocument {
        Objects.requireNonNull(name, "name");
        events = Collections.unmodifiableList(events);
    }
}
