package work.lcod.typeset.diag;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A diagnostic message with a severity and the template location it refers to.
 */
public record Diag(Level level, Span span, String message) {
    public Diag {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(message, "message");
    }

    public static Diag error(Span span, String message) {
        return new Diag(Level.ERROR, span, message);
    }

    public static Diag warning(Span span, String message) {
        return new Diag(Level.WARNING, span, message);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("level", level.name().toLowerCase(Locale.ROOT));
        map.put("span", span.path());
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return level.name().toLowerCase(Locale.ROOT) + ": " + span + ": " + message;
    }
}
