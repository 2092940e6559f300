package work.lcod.typeset.template;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.typeset.diag.Diag;
import work.lcod.typeset.diag.Span;
import work.lcod.typeset.exec.ExecutionContext;
import work.lcod.typeset.exec.State;
import work.lcod.typeset.exec.Template;
import work.lcod.typeset.geom.GenAxis;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.layout.FixedNode;
import work.lcod.typeset.shared.LengthParser;

/**
 * Evaluates template events against an {@link ExecutionContext}, in document order.
 *
 * <p>Malformed events never abort the run: they are reported as diagnostics at their path and skipped.
 */
public final class TemplateRunner {
    private static final String BODY_KEY = "body";
    private static final Set<String> STYLE_KINDS = Set.of("font", "par", "align", "lang");

    private final Deque<Path> includes = new ArrayDeque<>();

    public void run(ExecutionContext ctx, TemplateDocument document) {
        run(ctx, document.events(), new Span("template"));
    }

    /**
     * Wraps events into a {@link Template} executed by this runner.
     */
    public Template template(List<?> events, Span span) {
        return ctx -> run(ctx, events, span);
    }

    public void run(ExecutionContext ctx, List<?> events, Span span) {
        if (events == null) {
            return;
        }
        for (int index = 0; index < events.size(); index++) {
            var eventSpan = span.index(index);
            try {
                runEvent(ctx, events.get(index), eventSpan);
            } catch (IllegalArgumentException ex) {
                ctx.diag(Diag.error(eventSpan, ex.getMessage()));
            }
        }
    }

    private void runEvent(ExecutionContext ctx, Object event, Span span) {
        if (event instanceof String keyword) {
            runKeyword(ctx, keyword, Map.of(), span);
            return;
        }
        if (!(event instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Unsupported template event: " + event);
        }
        var map = castMap(raw);
        var kinds = new LinkedHashSet<>(map.keySet());
        kinds.remove(BODY_KEY);
        if (kinds.size() != 1) {
            throw new IllegalArgumentException("Template event must have exactly one kind, found " + kinds);
        }
        String kind = kinds.iterator().next();
        Object value = map.get(kind);
        Optional<List<?>> body = bodyOf(map);

        if (STYLE_KINDS.contains(kind)) {
            runStyled(ctx, kind, value, body, span);
            return;
        }
        if (body.isPresent() && !"page".equals(kind) && !"box".equals(kind)) {
            throw new IllegalArgumentException("Event '" + kind + "' does not take a body");
        }
        switch (kind) {
            case "text" -> ctx.pushText(stringValue(value, kind));
            case "h" -> ctx.pushSpacing(GenAxis.CROSS, resolveSpacing(ctx, value, kind));
            case "v" -> ctx.pushSpacing(GenAxis.MAIN, resolveSpacing(ctx, value, kind));
            case "raw" -> runRaw(ctx, value);
            case "page" -> runPage(ctx, value, body, span);
            case "box" -> runBox(ctx, value, body, span);
            case "include" -> runInclude(ctx, stringValue(value, kind), span);
            default -> runKeyword(ctx, kind, value instanceof Map<?, ?> opts ? castMap(opts) : Map.of(), span);
        }
    }

    private void runKeyword(ExecutionContext ctx, String keyword, Map<String, Object> options, Span span) {
        switch (keyword) {
            case "space" -> ctx.pushWordSpace();
            case "linebreak" -> ctx.linebreak();
            case "parbreak" -> ctx.parbreak();
            case "pagebreak" -> ctx.pagebreak(Boolean.TRUE.equals(options.get("keep")), true, span);
            default -> throw new IllegalArgumentException("Unknown template event: " + keyword);
        }
    }

    private void runStyled(ExecutionContext ctx, String kind, Object value, Optional<List<?>> body, Span span) {
        State snapshot = ctx.state();
        State styled = switch (kind) {
            case "font" -> StyleOptions.font(snapshot, options(value, kind));
            case "par" -> StyleOptions.par(snapshot, options(value, kind));
            case "align" -> StyleOptions.align(snapshot, value);
            default -> StyleOptions.lang(snapshot, value);
        };
        ctx.setState(styled);
        if (body.isPresent()) {
            try {
                run(ctx, body.get(), span.child(BODY_KEY));
            } finally {
                ctx.setState(snapshot);
            }
        }
    }

    private void runRaw(ExecutionContext ctx, Object value) {
        String text;
        boolean block = false;
        if (value instanceof Map<?, ?> raw) {
            var options = castMap(raw);
            text = stringValue(options.get("text"), "raw");
            block = Boolean.TRUE.equals(options.get("block"));
        } else {
            text = stringValue(value, "raw");
        }

        State snapshot = ctx.state();
        ctx.setMonospace();
        try {
            if (block) {
                ctx.parbreak();
            }
            ctx.pushText(text);
            if (block) {
                ctx.parbreak();
            }
        } finally {
            ctx.setState(snapshot);
        }
    }

    private void runPage(ExecutionContext ctx, Object value, Optional<List<?>> body, Span span) {
        var options = value == null ? Map.<String, Object>of() : options(value, "page");
        State snapshot = ctx.state();
        ctx.setState(StyleOptions.page(snapshot, options));
        ctx.pagebreak(false, true, span);
        if (body.isPresent()) {
            run(ctx, body.get(), span.child(BODY_KEY));
            ctx.setState(snapshot);
            ctx.pagebreak(true, false, span);
        }
    }

    private void runBox(ExecutionContext ctx, Object value, Optional<List<?>> body, Span span) {
        var options = value == null ? Map.<String, Object>of() : options(value, "box");
        var width = LengthParser.parseValue(options.get("width"));
        var height = LengthParser.parseValue(options.get("height"));
        List<?> events = body.orElse(List.of());
        var group = ctx.execGroup(template(events, span.child(BODY_KEY)), span);
        ctx.push(new FixedNode(width, height, group));
    }

    private void runInclude(ExecutionContext ctx, String location, Span span) {
        Path path = ctx.env().resolve(location);
        if (includes.contains(path)) {
            ctx.diag(Diag.error(span, "cyclic include of " + location));
            return;
        }
        TemplateDocument document;
        try {
            document = ctx.env().load(path, TemplateDocument.class, TemplateLoader::loadFromLocalFile);
        } catch (TemplateLoadException ex) {
            ctx.diag(Diag.error(span, "cannot include " + location + ": " + ex.getMessage()));
            return;
        }
        includes.push(path);
        try {
            run(ctx, document.events(), span.child("include"));
        } finally {
            includes.pop();
        }
    }

    private Length resolveSpacing(ExecutionContext ctx, Object value, String kind) {
        Linear amount = LengthParser.parseValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Event '" + kind + "' requires a length"));
        return amount.resolve(ctx.state().font().resolveSize());
    }

    private static Optional<List<?>> bodyOf(Map<String, Object> map) {
        if (!map.containsKey(BODY_KEY)) {
            return Optional.empty();
        }
        Object body = map.get(BODY_KEY);
        if (body == null) {
            return Optional.of(List.of());
        }
        if (!(body instanceof List<?> list)) {
            throw new IllegalArgumentException("'body' must be a list of events");
        }
        return Optional.of(list);
    }

    private static String stringValue(Object value, String kind) {
        if (value == null) {
            throw new IllegalArgumentException("Event '" + kind + "' requires a value");
        }
        return String.valueOf(value);
    }

    private static Map<String, Object> options(Object value, String kind) {
        if (value instanceof Map<?, ?> map) {
            return castMap(map);
        }
        throw new IllegalArgumentException("Event '" + kind + "' expects a mapping of options");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
