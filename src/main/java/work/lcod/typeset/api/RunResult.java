package work.lcod.typeset.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.typeset.diag.Diag;
import work.lcod.typeset.diag.Pass;
import work.lcod.typeset.layout.Tree;
import work.lcod.typeset.layout.TreeSerializer;

/**
 * Outcome of typesetting one template.
 *
 * <p>A run that reached {@code finish()} carries its tree and diagnostics even when
 * error diagnostics make it a failure. A run aborted by a load or style error only
 * carries the error message.
 */
public record RunResult(
    Status status,
    String template,
    Optional<Pass<Tree>> pass,
    Optional<String> error,
    Instant startedAt,
    Instant finishedAt
) {
    static final String ERRORS_MESSAGE = "Template produced errors";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(error, "error");
    }

    public static RunResult completed(String template, Pass<Tree> pass, Instant startedAt) {
        boolean failed = pass.diags().hasErrors();
        return new RunResult(
            failed ? Status.FAILURE : Status.SUCCESS,
            template,
            Optional.of(pass),
            failed ? Optional.of(ERRORS_MESSAGE) : Optional.empty(),
            startedAt,
            Instant.now()
        );
    }

    public static RunResult aborted(String template, String error, Instant startedAt) {
        String message = error == null || error.isBlank() ? "Typesetting failed" : error;
        return new RunResult(Status.FAILURE, template, Optional.empty(), Optional.of(message), startedAt, Instant.now());
    }

    public int pageCount() {
        return pass.map(p -> p.output().pageCount()).orElse(0);
    }

    public List<Diag> diagnostics() {
        return pass.map(p -> p.diags().toList()).orElse(List.of());
    }

    public Optional<Tree> tree() {
        return pass.map(Pass::output);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        map.put("template", template);
        error.ifPresent(message -> map.put("error", message));
        map.put("pages", pageCount());
        map.put("diagnostics", pass.map(p -> p.diags().toMaps()).orElse(List.of()));
        tree().ifPresent(tree -> map.put("tree", TreeSerializer.toMap(tree)));
        map.put("startedAt", startedAt.toString());
        map.put("finishedAt", finishedAt.toString());
        return map;
    }

    public String toJson() {
        try {
            return WRITER.writeValueAsString(toMap());
        } catch (JsonProcessingException ex) {
            var fallback = JSON.createObjectNode()
                .put("status", Status.FAILURE.name().toLowerCase(Locale.ROOT))
                .put("template", template)
                .put("error", "Unable to serialize result: " + ex.getOriginalMessage());
            return fallback.toPrettyString();
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
