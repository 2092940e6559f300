package work.lcod.typeset.api;

import java.time.Instant;
import java.util.Locale;
import work.lcod.typeset.config.StyleConfigLoader;
import work.lcod.typeset.diag.Diag;
import work.lcod.typeset.diag.Level;
import work.lcod.typeset.diag.Pass;
import work.lcod.typeset.exec.Env;
import work.lcod.typeset.exec.ExecutionContext;
import work.lcod.typeset.exec.State;
import work.lcod.typeset.layout.Tree;
import work.lcod.typeset.template.TemplateDocument;
import work.lcod.typeset.template.TemplateLoader;
import work.lcod.typeset.template.TemplateRunner;

/**
 * Public entry point for embedding the typesetter: loads a template, executes it and
 * returns the layout tree with its diagnostics.
 */
public final class TypesetRunner {
    /** System property that makes failures print their stack trace. */
    public static final String DEBUG_PROPERTY = "lcod.debug";

    public RunResult run(TypesetConfiguration configuration) {
        var started = Instant.now();
        var logLevel = configuration.logLevel();
        try {
            log(logLevel, LogLevel.DEBUG, "Loading template " + configuration.template());
            TemplateDocument document = TemplateLoader.loadFromLocalFile(configuration.template());
            State base = configuration.styleFile()
                .map(path -> {
                    log(logLevel, LogLevel.DEBUG, "Loading style file " + path);
                    return StyleConfigLoader.load(path);
                })
                .orElse(State.DEFAULT);

            var env = new Env(configuration.workingDirectory());
            var ctx = new ExecutionContext(env, base, configuration.maxGroupDepth());
            new TemplateRunner().run(ctx, document);
            Pass<Tree> pass = ctx.finish();

            for (Diag diag : pass.diags()) {
                log(logLevel, diag.level() == Level.ERROR ? LogLevel.ERROR : LogLevel.WARN, diag.toString());
            }
            log(logLevel, LogLevel.INFO, "Built " + pass.output().pageCount() + " page(s) from " + document.name());
            return RunResult.completed(document.name(), pass, started);
        } catch (RuntimeException ex) {
            log(logLevel, LogLevel.FATAL, "Typesetting failed: " + ex.getMessage());
            if (Boolean.getBoolean(DEBUG_PROPERTY)) {
                ex.printStackTrace();
            }
            return RunResult.aborted(configuration.template().toString(), ex.getMessage(), started);
        }
    }

    /**
     * Runs and renders the result as pretty-printed JSON.
     */
    public String runToJson(TypesetConfiguration configuration) {
        return run(configuration).toJson();
    }

    private static void log(LogLevel threshold, LogLevel level, String message) {
        if (threshold.allows(level)) {
            System.err.println("[" + level.name().toLowerCase(Locale.ROOT) + "] " + message);
        }
    }
}
