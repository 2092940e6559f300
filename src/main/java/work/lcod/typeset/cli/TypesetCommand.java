package work.lcod.typeset.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.typeset.api.LogLevel;
import work.lcod.typeset.api.RunResult;
import work.lcod.typeset.api.TypesetConfiguration;
import work.lcod.typeset.api.TypesetRunner;
import work.lcod.typeset.config.StyleConfigLoader;
import work.lcod.typeset.exec.ExecutionContext;

@CommandLine.Command(
    name = "lcod-typeset",
    description = "Build the layout tree of template documents.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TypesetCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-t", "--template"},
        required = true,
        description = "Template file (YAML or JSON).",
        arity = "1..*"
    )
    private List<String> templatePaths = new ArrayList<>();

    @CommandLine.Option(
        names = {"-s", "--style"},
        description = "TOML style file (default: typeset.toml next to the template, if present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String style;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the JSON result to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum nesting depth of boxes and other groups.",
        defaultValue = "" + ExecutionContext.DEFAULT_MAX_GROUP_DEPTH
    )
    private int maxDepth = ExecutionContext.DEFAULT_MAX_GROUP_DEPTH;

    @Override
    public Integer call() throws Exception {
        if (templatePaths == null || templatePaths.isEmpty()) {
            throw new CommandLine.ParameterException(new CommandLine(this), "At least one --template value is required.");
        }
        if (templatePaths.size() > 1 && output != null && !output.isBlank()) {
            throw new CommandLine.ParameterException(
                new CommandLine(this),
                "When using multiple --template values, --output is not supported."
            );
        }

        LogLevel logLevel = resolveLogLevel();
        TypesetRunner runner = new TypesetRunner();
        int exitCode = 0;

        for (String template : templatePaths) {
            Path templatePath = resolveTemplate(template);
            TypesetConfiguration configuration = TypesetConfiguration.builder()
                .template(templatePath)
                .styleFile(resolveStyle(templatePath))
                .logLevel(logLevel)
                .maxGroupDepth(maxDepth)
                .build();

            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            writeResult(result);
        }

        return exitCode;
    }

    private Path resolveTemplate(String value) {
        Path path = Paths.get(value).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Template file not found: " + path);
        }
        return path;
    }

    private Path resolveStyle(Path templatePath) {
        if (style != null && !style.isBlank()) {
            Path path = Paths.get(style).toAbsolutePath().normalize();
            if (!Files.isRegularFile(path)) {
                throw new CommandLine.ParameterException(new CommandLine(this), "Style file not found: " + path);
            }
            return path;
        }
        Path parent = templatePath.getParent();
        if (parent == null) {
            return null;
        }
        Path candidate = parent.resolve(StyleConfigLoader.DEFAULT_FILE_NAME);
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    private void writeResult(RunResult result) {
        String json = result.toJson();
        if (output == null || output.isBlank()) {
            System.out.println(json);
            return;
        }
        Path target = Paths.get(output).toAbsolutePath().normalize();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write output: " + ex.getMessage(), ex);
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LCOD_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }
}
