package work.lcod.typeset.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.typeset.exec.ExecutionContext;

/**
 * Immutable configuration for one typesetting run.
 */
public record TypesetConfiguration(
    Path template,
    Path workingDirectory,
    Optional<Path> styleFile,
    LogLevel logLevel,
    int maxGroupDepth
) {
    public TypesetConfiguration {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(styleFile, "styleFile");
        Objects.requireNonNull(logLevel, "logLevel");
        if (maxGroupDepth < 0) {
            throw new IllegalArgumentException("maxGroupDepth must not be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path template;
        private Path workingDirectory;
        private Optional<Path> styleFile = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;
        private int maxGroupDepth = ExecutionContext.DEFAULT_MAX_GROUP_DEPTH;

        public Builder template(Path template) {
            this.template = template;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder styleFile(Path styleFile) {
            this.styleFile = Optional.ofNullable(styleFile);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder maxGroupDepth(int maxGroupDepth) {
            this.maxGroupDepth = maxGroupDepth;
            return this;
        }

        public TypesetConfiguration build() {
            Path resolvedWorkingDirectory = workingDirectory;
            if (resolvedWorkingDirectory == null && template != null) {
                Path parent = template.toAbsolutePath().getParent();
                resolvedWorkingDirectory = parent != null ? parent : template.toAbsolutePath();
            }
            return new TypesetConfiguration(
                template,
                resolvedWorkingDirectory,
                styleFile,
                logLevel,
                maxGroupDepth
            );
        }
    }
}
