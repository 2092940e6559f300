package work.lcod.typeset.cli;

import picocli.CommandLine;
import work.lcod.typeset.config.StyleConfigLoader;
import work.lcod.typeset.exec.ExecutionContext;

/**
 * Version from the jar manifest, plus the input formats this build understands.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = TypesetCommand.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-typeset " + (implementationVersion != null ? implementationVersion : "development"),
            "templates: yaml, json; style: " + StyleConfigLoader.DEFAULT_FILE_NAME,
            "default max group depth: " + ExecutionContext.DEFAULT_MAX_GROUP_DEPTH
        };
    }
}
