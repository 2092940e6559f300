package work.lcod.typeset.exec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The environment from which resources are gathered during execution.
 * Relative resource paths resolve against the base directory and loaded resources are cached.
 */
public final class Env {
    private final Path baseDirectory;
    private final Map<Path, Object> resources = new LinkedHashMap<>();

    public Env() {
        this(null);
    }

    public Env(Path baseDirectory) {
        this.baseDirectory = baseDirectory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : baseDirectory.toAbsolutePath().normalize();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    public Path resolve(String path) {
        return baseDirectory.resolve(path).toAbsolutePath().normalize();
    }

    /**
     * Returns the resource at {@code path}, loading it with {@code loader} on first access.
     */
    public <T> T load(Path path, Class<T> type, Function<Path, ? extends T> loader) {
        var key = path.toAbsolutePath().normalize();
        Object cached = resources.get(key);
        if (cached == null) {
            cached = loader.apply(key);
            resources.put(key, cached);
        }
        if (!type.isInstance(cached)) {
            throw new IllegalStateException("Resource " + key + " is not a " + type.getSimpleName());
        }
        return type.cast(cached);
    }

    public int loadedCount() {
        return resources.size();
    }
}
