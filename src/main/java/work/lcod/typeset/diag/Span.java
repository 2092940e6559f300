package work.lcod.typeset.diag;

import java.util.Objects;

/**
 * Locates an event inside a template, e.g. {@code template[2].body[0]}.
 */
public record Span(String path) {
    public static final Span DETACHED = new Span("");

    public Span {
        Objects.requireNonNull(path, "path");
    }

    public Span child(String key) {
        return new Span(path.isEmpty() ? key : path + "." + key);
    }

    public Span index(int index) {
        return new Span(path + "[" + index + "]");
    }

    public boolean isDetached() {
        return path.isEmpty();
    }

    @Override
    public String toString() {
        return isDetached() ? "<detached>" : path;
    }
}
