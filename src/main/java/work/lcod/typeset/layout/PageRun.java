package work.lcod.typeset.layout;

import java.util.Objects;
import work.lcod.typeset.geom.Size;

/**
 * A finished page: its size and the padded block content.
 */
public record PageRun(Size size, LayoutNode child) {
    public PageRun {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(child, "child");
    }
}
