package work.lcod.typeset.layout;

import java.util.Objects;
import java.util.Optional;
import work.lcod.typeset.geom.Linear;

/**
 * Gives a child a fixed width and/or height.
 */
public record FixedNode(Optional<Linear> width, Optional<Linear> height, LayoutNode child) implements LayoutNode {
    public FixedNode {
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(height, "height");
        Objects.requireNonNull(child, "child");
    }
}
