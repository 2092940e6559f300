package work.lcod.typeset.layout;

import java.util.Objects;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Sides;

/**
 * Adds padding around a child. Relative padding resolves against the available space.
 */
public record PadNode(Sides<Linear> padding, LayoutNode child) implements LayoutNode {
    public PadNode {
        Objects.requireNonNull(padding, "padding");
        Objects.requireNonNull(child, "child");
    }
}
