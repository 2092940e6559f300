package work.lcod.typeset.layout;

import java.util.List;
import java.util.Objects;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Gen;

/**
 * Block-level children stacked along the main direction.
 */
public record StackNode(Gen<Dir> dirs, List<StackChild> children) implements LayoutNode {
    public StackNode {
        Objects.requireNonNull(dirs, "dirs");
        children = List.copyOf(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
