package work.lcod.typeset.layout;

import java.util.List;
import java.util.Objects;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Length;

/**
 * A paragraph: inline children laid out in lines.
 */
public record ParNode(Dir dir, Length lineSpacing, List<ParChild> children) implements LayoutNode {
    public ParNode {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(lineSpacing, "lineSpacing");
        children = List.copyOf(children);
    }
}
