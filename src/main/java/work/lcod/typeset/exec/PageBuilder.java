package work.lcod.typeset.exec;

import java.util.Optional;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Sides;
import work.lcod.typeset.geom.Size;
import work.lcod.typeset.layout.PadNode;
import work.lcod.typeset.layout.PageRun;
import work.lcod.typeset.layout.StackNode;

/**
 * Page metrics captured when a page starts, plus whether it was started by an explicit break.
 */
final class PageBuilder {
    private final Size size;
    private final Sides<Linear> padding;
    private final boolean hard;
    private boolean built;

    PageBuilder(State state, boolean hard) {
        this.size = state.page().size();
        this.padding = state.page().resolvedMargins();
        this.hard = hard;
    }

    /**
     * Empty pages are dropped unless they were started by a hard break and {@code keep} is set.
     */
    Optional<PageRun> build(StackNode child, boolean keep) {
        if (built) {
            throw new IllegalStateException("Page builder was already built");
        }
        built = true;
        if (child.isEmpty() && !(keep && hard)) {
            return Optional.empty();
        }
        return Optional.of(new PageRun(size, new PadNode(padding, child)));
    }
}
