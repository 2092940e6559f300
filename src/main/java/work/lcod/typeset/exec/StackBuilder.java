package work.lcod.typeset.exec;

import java.util.ArrayList;
import java.util.List;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Gen;
import work.lcod.typeset.layout.StackChild;
import work.lcod.typeset.layout.StackNode;

/**
 * Collects the block-level children of one flow. Inline content goes to the open paragraph,
 * which is closed by {@link #parbreak(State)} or {@link #build()}.
 */
final class StackBuilder {
    private final Gen<Dir> dirs;
    private final List<StackChild> children = new ArrayList<>();
    private final BreakAutomaton<StackChild> last = new BreakAutomaton<>();
    private ParBuilder par;
    private boolean built;

    StackBuilder(State state) {
        this.dirs = new Gen<>(state.lang().dir(), Dir.TTB);
        this.par = new ParBuilder(state);
    }

    ParBuilder par() {
        ensureOpen();
        return par;
    }

    void pushSoft(StackChild child) {
        ensureOpen();
        last.soft(child);
    }

    void pushHard(StackChild child) {
        ensureOpen();
        last.hard();
        children.add(child);
    }

    void parbreak(State state) {
        ensureOpen();
        var finished = par;
        par = new ParBuilder(state);
        finished.build().ifPresent(this::pushParagraph);
    }

    StackNode build() {
        ensureOpen();
        par.build().ifPresent(this::pushParagraph);
        built = true;
        return new StackNode(dirs, children);
    }

    private void pushParagraph(StackChild paragraph) {
        last.any().ifPresent(children::add);
        children.add(paragraph);
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Stack builder was already built");
        }
    }
}
