package work.lcod.typeset.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.typeset.geom.Align;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Gen;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.layout.ParChild;
import work.lcod.typeset.layout.ParNode;
import work.lcod.typeset.layout.StackChild;
import work.lcod.typeset.layout.TextNode;

/**
 * Collects the inline children of one paragraph.
 */
final class ParBuilder {
    private final Gen<Align> aligns;
    private final Dir dir;
    private final Length lineSpacing;
    private final List<ParChild> children = new ArrayList<>();
    private final BreakAutomaton<ParChild> last = new BreakAutomaton<>();
    private boolean built;

    ParBuilder(State state) {
        Length em = state.font().resolveSize();
        this.aligns = state.aligns();
        this.dir = state.lang().dir();
        this.lineSpacing = state.par().leading().resolve(em);
    }

    void push(ParChild child) {
        ensureOpen();
        last.any().ifPresent(children::add);
        children.add(child);
    }

    /**
     * Appends text with the properties of {@code state}, merging it into the previous run
     * when alignment and properties match.
     */
    void pushText(String text, State state) {
        ensureOpen();
        last.any().ifPresent(children::add);

        Align align = state.aligns().cross();
        var props = state.font().resolveProps();

        int lastIndex = children.size() - 1;
        if (lastIndex >= 0 && children.get(lastIndex) instanceof ParChild.Text prev
            && prev.align() == align
            && prev.node().props().equals(props)) {
            children.set(lastIndex, new ParChild.Text(prev.node().append(text), align));
            return;
        }

        children.add(new ParChild.Text(new TextNode(text, props), align));
    }

    void pushSoft(ParChild child) {
        ensureOpen();
        last.soft(child);
    }

    void pushHard(ParChild child) {
        ensureOpen();
        last.hard();
        children.add(child);
    }

    Optional<StackChild> build() {
        ensureOpen();
        built = true;
        if (children.isEmpty()) {
            return Optional.empty();
        }
        var node = new ParNode(dir, lineSpacing, children);
        return Optional.of(new StackChild.Any(node, aligns));
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Paragraph builder was already built");
        }
    }
}
