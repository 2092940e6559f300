package work.lcod.typeset.layout;

import java.util.List;

/**
 * The finished page runs of a document, in order.
 */
public record Tree(List<PageRun> runs) {
    public Tree {
        runs = List.copyOf(runs);
    }

    public int pageCount() {
        return runs.size();
    }
}
