package work.lcod.typeset.exec;

import java.util.Optional;

/**
 * Finite state machine for spacing and break coalescing.
 *
 * <p>A soft item is only remembered directly after content and is only emitted once more
 * content follows. A hard item resets the machine, so soft items never appear next to it.
 */
final class BreakAutomaton<T> {
    enum Kind {
        NONE,
        ANY,
        SOFT
    }

    private Kind kind = Kind.NONE;
    private T pending;

    /**
     * Called right before content is emitted. Returns the pending soft item, if any.
     */
    Optional<T> any() {
        T soft = kind == Kind.SOFT ? pending : null;
        kind = Kind.ANY;
        pending = null;
        return Optional.ofNullable(soft);
    }

    void soft(T item) {
        if (kind == Kind.ANY) {
            kind = Kind.SOFT;
            pending = item;
        }
    }

    void hard() {
        kind = Kind.NONE;
        pending = null;
    }

    Kind kind() {
        return kind;
    }
}
