package work.lcod.typeset.layout;

import java.util.Objects;
import work.lcod.typeset.geom.Align;
import work.lcod.typeset.geom.Gen;
import work.lcod.typeset.geom.Length;

/**
 * A block-level child of a stack.
 */
public sealed interface StackChild {
    record Spacing(Length amount) implements StackChild {
        public Spacing {
            Objects.requireNonNull(amount, "amount");
        }
    }

    record Any(LayoutNode node, Gen<Align> aligns) implements StackChild {
        public Any {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(aligns, "aligns");
        }
    }
}
