package work.lcod.typeset.layout;

import java.util.Objects;
import work.lcod.typeset.geom.Align;
import work.lcod.typeset.geom.Length;

/**
 * An inline child of a paragraph.
 */
public sealed interface ParChild {
    record Spacing(Length amount) implements ParChild {
        public Spacing {
            Objects.requireNonNull(amount, "amount");
        }
    }

    record Text(TextNode node, Align align) implements ParChild {
        public Text {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(align, "align");
        }
    }

    record Linebreak() implements ParChild {}

    record Any(LayoutNode node, Align align) implements ParChild {
        public Any {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(align, "align");
        }
    }
}
