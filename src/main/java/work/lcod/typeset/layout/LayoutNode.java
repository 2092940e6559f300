package work.lcod.typeset.layout;

/**
 * A node of the layout tree handed to the downstream layouter.
 */
public sealed interface LayoutNode permits ParNode, StackNode, PadNode, FixedNode {
}
