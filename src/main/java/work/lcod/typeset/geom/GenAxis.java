package work.lcod.typeset.geom;

/**
 * The generic layout axes. Paragraphs stack along {@link #MAIN}, text flows along {@link #CROSS}.
 */
public enum GenAxis {
    CROSS,
    MAIN
}
