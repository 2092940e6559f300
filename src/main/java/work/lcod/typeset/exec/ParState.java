package work.lcod.typeset.exec;

import java.util.Objects;
import work.lcod.typeset.geom.Linear;

/**
 * Paragraph settings, each resolved against the effective font size.
 */
public record ParState(Linear spacing, Linear leading, Linear wordSpacing) {
    public static final ParState DEFAULT = new ParState(Linear.rel(1.0), Linear.rel(0.5), Linear.rel(0.25));

    public ParState {
        Objects.requireNonNull(spacing, "spacing");
        Objects.requireNonNull(leading, "leading");
        Objects.requireNonNull(wordSpacing, "wordSpacing");
    }

    public ParState withSpacing(Linear spacing) {
        return new ParState(spacing, leading, wordSpacing);
    }

    public ParState withLeading(Linear leading) {
        return new ParState(spacing, leading, wordSpacing);
    }

    public ParState withWordSpacing(Linear wordSpacing) {
        return new ParState(spacing, leading, wordSpacing);
    }
}
