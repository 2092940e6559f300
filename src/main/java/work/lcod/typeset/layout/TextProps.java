package work.lcod.typeset.layout;

import java.util.List;
import java.util.Objects;
import work.lcod.typeset.geom.Length;

/**
 * Resolved properties of a text run. Two runs with equal properties can be merged.
 */
public record TextProps(List<String> families, Length size, boolean strong, boolean emph) {
    public TextProps {
        families = List.copyOf(families);
        Objects.requireNonNull(size, "size");
    }
}
