package work.lcod.typeset.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.layout.TextProps;

/**
 * Font settings. The effective size is {@code scale} resolved against {@code size}.
 */
public record FontState(List<FontFamily> families, Length size, Linear scale, boolean strong, boolean emph) {
    public static final FontState DEFAULT = new FontState(
        List.of(FontFamily.SERIF),
        Length.pt(11),
        Linear.rel(1),
        false,
        false
    );

    public FontState {
        families = List.copyOf(families);
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(scale, "scale");
    }

    public Length resolveSize() {
        return scale.resolve(size);
    }

    public TextProps resolveProps() {
        var names = new ArrayList<String>(families.size());
        for (FontFamily family : families) {
            names.add(family.name());
        }
        return new TextProps(names, resolveSize(), strong, emph);
    }

    public FontState withFamilies(List<FontFamily> families) {
        return new FontState(families, size, scale, strong, emph);
    }

    /**
     * Inserts {@code family} in front of the preference list. Earlier entries stay, even
     * when they name the same family.
     */
    public FontState withPreferred(FontFamily family) {
        var list = new ArrayList<FontFamily>(families.size() + 1);
        list.add(family);
        list.addAll(families);
        return withFamilies(list);
    }

    /**
     * An absolute amount replaces the base size, a relative one scales it.
     */
    public FontState withSize(Linear amount) {
        if (amount.isAbsolute()) {
            return new FontState(families, amount.abs(), Linear.rel(1), strong, emph);
        }
        return new FontState(families, size, amount, strong, emph);
    }

    public FontState withStrong(boolean strong) {
        return new FontState(families, size, scale, strong, emph);
    }

    public FontState withEmph(boolean emph) {
        return new FontState(families, size, scale, strong, emph);
    }
}
