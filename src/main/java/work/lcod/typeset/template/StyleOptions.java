package work.lcod.typeset.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.typeset.exec.FontFamily;
import work.lcod.typeset.exec.LangState;
import work.lcod.typeset.exec.PageState;
import work.lcod.typeset.exec.State;
import work.lcod.typeset.geom.Align;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Gen;
import work.lcod.typeset.geom.GenAxis;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Sides;
import work.lcod.typeset.geom.Size;
import work.lcod.typeset.shared.LengthParser;

/**
 * Applies option maps (from template events or the style file) to a {@link State}.
 * Invalid values raise {@link IllegalArgumentException}.
 */
public final class StyleOptions {
    private static final Map<String, Size> PAPERS = Map.of(
        "a3", new Size(Length.mm(297), Length.mm(420)),
        "a4", PageState.A4,
        "a5", new Size(Length.mm(148), Length.mm(210)),
        "letter", new Size(Length.inches(8.5), Length.inches(11)),
        "legal", new Size(Length.inches(8.5), Length.inches(14))
    );

    private StyleOptions() {}

    public static State font(State state, Map<String, Object> options) {
        var font = state.font();
        Object family = options.get("family");
        if (family == null) {
            family = options.get("families");
        }
        if (family instanceof List<?> list) {
            if (list.isEmpty()) {
                throw new IllegalArgumentException("Font family list must not be empty");
            }
            var families = new ArrayList<FontFamily>(list.size());
            for (Object item : list) {
                families.add(FontFamily.of(String.valueOf(item)));
            }
            font = font.withFamilies(families);
        } else if (family != null) {
            font = font.withPreferred(FontFamily.of(String.valueOf(family)));
        }
        var size = LengthParser.parseValue(options.get("size"));
        if (size.isPresent()) {
            font = font.withSize(size.get());
        }
        if (options.get("strong") instanceof Boolean strong) {
            font = font.withStrong(strong);
        }
        if (options.get("emph") instanceof Boolean emph) {
            font = font.withEmph(emph);
        }
        if (Boolean.TRUE.equals(options.get("monospace"))) {
            font = font.withPreferred(FontFamily.MONOSPACE);
        }
        return state.withFont(font);
    }

    public static State par(State state, Map<String, Object> options) {
        var par = state.par();
        var spacing = LengthParser.parseValue(options.get("spacing"));
        if (spacing.isPresent()) {
            par = par.withSpacing(spacing.get());
        }
        var leading = LengthParser.parseValue(options.get("leading"));
        if (leading.isPresent()) {
            par = par.withLeading(leading.get());
        }
        var wordSpacing = LengthParser.parseValue(options.get("word_spacing"));
        if (wordSpacing.isPresent()) {
            par = par.withWordSpacing(wordSpacing.get());
        }
        return state.withPar(par);
    }

    /**
     * A plain string sets the cross alignment; a mapping may set {@code cross} and {@code main}.
     */
    public static State align(State state, Object value) {
        if (value instanceof String raw) {
            return state.withAligns(state.aligns().with(GenAxis.CROSS, Align.from(raw)));
        }
        if (!(value instanceof Map<?, ?> options)) {
            throw new IllegalArgumentException("Alignment expects a string or a mapping");
        }
        Gen<Align> aligns = state.aligns();
        if (options.get("cross") != null) {
            aligns = aligns.with(GenAxis.CROSS, Align.from(String.valueOf(options.get("cross"))));
        }
        if (options.get("main") != null) {
            aligns = aligns.with(GenAxis.MAIN, Align.from(String.valueOf(options.get("main"))));
        }
        return state.withAligns(aligns);
    }

    public static State lang(State state, Object value) {
        Object dir = value instanceof Map<?, ?> map ? map.get("dir") : value;
        if (dir == null) {
            throw new IllegalArgumentException("Language settings require a direction");
        }
        return state.withLang(new LangState(Dir.from(String.valueOf(dir))));
    }

    /**
     * Supports {@code paper}, {@code width}, {@code height}, {@code flip}, a uniform
     * {@code margins} value and per-side {@code left}, {@code top}, {@code right}, {@code bottom}.
     */
    public static State page(State state, Map<String, Object> options) {
        var page = state.page();
        Size size = page.size();
        Object paper = options.get("paper");
        if (paper != null) {
            size = PAPERS.get(String.valueOf(paper).trim().toLowerCase(Locale.ROOT));
            if (size == null) {
                throw new IllegalArgumentException("Unknown paper: " + paper);
            }
        }
        var width = LengthParser.parseAbsolute(options.get("width"));
        if (width.isPresent()) {
            size = new Size(width.get(), size.height());
        }
        var height = LengthParser.parseAbsolute(options.get("height"));
        if (height.isPresent()) {
            size = new Size(size.width(), height.get());
        }
        if (Boolean.TRUE.equals(options.get("flip"))) {
            size = size.flipped();
        }

        Sides<Optional<Linear>> margins = page.margins();
        var uniform = LengthParser.parseValue(options.get("margins"));
        if (uniform.isPresent()) {
            margins = Sides.uniform(uniform);
        }
        margins = new Sides<>(
            side(options, "left", margins.left()),
            side(options, "top", margins.top()),
            side(options, "right", margins.right()),
            side(options, "bottom", margins.bottom())
        );
        return state.withPage(page.withSize(size).withMargins(margins));
    }

    private static Optional<Linear> side(Map<String, Object> options, String key, Optional<Linear> fallback) {
        var value = LengthParser.parseValue(options.get(key));
        return value.isPresent() ? value : fallback;
    }
}
