package work.lcod.typeset.exec;

import java.util.Objects;
import work.lcod.typeset.geom.Align;
import work.lcod.typeset.geom.Gen;

/**
 * The formatting state threaded through execution. Immutable: changes produce a new state,
 * so taking a snapshot is just keeping a reference.
 */
public record State(FontState font, ParState par, PageState page, LangState lang, Gen<Align> aligns) {
    public static final State DEFAULT = new State(
        FontState.DEFAULT,
        ParState.DEFAULT,
        PageState.DEFAULT,
        LangState.DEFAULT,
        new Gen<>(Align.START, Align.START)
    );

    public State {
        Objects.requireNonNull(font, "font");
        Objects.requireNonNull(par, "par");
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(lang, "lang");
        Objects.requireNonNull(aligns, "aligns");
    }

    public State withFont(FontState font) {
        return new State(font, par, page, lang, aligns);
    }

    public State withPar(ParState par) {
        return new State(font, par, page, lang, aligns);
    }

    public State withPage(PageState page) {
        return new State(font, par, page, lang, aligns);
    }

    public State withLang(LangState lang) {
        return new State(font, par, page, lang, aligns);
    }

    public State withAligns(Gen<Align> aligns) {
        return new State(font, par, page, lang, aligns);
    }
}
