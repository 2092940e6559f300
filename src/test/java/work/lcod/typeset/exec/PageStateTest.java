package work.lcod.typeset.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Sides;

class PageStateTest {
    @Test
    void defaultMarginsScaleWithShortSide() {
        var margins = PageState.DEFAULT.resolvedMargins();
        double shortSide = Length.mm(210).pt();
        assertEquals(shortSide * 0.1190, margins.left().abs().pt(), 1e-9);
        assertEquals(shortSide * 0.0842, margins.top().abs().pt(), 1e-9);
        assertEquals(margins.left(), margins.right());
        assertEquals(margins.top(), margins.bottom());
    }

    @Test
    void explicitMarginsOverrideDefaults() {
        var one = Optional.of(Linear.abs(Length.cm(1)));
        var page = PageState.DEFAULT.withMargins(new Sides<>(one, Optional.empty(), one, Optional.empty()));
        var margins = page.resolvedMargins();
        assertEquals(Linear.abs(Length.cm(1)), margins.left());
        assertEquals(PageState.DEFAULT.resolvedMargins().top(), margins.top());
    }

    @Test
    void fontSizeScalesRelativeToBase() {
        var font = FontState.DEFAULT.withSize(Linear.rel(1.5));
        assertEquals(16.5, font.resolveSize().pt(), 1e-9);
        assertEquals(12.0, font.withSize(Linear.abs(Length.pt(12))).resolveSize().pt(), 1e-9);
    }

    @Test
    void languageMustBeHorizontal() {
        assertThrows(IllegalArgumentException.class, () -> new LangState(Dir.TTB));
    }
}
