package work.lcod.typeset.geom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GeomTest {
    @Test
    void linearResolvesAgainstBase() {
        var amount = Linear.rel(0.5).plus(Linear.abs(Length.pt(2)));
        assertEquals(Length.pt(7), amount.resolve(Length.pt(10)));
        assertFalse(amount.isAbsolute());
        assertTrue(Linear.abs(Length.cm(1)).isAbsolute());
        assertEquals("50.0% + 2.0pt", amount.toString());
    }

    @Test
    void unitConversions() {
        assertEquals(72.0, Length.inches(1).pt(), 1e-9);
        assertEquals(Length.cm(1).pt(), Length.mm(10).pt(), 1e-9);
        assertEquals(Length.pt(3), Length.pt(3).min(Length.pt(4)));
    }

    @Test
    void sizeFlipsAndFindsShortSide() {
        var size = new Size(Length.pt(100), Length.pt(50));
        assertEquals(new Size(Length.pt(50), Length.pt(100)), size.flipped());
        assertEquals(Length.pt(50), size.minSide());
    }

    @Test
    void genericAxesAreIndependent() {
        var aligns = new Gen<>(Align.START, Align.START).with(GenAxis.MAIN, Align.END);
        assertEquals(Align.START, aligns.get(GenAxis.CROSS));
        assertEquals(Align.END, aligns.get(GenAxis.MAIN));
    }

    @Test
    void parsesAlignmentsAndDirections() {
        assertEquals(Align.END, Align.from("Right"));
        assertEquals(Align.CENTER, Align.from(" center "));
        assertThrows(IllegalArgumentException.class, () -> Align.from("middle"));
        assertEquals(Dir.RTL, Dir.from("rtl"));
        assertFalse(Dir.TTB.isHorizontal());
        assertThrows(IllegalArgumentException.class, () -> Dir.from("up"));
    }
}
