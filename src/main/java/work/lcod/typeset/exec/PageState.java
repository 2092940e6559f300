package work.lcod.typeset.exec;

import java.util.Objects;
import java.util.Optional;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Sides;
import work.lcod.typeset.geom.Size;

/**
 * Page geometry. Margins left unset fall back to a fraction of the smaller page side.
 */
public record PageState(Size size, Sides<Optional<Linear>> margins) {
    public static final Size A4 = new Size(Length.mm(210), Length.mm(297));
    public static final PageState DEFAULT = new PageState(A4, Sides.uniform(Optional.empty()));

    private static final double HORIZONTAL_MARGIN = 0.1190;
    private static final double VERTICAL_MARGIN = 0.0842;

    public PageState {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(margins, "margins");
    }

    public Sides<Linear> resolvedMargins() {
        Length min = size.minSide();
        Linear horizontal = Linear.abs(min.times(HORIZONTAL_MARGIN));
        Linear vertical = Linear.abs(min.times(VERTICAL_MARGIN));
        return new Sides<>(
            margins.left().orElse(horizontal),
            margins.top().orElse(vertical),
            margins.right().orElse(horizontal),
            margins.bottom().orElse(vertical)
        );
    }

    public PageState withSize(Size size) {
        return new PageState(size, margins);
    }

    public PageState withMargins(Sides<Optional<Linear>> margins) {
        return new PageState(size, margins);
    }
}
