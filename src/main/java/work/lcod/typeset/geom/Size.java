package work.lcod.typeset.geom;

import java.util.Objects;

public record Size(Length width, Length height) {
    public Size {
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(height, "height");
    }

    public Size flipped() {
        return new Size(height, width);
    }

    public Length minSide() {
        return width.min(height);
    }
}
