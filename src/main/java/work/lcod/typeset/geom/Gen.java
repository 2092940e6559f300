package work.lcod.typeset.geom;

import java.util.Objects;

/**
 * A pair of values along the generic axes: cross (inline) and main (block).
 */
public record Gen<T>(T cross, T main) {
    public Gen {
        Objects.requireNonNull(cross, "cross");
        Objects.requireNonNull(main, "main");
    }

    public T get(GenAxis axis) {
        return axis == GenAxis.CROSS ? cross : main;
    }

    public Gen<T> with(GenAxis axis, T value) {
        return axis == GenAxis.CROSS ? new Gen<>(value, main) : new Gen<>(cross, value);
    }
}
