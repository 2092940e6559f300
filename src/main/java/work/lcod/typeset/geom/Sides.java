package work.lcod.typeset.geom;

import java.util.Objects;
import java.util.function.Function;

/**
 * A container with left, top, right and bottom components.
 */
public record Sides<T>(T left, T top, T right, T bottom) {
    public Sides {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(top, "top");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(bottom, "bottom");
    }

    public static <T> Sides<T> uniform(T value) {
        return new Sides<>(value, value, value, value);
    }

    public <R> Sides<R> map(Function<? super T, ? extends R> fn) {
        return new Sides<>(fn.apply(left), fn.apply(top), fn.apply(right), fn.apply(bottom));
    }
}
