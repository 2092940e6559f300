package work.lcod.typeset.geom;

import java.util.Objects;

/**
 * A relative part plus an absolute part, resolved against a base length.
 */
public record Linear(Relative rel, Length abs) {
    public static final Linear ZERO = new Linear(Relative.ZERO, Length.ZERO);

    public Linear {
        Objects.requireNonNull(rel, "rel");
        Objects.requireNonNull(abs, "abs");
    }

    public static Linear rel(double ratio) {
        return new Linear(new Relative(ratio), Length.ZERO);
    }

    public static Linear abs(Length length) {
        return new Linear(Relative.ZERO, length);
    }

    public Linear plus(Linear other) {
        return new Linear(new Relative(rel.ratio() + other.rel.ratio()), abs.plus(other.abs));
    }

    public Length resolve(Length base) {
        return rel.resolve(base).plus(abs);
    }

    public boolean isAbsolute() {
        return rel.ratio() == 0;
    }

    @Override
    public String toString() {
        if (rel.ratio() == 0) {
            return abs.toString();
        }
        if (abs.pt() == 0) {
            return rel.toString();
        }
        return rel + " + " + abs;
    }
}
