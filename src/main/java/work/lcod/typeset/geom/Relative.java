package work.lcod.typeset.geom;

/**
 * A length relative to some base, e.g. {@code 0.5} for half the font size.
 */
public record Relative(double ratio) {
    public static final Relative ZERO = new Relative(0);
    public static final Relative ONE = new Relative(1);

    public Length resolve(Length base) {
        return base.times(ratio);
    }

    @Override
    public String toString() {
        return (ratio * 100) + "%";
    }
}
