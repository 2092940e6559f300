package work.lcod.typeset.geom;

/**
 * An absolute length, stored in typographic points.
 */
public record Length(double pt) implements Comparable<Length> {
    public static final Length ZERO = new Length(0);

    private static final double PT_PER_MM = 72.0 / 25.4;

    public static Length pt(double value) {
        return new Length(value);
    }

    public static Length mm(double value) {
        return new Length(value * PT_PER_MM);
    }

    public static Length cm(double value) {
        return new Length(value * PT_PER_MM * 10);
    }

    public static Length inches(double value) {
        return new Length(value * 72.0);
    }

    public Length plus(Length other) {
        return new Length(pt + other.pt);
    }

    public Length times(double factor) {
        return new Length(pt * factor);
    }

    public Length min(Length other) {
        return pt <= other.pt ? this : other;
    }

    @Override
    public int compareTo(Length other) {
        return Double.compare(pt, other.pt);
    }

    @Override
    public String toString() {
        return pt + "pt";
    }
}
