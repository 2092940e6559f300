package work.lcod.typeset.shared;

import java.util.Locale;
import java.util.Optional;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Relative;

/**
 * Small helper to parse user-friendly lengths (e.g. {@code 12pt}, {@code 2cm}, {@code 1.5em},
 * {@code 50%}, {@code 50% + 2pt}). Both {@code em} and {@code %} produce the relative part.
 */
public final class LengthParser {
    private LengthParser() {}

    public static Optional<Linear> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Linear total = Linear.ZERO;
        for (String term : raw.split("\\+", -1)) {
            total = total.plus(parseTerm(term, raw));
        }
        return Optional.of(total);
    }

    /**
     * Parses a length that must not have a relative part. Numbers are taken as points.
     */
    public static Optional<Length> parseAbsolute(Object value) {
        return parseValue(value).map(linear -> {
            if (!linear.isAbsolute()) {
                throw new IllegalArgumentException("Expected an absolute length: " + value);
            }
            return linear.abs();
        });
    }

    /**
     * Accepts numbers (taken as points) as well as strings.
     */
    public static Optional<Linear> parseValue(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(Linear.abs(Length.pt(number.doubleValue())));
        }
        return parse(value.toString());
    }

    private static Linear parseTerm(String term, String raw) {
        String trimmed = term.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Invalid length: " + raw);
        }
        if ("0".equals(trimmed)) {
            return Linear.ZERO;
        }
        try {
            if (trimmed.endsWith("%")) {
                double value = number(trimmed, 1);
                return new Linear(new Relative(value / 100.0), Length.ZERO);
            } else if (trimmed.endsWith("em")) {
                return new Linear(new Relative(number(trimmed, 2)), Length.ZERO);
            } else if (trimmed.endsWith("pt")) {
                return Linear.abs(Length.pt(number(trimmed, 2)));
            } else if (trimmed.endsWith("mm")) {
                return Linear.abs(Length.mm(number(trimmed, 2)));
            } else if (trimmed.endsWith("cm")) {
                return Linear.abs(Length.cm(number(trimmed, 2)));
            } else if (trimmed.endsWith("in")) {
                return Linear.abs(Length.inches(number(trimmed, 2)));
            }
            return Linear.abs(Length.pt(Double.parseDouble(trimmed)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid length: " + raw, ex);
        }
    }

    private static double number(String term, int suffixLength) {
        return Double.parseDouble(term.substring(0, term.length() - suffixLength).trim());
    }
}
