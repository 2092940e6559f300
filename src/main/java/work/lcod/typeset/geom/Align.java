package work.lcod.typeset.geom;

import java.util.Locale;

/**
 * Where to align content along an axis.
 */
public enum Align {
    START,
    CENTER,
    END;

    public static Align from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing alignment");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "start", "left", "top" -> START;
            case "center" -> CENTER;
            case "end", "right", "bottom" -> END;
            default -> throw new IllegalArgumentException("Unsupported alignment: " + value);
        };
    }
}
