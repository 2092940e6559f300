package work.lcod.typeset.exec;

import java.util.Locale;
import java.util.Objects;

/**
 * A font family preference: a generic class such as {@code serif} or a concrete family name.
 */
public record FontFamily(String name) {
    public static final FontFamily SERIF = new FontFamily("serif");
    public static final FontFamily SANS_SERIF = new FontFamily("sans-serif");
    public static final FontFamily MONOSPACE = new FontFamily("monospace");

    public FontFamily {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Font family name must not be blank");
        }
    }

    public static FontFamily of(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "serif" -> SERIF;
            case "sans-serif", "sans" -> SANS_SERIF;
            case "monospace", "mono" -> MONOSPACE;
            default -> new FontFamily(raw.trim());
        };
    }
}
