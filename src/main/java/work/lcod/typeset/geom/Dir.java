package work.lcod.typeset.geom;

import java.util.Locale;

/**
 * Layout and writing directions.
 */
public enum Dir {
    LTR,
    RTL,
    TTB,
    BTT;

    public boolean isHorizontal() {
        return this == LTR || this == RTL;
    }

    public static Dir from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing direction");
        }
        try {
            return Dir.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported direction: " + value);
        }
    }
}
