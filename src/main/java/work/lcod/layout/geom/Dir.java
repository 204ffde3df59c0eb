package work.lcod.layout.geom;

import java.util.Locale;

/**
 * Horizontal text direction. Columns progress in this direction.
 */
public enum Dir {
    LTR,
    RTL;

    public static Dir from(String value) {
        if (value == null || value.isBlank()) {
            return LTR;
        }
        try {
            return Dir.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported text direction: " + value);
        }
    }
}
