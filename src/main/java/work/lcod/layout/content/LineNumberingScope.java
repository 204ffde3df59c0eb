package work.lcod.layout.content;

import java.util.Locale;

/**
 * Where line numbers restart.
 */
public enum LineNumberingScope {
    DOCUMENT,
    PAGE;

    public static LineNumberingScope from(String value) {
        if (value == null || value.isBlank()) {
            return DOCUMENT;
        }
        try {
            return LineNumberingScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported line numbering scope: " + value);
        }
    }
}
