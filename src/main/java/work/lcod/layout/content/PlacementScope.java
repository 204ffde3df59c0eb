package work.lcod.layout.content;

import java.util.Locale;

/**
 * Relative to which container placed elements are positioned.
 */
public enum PlacementScope {
    /** The current column. */
    COLUMN,
    /** The parent of the columns, usually the page. */
    PARENT;

    public static PlacementScope from(String value) {
        if (value == null || value.isBlank()) {
            return COLUMN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "column" -> COLUMN;
            case "parent", "page" -> PARENT;
            default -> throw new IllegalArgumentException("Unsupported placement scope: " + value);
        };
    }
}
