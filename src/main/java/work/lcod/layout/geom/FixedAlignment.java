package work.lcod.layout.geom;

import java.util.Locale;

/**
 * Alignment along one axis, already resolved against the text direction.
 */
public enum FixedAlignment {
    START,
    CENTER,
    END;

    /**
     * The offset at which content is placed given the amount of free space.
     */
    public double position(double free) {
        return switch (this) {
            case START -> 0;
            case CENTER -> free / 2;
            case END -> free;
        };
    }

    public FixedAlignment max(FixedAlignment other) {
        return ordinal() >= other.ordinal() ? this : other;
    }

    public FixedAlignment inv() {
        return switch (this) {
            case START -> END;
            case CENTER -> CENTER;
            case END -> START;
        };
    }

    /**
     * Parses {@code start|left|top}, {@code center|horizon|middle} and {@code end|right|bottom}.
     */
    public static FixedAlignment from(String value) {
        if (value == null || value.isBlank()) {
            return START;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "start", "left", "top" -> START;
            case "center", "horizon", "middle" -> CENTER;
            case "end", "right", "bottom" -> END;
            default -> throw new IllegalArgumentException("Unsupported alignment: " + value);
        };
    }
}
