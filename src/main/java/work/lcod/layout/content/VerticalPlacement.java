package work.lcod.layout.content;

import java.util.Locale;
import java.util.Optional;
import work.lcod.layout.geom.FixedAlignment;

/**
 * Vertical alignment of a placed element.
 */
public enum VerticalPlacement {
    /** Chosen automatically (floats only). */
    AUTO,
    /** No alignment: the element stays where it occurs in the flow (non-floats only). */
    IN_FLOW,
    TOP,
    CENTER,
    BOTTOM;

    public Optional<FixedAlignment> fixed() {
        return switch (this) {
            case TOP -> Optional.of(FixedAlignment.START);
            case CENTER -> Optional.of(FixedAlignment.CENTER);
            case BOTTOM -> Optional.of(FixedAlignment.END);
            default -> Optional.empty();
        };
    }

    public static VerticalPlacement from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "none", "flow", "in-flow" -> IN_FLOW;
            case "top", "start" -> TOP;
            case "center", "horizon", "middle" -> CENTER;
            case "bottom", "end" -> BOTTOM;
            default -> throw new IllegalArgumentException("Unsupported vertical placement: " + value);
        };
    }
}
