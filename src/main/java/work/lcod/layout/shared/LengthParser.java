package work.lcod.layout.shared;

import java.util.Locale;
import java.util.Optional;
import work.lcod.layout.content.Sizing;
import work.lcod.layout.geom.Rel;

/**
 * Small helper to parse user-friendly lengths (e.g. {@code 12pt}, {@code 210mm}, {@code 1.5em},
 * {@code 4%}, {@code 1fr}). Bare numbers are points.
 */
public final class LengthParser {
    private static final double POINTS_PER_INCH = 72.0;

    private LengthParser() {}

    /** Parses an absolute length; {@code em} is the font size {@code 1em} resolves to. */
    public static Optional<Double> parse(String raw, double em) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        double multiplier = 1.0;
        if (trimmed.endsWith("pt")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("mm")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = POINTS_PER_INCH / 25.4;
        } else if (trimmed.endsWith("cm")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = POINTS_PER_INCH / 2.54;
        } else if (trimmed.endsWith("in")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = POINTS_PER_INCH;
        } else if (trimmed.endsWith("em")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = em;
        }
        return Optional.of(number(raw, trimmed) * multiplier);
    }

    /** Parses an absolute length or a percentage of the base it is resolved against later. */
    public static Optional<Rel> parseRel(String raw, double em) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.endsWith("%")) {
            return Optional.of(Rel.ratio(number(raw, trimmed.substring(0, trimmed.length() - 1)) / 100.0));
        }
        return parse(trimmed, em).map(Rel::abs);
    }

    /** Like {@link #parseRel(String, double)}, additionally accepting fractions such as {@code 2fr}. */
    public static Optional<Sizing> parseSizing(String raw, double em) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.endsWith("fr")) {
            return Optional.of(Sizing.fr(number(raw, trimmed.substring(0, trimmed.length() - 2))));
        }
        return parseRel(trimmed, em).map(Sizing::rel);
    }

    private static double number(String raw, String digits) {
        try {
            return Double.parseDouble(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid length: " + raw, ex);
        }
    }
}
