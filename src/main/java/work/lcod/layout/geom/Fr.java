package work.lcod.layout.geom;

/**
 * A fraction of the leftover space in a region.
 */
public record Fr(double value) {
    public static final Fr ZERO = new Fr(0);

    public Fr plus(Fr other) {
        return new Fr(value + other.value);
    }

    /**
     * This fraction's share of {@code space} when {@code total} fractions compete for it.
     */
    public double share(Fr total, double space) {
        if (total.value <= 0 || !Double.isFinite(space)) {
            return 0;
        }
        return value / total.value * Math.max(space, 0);
    }

    public boolean isPositive() {
        return value > 0;
    }
}
