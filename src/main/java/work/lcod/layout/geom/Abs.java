package work.lcod.layout.geom;

/**
 * Helpers for absolute lengths, expressed in points as {@code double}s.
 */
public final class Abs {
    /** Tolerance used when comparing lengths. */
    public static final double EPS = 1e-4;

    private Abs() {}

    /**
     * Whether {@code need} fits into {@code space}. Lengths that are exactly at the boundary fit.
     */
    public static boolean fits(double space, double need) {
        return space + EPS >= need;
    }

    public static boolean approxEq(double a, double b) {
        return a == b || Math.abs(a - b) < EPS;
    }

    public static boolean isZero(double value) {
        return Math.abs(value) < EPS;
    }

    public static boolean isFinite(double value) {
        return Double.isFinite(value);
    }
}
