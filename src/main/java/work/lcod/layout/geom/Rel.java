package work.lcod.layout.geom;

/**
 * A length made of an absolute part and a part relative to some base length.
 */
public record Rel(double abs, double ratio) {
    public static final Rel ZERO = new Rel(0, 0);

    public static Rel abs(double abs) {
        return new Rel(abs, 0);
    }

    public static Rel ratio(double ratio) {
        return new Rel(0, ratio);
    }

    public double relativeTo(double base) {
        if (ratio == 0) {
            return abs;
        }
        return abs + ratio * base;
    }

    public boolean isZero() {
        return abs == 0 && ratio == 0;
    }
}
