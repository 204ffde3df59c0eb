package work.lcod.layout.geom;

/**
 * A position relative to the top-left corner of a frame.
 */
public record Point(double x, double y) {
    public static final Point ZERO = new Point(0, 0);

    public static Point withX(double x) {
        return new Point(x, 0);
    }

    public static Point withY(double y) {
        return new Point(0, y);
    }

    public Point plus(Point other) {
        return new Point(x + other.x, y + other.y);
    }
}
