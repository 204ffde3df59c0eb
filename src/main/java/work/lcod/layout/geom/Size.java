package work.lcod.layout.geom;

/**
 * A two-dimensional size in points.
 */
public record Size(double x, double y) {
    public static final Size ZERO = new Size(0, 0);

    public static Size withX(double x) {
        return new Size(x, 0);
    }

    public static Size withY(double y) {
        return new Size(0, y);
    }

    public double width() {
        return x;
    }

    public double height() {
        return y;
    }

    public Size withWidth(double width) {
        return new Size(width, y);
    }

    public Size withHeight(double height) {
        return new Size(x, height);
    }

    public Size plus(Size other) {
        return new Size(x + other.x, y + other.y);
    }

    public Size min(Size other) {
        return new Size(Math.min(x, other.x), Math.min(y, other.y));
    }

    public Size max(Size other) {
        return new Size(Math.max(x, other.x), Math.max(y, other.y));
    }

    public boolean isZero() {
        return Abs.isZero(x) && Abs.isZero(y);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    public Point toPoint() {
        return new Point(x, y);
    }
}
