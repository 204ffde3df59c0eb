package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.Comparator;
import work.lcod.layout.content.ParLineMarker;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.frame.FrameItem;
import work.lcod.layout.geom.Abs;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Size;

/**
 * Numbers the lines of a finished column in its margin.
 */
final class LineNumbers {
    private LineNumbers() {}

    static void layout(Engine engine, Config config, Config.LineNumberConfig numbering, Work work, int column, Frame output) {
        var markers = new ArrayList<>(output.find(ParLineMarker.class));
        if (markers.isEmpty()) {
            return;
        }
        markers.sort(Comparator.comparingDouble(Frame.Located::y));

        var numbers = new ArrayList<Number>();
        double maxWidth = 0;
        double previousBottom = Double.NEGATIVE_INFINITY;
        for (var marker : markers) {
            // A line starting above the bottom of the previous number would overlap it.
            if (marker.y() + Abs.EPS < previousBottom) {
                continue;
            }
            var text = Integer.toString(work.nextLineNumber());
            var size = engine.routines().shaper().measure(text, config.shared());
            previousBottom = marker.y() + size.y();
            maxWidth = Math.max(maxWidth, size.x());
            numbers.add(new Number(marker, text, size));
        }

        // The last of several columns is numbered in the opposite margin.
        boolean opposite = config.columns().count() >= 2 && column + 1 == config.columns().count();
        for (var number : numbers) {
            var marker = number.marker().elem();
            var margin = opposite ? FixedAlignment.END : marker.numberMargin();
            double clearance = marker.numberClearance().orElse(numbering.defaultClearance());
            double x;
            double shift;
            if (margin == FixedAlignment.END) {
                x = output.width() + clearance;
                shift = 0;
            } else {
                x = -maxWidth - clearance;
                shift = maxWidth - number.size().x();
            }
            var frame = Frame.of(number.size());
            frame.push(Point.ZERO, new FrameItem.Text(number.text(), number.size()));
            output.pushFrame(new Point(x + shift, number.marker().y()), frame);
        }
    }

    private record Number(Frame.Located<ParLineMarker> marker, String text, Size size) {}
}
