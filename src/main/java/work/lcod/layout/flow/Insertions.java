package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import work.lcod.layout.content.Location;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Size;

/**
 * Floats and footnotes inserted into a column or region around the flowing content.
 */
final class Insertions {
    private final List<Inserted> topFloats = new ArrayList<>();
    private final List<Inserted> bottomFloats = new ArrayList<>();
    private final List<Frame> footnotes = new ArrayList<>();
    private Frame footnoteSeparator;
    private List<Frame> footnoteSpill;
    private double topSize;
    private double bottomSize;
    private double width;
    private final List<Location> skips = new ArrayList<>();

    /** Pushes a float to the top or bottom; it is spaced from the content by its clearance. */
    void pushFloat(PlacedChild placed, Frame frame, FixedAlignment alignY) {
        double amount = frame.height() + placed.clearance();
        var entry = new Inserted(placed, frame);
        if (alignY == FixedAlignment.START) {
            topSize += amount;
            topFloats.add(entry);
        } else {
            bottomSize += amount;
            bottomFloats.add(entry);
        }
        width = Math.max(width, frame.width());
    }

    void pushFootnote(Config config, Frame frame) {
        bottomSize += config.footnote().gap() + frame.height();
        footnotes.add(frame);
        width = Math.max(width, frame.width());
    }

    void pushFootnoteSeparator(Config config, Frame frame) {
        bottomSize += config.footnote().clearance() + frame.height();
        footnoteSeparator = frame;
        width = Math.max(width, frame.width());
    }

    /** Remembers the frames of an entry that continue in the next column. */
    void setFootnoteSpill(List<Frame> frames) {
        footnoteSpill = List.copyOf(frames);
    }

    boolean hasFootnoteSpill() {
        return footnoteSpill != null;
    }

    boolean hasFootnotes() {
        return !footnotes.isEmpty();
    }

    void addSkip(Location location) {
        skips.add(location);
    }

    boolean skipped(Location location) {
        return skips.contains(location);
    }

    int skipCount() {
        return skips.size();
    }

    double height() {
        return topSize + bottomSize;
    }

    double width() {
        return width;
    }

    /**
     * Arranges the insertions around {@code inner}. Only now do the recorded skips become part of
     * the work: an attempt that is thrown away must not hide its floats and footnotes. The same
     * holds for the continuation of a spilled footnote.
     */
    Frame finalize(Work work, Config config, Frame inner) {
        work.extendSkips(skips);
        if (footnoteSpill != null) {
            work.setFootnoteSpill(footnoteSpill);
        }

        if (topFloats.isEmpty() && bottomFloats.isEmpty() && footnoteSeparator == null && footnotes.isEmpty()) {
            return inner;
        }

        var size = inner.size().plus(Size.withY(height()));
        var output = Frame.of(size);
        double offsetTop = 0;
        double offsetBottom = size.y() - bottomSize;

        for (var entry : topFloats) {
            var placed = entry.placed();
            var frame = entry.frame();
            double x = placed.alignX().position(size.x() - frame.width());
            double y = offsetTop;
            var delta = new Point(placed.elem().dx().relativeTo(size.x()), placed.elem().dy().relativeTo(size.y()));
            offsetTop += frame.height() + placed.clearance();
            output.pushFrame(new Point(x, y).plus(delta), frame);
        }

        output.pushFrame(new Point(0, topSize), inner);

        for (var entry : bottomFloats) {
            var placed = entry.placed();
            var frame = entry.frame();
            offsetBottom += placed.clearance();
            double x = placed.alignX().position(size.x() - frame.width());
            double y = offsetBottom;
            var delta = new Point(placed.elem().dx().relativeTo(size.x()), placed.elem().dy().relativeTo(size.y()));
            offsetBottom += frame.height();
            output.pushFrame(new Point(x, y).plus(delta), frame);
        }

        if (footnoteSeparator != null) {
            offsetBottom += config.footnote().clearance();
            double y = offsetBottom;
            offsetBottom += footnoteSeparator.height();
            output.pushFrame(new Point(0, y), footnoteSeparator);
        }

        for (var frame : footnotes) {
            offsetBottom += config.footnote().gap();
            double y = offsetBottom;
            offsetBottom += frame.height();
            output.pushFrame(new Point(0, y), frame);
        }

        return output;
    }

    private record Inserted(PlacedChild placed, Frame frame) {}
}
