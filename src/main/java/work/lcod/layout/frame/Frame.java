package work.lcod.layout.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Tag;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Size;

/**
 * A finished layout with items at fixed positions.
 *
 * <p>Frames are built up with {@link #push} and {@link #pushFrame} and must not be modified once
 * they have been pushed into another frame or returned from a layout routine; layout results are
 * shared between cache hits and relayout attempts.
 */
public final class Frame {
    private Size size;
    private final List<Positioned> items = new ArrayList<>();

    private Frame(Size size) {
        this.size = Objects.requireNonNull(size, "size");
    }

    public static Frame of(Size size) {
        return new Frame(size);
    }

    public static Frame empty() {
        return new Frame(Size.ZERO);
    }

    public Size size() {
        return size;
    }

    public double width() {
        return size.x();
    }

    public double height() {
        return size.y();
    }

    public void setSize(Size size) {
        this.size = Objects.requireNonNull(size, "size");
    }

    public List<Positioned> items() {
        return Collections.unmodifiableList(items);
    }

    /** Whether the frame holds no items at all (its size may still be non-zero). */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    public void push(Point pos, FrameItem item) {
        items.add(new Positioned(pos, item));
    }

    public void pushFrame(Point pos, Frame frame) {
        push(pos, new FrameItem.Group(frame));
    }

    public void pushTag(Point pos, Tag tag) {
        push(pos, new FrameItem.TagItem(tag));
    }

    /** Whether the frame is empty or only holds tags. Such frames are invisible. */
    public boolean isInvisible() {
        for (var item : items) {
            if (item.item() instanceof FrameItem.TagItem) {
                continue;
            }
            if (item.item() instanceof FrameItem.Group group && group.frame().isInvisible()) {
                continue;
            }
            return false;
        }
        return true;
    }

    /**
     * Finds all tags whose element is of the given type, with their absolute vertical position,
     * in document order.
     */
    public <T extends Content> List<Located<T>> find(Class<T> type) {
        var found = new ArrayList<Located<T>>();
        collect(this, 0, type, found);
        return found;
    }

    /** Like {@link #find(Class)}, across several frames. Positions are relative to each frame. */
    public static <T extends Content> List<Located<T>> find(List<Frame> frames, Class<T> type) {
        var found = new ArrayList<Located<T>>();
        for (var frame : frames) {
            collect(frame, 0, type, found);
        }
        return found;
    }

    private static <T extends Content> void collect(Frame frame, double offset, Class<T> type, List<Located<T>> out) {
        for (var positioned : frame.items) {
            double y = offset + positioned.pos().y();
            if (positioned.item() instanceof FrameItem.Group group) {
                collect(group.frame(), y, type, out);
            } else if (positioned.item() instanceof FrameItem.TagItem tagItem && type.isInstance(tagItem.tag().elem())) {
                out.add(new Located<>(y, tagItem.tag(), type.cast(tagItem.tag().elem())));
            }
        }
    }

    /** An item at a position. */
    public record Positioned(Point pos, FrameItem item) {}

    /** A tagged element found in a frame, at vertical position {@code y}. */
    public record Located<T extends Content>(double y, Tag tag, T elem) {}
}
