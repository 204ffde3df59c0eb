package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import work.lcod.layout.content.Location;
import work.lcod.layout.content.Tag;
import work.lcod.layout.frame.Frame;

/**
 * What remains to be laid out in a flow.
 *
 * <p>The composer checkpoints the work before a column or region and restores it when the attempt
 * has to be redone. Copies never share mutable state; the children list itself is never modified.
 */
final class Work {
    private final List<Child> children;
    private int cursor;
    private MultiSpill spill;
    private List<PlacedChild> floats = new ArrayList<>();
    private List<Note> footnotes = new ArrayList<>();
    private List<Frame> footnoteSpill;
    private List<Tag> tags = new ArrayList<>();
    private SkipSet skips = SkipSet.empty();
    private int lineNumber;

    Work(List<Child> children) {
        this.children = List.copyOf(children);
    }

    private Work(List<Child> children, int cursor) {
        this.children = children;
        this.cursor = cursor;
    }

    /** The next child, or {@code null} when all children were consumed. */
    Child head() {
        return cursor < children.size() ? children.get(cursor) : null;
    }

    void advance() {
        cursor++;
    }

    /** Whether nothing is left: no children, spills, queued floats or footnotes. */
    boolean done() {
        return cursor >= children.size()
            && spill == null
            && floats.isEmpty()
            && footnoteSpill == null
            && footnotes.isEmpty();
    }

    Work copy() {
        var copy = new Work(children, cursor);
        copy.restore(this);
        return copy;
    }

    /** Replaces the state of this work with that of {@code other}, leaving {@code other} untouched. */
    void restore(Work other) {
        if (other.children != children) {
            throw new IllegalArgumentException("Cannot restore work of another flow");
        }
        cursor = other.cursor;
        spill = other.spill;
        floats = new ArrayList<>(other.floats);
        footnotes = new ArrayList<>(other.footnotes);
        footnoteSpill = other.footnoteSpill;
        tags = new ArrayList<>(other.tags);
        skips = other.skips;
        lineNumber = other.lineNumber;
    }

    MultiSpill takeSpill() {
        var taken = spill;
        spill = null;
        return taken;
    }

    void setSpill(MultiSpill spill) {
        this.spill = spill;
    }

    List<PlacedChild> floats() {
        return floats;
    }

    List<PlacedChild> takeFloats() {
        var taken = floats;
        floats = new ArrayList<>();
        return taken;
    }

    List<Note> footnotes() {
        return footnotes;
    }

    List<Note> takeFootnotes() {
        var taken = footnotes;
        footnotes = new ArrayList<>();
        return taken;
    }

    boolean hasFootnoteSpill() {
        return footnoteSpill != null;
    }

    List<Frame> takeFootnoteSpill() {
        var taken = footnoteSpill;
        footnoteSpill = null;
        return taken;
    }

    void setFootnoteSpill(List<Frame> frames) {
        this.footnoteSpill = frames.isEmpty() ? null : List.copyOf(frames);
    }

    List<Tag> tags() {
        return tags;
    }

    boolean skipped(Location location) {
        return skips.contains(location);
    }

    void extendSkips(Collection<Location> locations) {
        skips = skips.extend(locations);
    }

    int nextLineNumber() {
        return ++lineNumber;
    }

    void resetLineNumbers() {
        lineNumber = 0;
    }
}
