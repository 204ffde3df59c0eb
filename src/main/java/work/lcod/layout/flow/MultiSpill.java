package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Size;

/**
 * The not yet placed remainder of a {@link MultiChild}.
 *
 * <p>The block is always laid out as a whole: the spill replays the heights of the regions its
 * earlier slices were committed to, followed by the current regions, and keeps the slice for the
 * current region. Slices therefore partition the block without gaps or overlap. Instances are
 * immutable so that copies of the work stay independent.
 */
final class MultiSpill {
    private final MultiChild multi;
    private final double first;
    private final double full;
    private final List<Double> backlog;
    private final int minBacklogLen;
    private final boolean existNonEmptyFrame;

    MultiSpill(
        MultiChild multi,
        double first,
        double full,
        List<Double> backlog,
        int minBacklogLen,
        boolean existNonEmptyFrame
    ) {
        this.multi = multi;
        this.first = first;
        this.full = full;
        this.backlog = List.copyOf(backlog);
        this.minBacklogLen = minBacklogLen;
        this.existNonEmptyFrame = existNonEmptyFrame;
    }

    Axes<FixedAlignment> align() {
        return multi.align();
    }

    boolean existNonEmptyFrame() {
        return existNonEmptyFrame;
    }

    MultiChild multi() {
        return multi;
    }

    /** Lays out the next slice into the first of {@code regions}. */
    MultiChild.Slice layout(Engine engine, Regions regions) {
        var committed = new ArrayList<>(backlog);
        committed.add(regions.size().y());

        var heights = new ArrayList<>(committed);
        heights.addAll(regions.backlog());
        // Trailing heights equal to the repeating one change nothing; dropping them keeps the
        // regions identical across attempts so the block layout is served from the cache.
        var last = regions.last();
        while (heights.size() > minBacklogLen
            && last.isPresent()
            && heights.get(heights.size() - 1).equals(last.get())) {
            heights.remove(heights.size() - 1);
        }

        var pod = new Regions(new Size(regions.size().x(), first), full, heights, last, regions.expand());
        var frames = multi.layoutFull(engine, pod).frames();
        // Frame 0 belongs to the first region, so the current slice sits behind the committed ones.
        int index = committed.size();
        if (frames.size() <= index) {
            return new MultiChild.Slice(Frame.of(new Size(regions.size().x(), 0)), Optional.empty());
        }

        var frame = frames.get(index);
        if (frames.size() == index + 1) {
            return new MultiChild.Slice(frame, Optional.empty());
        }
        var next = new MultiSpill(multi, first, full, committed, minBacklogLen, existNonEmptyFrame);
        return new MultiChild.Slice(frame, Optional.of(next));
    }
}
