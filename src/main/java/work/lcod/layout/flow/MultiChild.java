package work.lcod.layout.flow;

import java.util.List;
import java.util.Optional;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.Styles;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Fragment;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Regions;

/**
 * A breakable block (or a nested column layout) that may be split across regions.
 */
final class MultiChild implements Child {
    private final Axes<FixedAlignment> align;
    private final boolean sticky;
    private final Content elem;
    private final Styles styles;
    private final Locator locator;

    private Regions cachedRegions;
    private Fragment cachedFragment;

    MultiChild(Axes<FixedAlignment> align, boolean sticky, Content elem, Styles styles, Locator locator) {
        this.align = align;
        this.sticky = sticky;
        this.elem = elem;
        this.styles = styles;
        this.locator = locator;
    }

    Axes<FixedAlignment> align() {
        return align;
    }

    boolean sticky() {
        return sticky;
    }

    Content elem() {
        return elem;
    }

    /** Lays out the first slice and returns it with the spill for the remaining ones, if any. */
    Slice layout(Engine engine, Regions regions) {
        var fragment = layoutFull(engine, regions);
        boolean existNonEmpty = fragment.frames().stream().anyMatch(frame -> !frame.isEmpty());
        var first = fragment.get(0);
        if (fragment.size() == 1) {
            return new Slice(first, Optional.empty());
        }
        var spill = new MultiSpill(
            this,
            regions.size().y(),
            regions.full(),
            List.of(),
            regions.backlog().size(),
            existNonEmpty
        );
        return new Slice(first, Optional.of(spill));
    }

    Fragment layoutFull(Engine engine, Regions regions) {
        if (cachedFragment != null && regions.equals(cachedRegions)) {
            return cachedFragment;
        }
        var fragment = BlockLayout.layoutMulti(engine, elem, locator, styles, regions);
        cachedRegions = regions;
        cachedFragment = fragment;
        return fragment;
    }

    /** One slice of a breakable block and what remains of it. */
    record Slice(Frame frame, Optional<MultiSpill> spill) {}
}
