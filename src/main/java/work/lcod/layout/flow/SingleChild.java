package work.lcod.layout.flow;

import java.util.Optional;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.Styles;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Fr;
import work.lcod.layout.geom.Region;

/**
 * An unbreakable block, laid out lazily and cached for the last region it was asked for.
 */
final class SingleChild implements Child {
    private final Axes<FixedAlignment> align;
    private final boolean sticky;
    private final Optional<Fr> fr;
    private final BlockContent elem;
    private final Styles styles;
    private final Locator locator;

    private Region cachedRegion;
    private Frame cachedFrame;

    SingleChild(
        Axes<FixedAlignment> align,
        boolean sticky,
        Optional<Fr> fr,
        BlockContent elem,
        Styles styles,
        Locator locator
    ) {
        this.align = align;
        this.sticky = sticky;
        this.fr = fr;
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

    Optional<Fr> fr() {
        return fr;
    }

    BlockContent elem() {
        return elem;
    }

    Frame layout(Engine engine, Region region) {
        if (cachedFrame != null && region.equals(cachedRegion)) {
            return cachedFrame;
        }
        var frame = BlockLayout.layoutSingle(engine, elem, locator, styles, region);
        cachedRegion = region;
        cachedFrame = frame;
        return frame;
    }
}
