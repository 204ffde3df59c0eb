package work.lcod.layout.flow;

import work.lcod.layout.content.Location;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.PlaceContent;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.VerticalPlacement;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Region;
import work.lcod.layout.geom.Size;

/**
 * A placed element: a float that may be deferred, or an absolutely positioned element that
 * takes no space in the flow.
 */
final class PlacedChild implements Child {
    private final FixedAlignment alignX;
    private final VerticalPlacement alignY;
    private final PlacementScope scope;
    private final boolean floating;
    private final double clearance;
    private final PlaceContent elem;
    private final Styles styles;
    private final Locator locator;

    private Size cachedBase;
    private Frame cachedFrame;

    PlacedChild(
        FixedAlignment alignX,
        VerticalPlacement alignY,
        PlacementScope scope,
        boolean floating,
        double clearance,
        PlaceContent elem,
        Styles styles,
        Locator locator
    ) {
        this.alignX = alignX;
        this.alignY = alignY;
        this.scope = scope;
        this.floating = floating;
        this.clearance = clearance;
        this.elem = elem;
        this.styles = styles;
        this.locator = locator;
    }

    FixedAlignment alignX() {
        return alignX;
    }

    VerticalPlacement alignY() {
        return alignY;
    }

    PlacementScope scope() {
        return scope;
    }

    boolean floating() {
        return floating;
    }

    double clearance() {
        return clearance;
    }

    PlaceContent elem() {
        return elem;
    }

    /** Stable identity of this element across regions and relayout attempts. */
    Location location() {
        return locator.location();
    }

    Frame layout(Engine engine, Size base) {
        if (cachedFrame != null && base.equals(cachedBase)) {
            return cachedFrame;
        }
        var region = new Region(base, Axes.splat(false));
        var frame = FlowLayout.layoutFrame(engine, new SequenceContent(elem.body(), elem.span()), locator, styles, region);
        cachedBase = base;
        cachedFrame = frame;
        return frame;
    }
}
