package work.lcod.layout.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.layout.support.LayoutTestSupport.layout;
import static work.lcod.layout.support.LayoutTestSupport.pages;
import static work.lcod.layout.support.LayoutTestSupport.shape;
import static work.lcod.layout.support.LayoutTestSupport.shapes;

import org.junit.jupiter.api.Test;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.Sizing;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.TagContent;
import work.lcod.layout.content.VSpaceContent;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.geom.Size;

class DistributorTest {
    private static Regions shrinking(double width, double height) {
        return Regions.one(new Size(width, height), new Axes<>(true, false));
    }

    private static Regions filling(double width, double height) {
        return Regions.one(new Size(width, height), Axes.splat(true));
    }

    @Test
    void weakSpacingCollapsesIntoStrongerNeighbour() {
        var fragment = layout(
            shrinking(100, 200),
            VSpaceContent.weak(20),
            BlockContent.box("a", 10),
            VSpaceContent.weak(20),
            BlockContent.box("b", 10),
            VSpaceContent.weak(20)
        );

        var frame = fragment.get(0);
        assertEquals(0, shape(frame, "a").y());
        assertEquals(30, shape(frame, "b").y());
        assertEquals(40, frame.height());
    }

    @Test
    void strongSpacingAddsToBlockSpacing() {
        var frame = layout(shrinking(100, 200), BlockContent.box("a", 10), VSpaceContent.of(15), BlockContent.box("b", 10))
            .get(0);

        assertEquals(33, shape(frame, "b").y());
    }

    @Test
    void strongSpacingAtRegionStartIsKept() {
        var frame = layout(shrinking(100, 200), VSpaceContent.of(15), BlockContent.box("a", 10)).get(0);

        assertEquals(15, shape(frame, "a").y());
        assertEquals(25, frame.height());
    }

    @Test
    void fractionalSpacingTakesLeftoverSpace() {
        var frame = layout(filling(100, 100), BlockContent.box("a", 10), VSpaceContent.fr(1), BlockContent.box("b", 10))
            .get(0);

        assertEquals(0, shape(frame, "a").y());
        assertEquals(90, shape(frame, "b").y());
    }

    @Test
    void fractionalSpacingIsSharedByWeight() {
        var frame = layout(
            filling(100, 100),
            BlockContent.box("a", 10),
            VSpaceContent.fr(1),
            BlockContent.box("b", 10),
            VSpaceContent.fr(3)
        ).get(0);

        assertEquals(30, shape(frame, "b").y());
    }

    @Test
    void fractionalBlockFillsLeftoverSpace() {
        var fill = BlockContent.builder().label("fill").height(Sizing.fr(1)).build();

        var frame = layout(filling(100, 100), BlockContent.box("a", 10), fill, BlockContent.box("b", 10)).get(0);

        assertEquals(18, shape(frame, "fill").y());
        assertEquals(64, shape(frame, "fill").size().y());
        assertEquals(90, shape(frame, "b").y());
    }

    @Test
    void stickyBlockMovesWithItsSuccessor() {
        var heading = BlockContent.builder().label("heading").height(10).sticky(true).build();

        var fragment = layout(pages(200, 100), BlockContent.box("a", 70), heading, BlockContent.box("b", 30));

        assertEquals(2, fragment.size());
        assertTrue(shapes(fragment.get(0), "heading").isEmpty());
        assertEquals(0, shape(fragment.get(1), "heading").y());
        assertEquals(18, shape(fragment.get(1), "b").y());
    }

    @Test
    void blockWithoutStickinessStaysBehind() {
        var fragment = layout(pages(200, 100), BlockContent.box("a", 70), BlockContent.box("heading", 10), BlockContent.box("b", 30));

        assertEquals(78, shape(fragment.get(0), "heading").y());
        assertEquals(0, shape(fragment.get(1), "b").y());
    }

    @Test
    void stickyBlockAtRegionStartIsNotMovedOn() {
        var heading = BlockContent.builder().label("heading").height(10).sticky(true).build();
        var engine = Engine.create();

        var fragment = layout(engine, Styles.defaults(), pages(200, 50), 1, Rel.ZERO, heading, BlockContent.box("b", 60));

        assertEquals(2, fragment.size());
        assertEquals(0, shape(fragment.get(0), "heading").y());
        assertEquals(0, shape(fragment.get(1), "b").y());
        assertEquals(1, engine.sink().warnings().size());
    }

    @Test
    void tagsTakeThePositionOfTheFollowingContent() {
        var frame = layout(shrinking(100, 200), BlockContent.box("a", 20), TagContent.of("mark"), BlockContent.box("b", 20))
            .get(0);

        var tags = frame.find(TagContent.class);
        assertEquals(1, tags.size());
        assertEquals("mark", tags.get(0).elem().name());
        assertEquals(28, tags.get(0).y());
    }

    @Test
    void trailingTagsAreKeptAtTheEnd() {
        var frame = layout(shrinking(100, 200), BlockContent.box("a", 20), TagContent.of("end")).get(0);

        var tags = frame.find(TagContent.class);
        assertEquals(1, tags.size());
        assertEquals(20, tags.get(0).y());
    }

    @Test
    void alignedBlocksArePositionedHorizontally() {
        var centered = BlockContent.builder()
            .label("centered")
            .width(40)
            .height(10)
            .align(FixedAlignment.CENTER)
            .build();

        var frame = layout(shrinking(100, 200), centered).get(0);

        assertEquals(30, shape(frame, "centered").x());
        assertEquals(40, shape(frame, "centered").size().x());
    }
}
