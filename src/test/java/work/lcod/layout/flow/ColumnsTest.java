package work.lcod.layout.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.layout.support.LayoutTestSupport.layout;
import static work.lcod.layout.support.LayoutTestSupport.pages;
import static work.lcod.layout.support.LayoutTestSupport.shape;
import static work.lcod.layout.support.LayoutTestSupport.shapes;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.ColbreakContent;
import work.lcod.layout.content.ColumnsContent;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Styles;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.geom.Dir;
import work.lcod.layout.geom.Rel;

class ColumnsTest {
    @Test
    void columnsAndGutterSpanThePageWidth() {
        var fragment = layout(
            Engine.create(),
            Styles.defaults(),
            pages(210, 100),
            2,
            Rel.abs(10),
            BlockContent.box("a", 50),
            ColbreakContent.of(),
            BlockContent.box("b", 50)
        );

        assertEquals(1, fragment.size());
        var a = shape(fragment.get(0), "a");
        var b = shape(fragment.get(0), "b");
        assertEquals(0, a.x());
        assertEquals(110, b.x());
        assertEquals(100, a.size().x());
        assertEquals(100, b.size().x());
        assertEquals(210, b.x() + b.size().x());
        assertEquals(0, b.y());
    }

    @Test
    void rightToLeftColumnsProgressFromTheRight() {
        var styles = Styles.builder().dir(Dir.RTL).build();
        var fragment = layout(
            Engine.create(),
            styles,
            pages(210, 100),
            2,
            Rel.abs(10),
            BlockContent.box("a", 50),
            ColbreakContent.of(),
            BlockContent.box("b", 50)
        );

        assertEquals(110, shape(fragment.get(0), "a").x());
        assertEquals(0, shape(fragment.get(0), "b").x());
    }

    @Test
    void relativeGutterResolvesAgainstRegionWidth() {
        var fragment = layout(
            Engine.create(),
            Styles.defaults(),
            pages(200, 100),
            2,
            Rel.ratio(0.1),
            BlockContent.box("a", 50),
            ColbreakContent.of(),
            BlockContent.box("b", 50)
        );

        assertEquals(90, shape(fragment.get(0), "a").size().x());
        assertEquals(110, shape(fragment.get(0), "b").x());
    }

    @Test
    void contentFlowsIntoNextColumnBeforeNextRegion() {
        var fragment = layout(
            Engine.create(),
            Styles.defaults(),
            pages(210, 100),
            2,
            Rel.abs(10),
            BlockContent.box("a", 80),
            BlockContent.box("b", 80),
            BlockContent.box("c", 80)
        );

        assertEquals(2, fragment.size());
        assertEquals(0, shape(fragment.get(0), "a").x());
        assertEquals(110, shape(fragment.get(0), "b").x());
        assertEquals(0, shape(fragment.get(1), "c").x());
    }

    @Test
    void weakColumnBreakAtColumnStartDoesNothing() {
        var fragment = layout(
            Engine.create(),
            Styles.defaults(),
            pages(210, 100),
            2,
            Rel.abs(10),
            new ColbreakContent(true, Span.detached()),
            BlockContent.box("a", 50)
        );

        assertEquals(0, shape(fragment.get(0), "a").x());
    }

    @Test
    void columnBreakInSingleColumnMovesToNextRegion() {
        var fragment = layout(pages(100, 100), BlockContent.box("a", 20), ColbreakContent.of(), BlockContent.box("b", 20));

        assertEquals(2, fragment.size());
        assertTrue(shapes(fragment.get(0), "b").isEmpty());
        assertEquals(0, shape(fragment.get(1), "b").y());
    }

    @Test
    void nestedColumnsPlaceTheirBodySideBySide() {
        var columns = ColumnsContent.of(2, Rel.abs(10), List.of(
            BlockContent.box("left", 30),
            ColbreakContent.of(),
            BlockContent.box("right", 30)
        ));

        var fragment = layout(pages(210, 100), columns);

        assertEquals(1, fragment.size());
        assertEquals(0, shape(fragment.get(0), "left").x());
        assertEquals(110, shape(fragment.get(0), "right").x());
        assertEquals(shape(fragment.get(0), "left").y(), shape(fragment.get(0), "right").y());
    }
}
