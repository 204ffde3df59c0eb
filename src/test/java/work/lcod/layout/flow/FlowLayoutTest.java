package work.lcod.layout.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.layout.support.LayoutTestSupport.layout;
import static work.lcod.layout.support.LayoutTestSupport.pages;
import static work.lcod.layout.support.LayoutTestSupport.shape;
import static work.lcod.layout.support.LayoutTestSupport.shapes;
import static work.lcod.layout.support.LayoutTestSupport.text;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.PagebreakContent;
import work.lcod.layout.content.ParagraphContent;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Styles;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.engine.SourceException;
import work.lcod.layout.frame.FrameJson;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.Region;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.geom.Size;

class FlowLayoutTest {
    @Test
    void defersBlockThatDoesNotFitToNextRegion() {
        var fragment = layout(pages(100, 100), BlockContent.box("a", 60), BlockContent.box("b", 60));

        assertEquals(2, fragment.size());
        assertEquals(0, shape(fragment.get(0), "a").y());
        assertTrue(shapes(fragment.get(0), "b").isEmpty());
        assertEquals(0, shape(fragment.get(1), "b").y());
        assertEquals(100, fragment.get(0).height());
        assertEquals(100, fragment.get(1).height());
    }

    @Test
    void shrinksFramesToContentWithoutVerticalExpansion() {
        var regions = Regions.repeat(new Size(100, 100), new Axes<>(true, false));
        var fragment = layout(regions, BlockContent.box("a", 60), BlockContent.box("b", 60));

        assertEquals(2, fragment.size());
        assertEquals(60, fragment.get(0).height());
        assertEquals(60, fragment.get(1).height());
        assertEquals(100, fragment.get(0).width());
    }

    @Test
    void placesBlocksWithSpacingBetweenThem() {
        var fragment = layout(pages(100, 200), BlockContent.box("a", 20), BlockContent.box("b", 20));

        assertEquals(1, fragment.size());
        assertEquals(0, shape(fragment.get(0), "a").y());
        assertEquals(28, shape(fragment.get(0), "b").y());
    }

    @Test
    void emptyDocumentProducesSingleFrame() {
        var fragment = layout(pages(100, 80));

        assertEquals(1, fragment.size());
        assertEquals(new Size(100, 80), fragment.get(0).size());
        assertTrue(fragment.get(0).isEmpty());
    }

    @Test
    void splitsBreakableBlockIntoConsecutiveSlices() {
        var outer = BlockContent.builder().label("outer").above(0).below(0);
        for (int i = 0; i < 25; i++) {
            outer.child(BlockContent.builder().label("inner").height(10).above(0).below(0).build());
        }

        var fragment = layout(pages(100, 100), outer.build());

        assertEquals(3, fragment.size());
        int[] expected = {10, 10, 5};
        int total = 0;
        for (int page = 0; page < 3; page++) {
            var inner = shapes(fragment.get(page), "inner");
            assertEquals(expected[page], inner.size());
            for (int i = 0; i < inner.size(); i++) {
                assertEquals(i * 10.0, inner.get(i).y(), 1e-9);
            }
            total += inner.size();
        }
        assertEquals(25, total);
        assertEquals(100, shape(fragment.get(1), "outer").size().y());
        assertEquals(50, shape(fragment.get(2), "outer").size().y());
    }

    @Test
    void spreadsFixedHeightOfBreakableBlockOverRegions() {
        var block = BlockContent.builder()
            .label("sized")
            .breakable(true)
            .height(250)
            .child(ParagraphContent.of("text"))
            .build();
        var engine = Engine.create();

        var fragment = layout(engine, Styles.defaults(), pages(100, 100), 1, Rel.ZERO, block);

        assertEquals(3, fragment.size());
        double[] slices = {100, 100, 50};
        for (int page = 0; page < 3; page++) {
            var sized = shape(fragment.get(page), "sized");
            assertEquals(0, sized.y());
            assertEquals(slices[page], sized.size().y(), 1e-9);
        }
        assertEquals(0, text(fragment.get(0), "text").y());
        assertTrue(engine.sink().warnings().isEmpty());
    }

    @Test
    void fixedHeightBreakableBlockStartsInRemainingSpace() {
        var block = BlockContent.builder().label("sized").height(120).build();

        var fragment = layout(pages(100, 100), BlockContent.box("a", 52), block);

        assertEquals(2, fragment.size());
        assertEquals(60, shape(fragment.get(0), "sized").y());
        assertEquals(40, shape(fragment.get(0), "sized").size().y(), 1e-9);
        assertEquals(80, shape(fragment.get(1), "sized").size().y(), 1e-9);
    }

    @Test
    void unbreakableBlockTallerThanRegionOverflows() {
        var block = BlockContent.builder()
            .label("fixed")
            .breakable(false)
            .height(150)
            .child(ParagraphContent.of("text"))
            .build();
        var engine = Engine.create();

        var fragment = layout(engine, Styles.defaults(), pages(100, 100), 1, Rel.ZERO, block);

        assertEquals(1, fragment.size());
        assertEquals(150, shape(fragment.get(0), "fixed").size().y());
        assertEquals(1, engine.sink().warnings().size());
        assertEquals(Distributor.OVERFLOW, engine.sink().warnings().get(0).message());
    }

    @Test
    void warnsWhenContentOverflowsLastRegion() {
        var engine = Engine.create();
        var content = SequenceContent.of(BlockContent.box("tall", 80));

        var fragment = FlowLayout.layoutFragment(
            engine,
            content,
            Locator.root(),
            Styles.defaults(),
            Regions.one(new Size(100, 50), Axes.splat(true))
        );

        assertEquals(1, fragment.size());
        assertEquals(50, fragment.get(0).height());
        assertEquals(80, shape(fragment.get(0), "tall").size().y());
        assertEquals(List.of(Distributor.OVERFLOW),
            engine.sink().warnings().stream().map(warning -> warning.message()).toList());
    }

    @Test
    void rejectsExpansionIntoInfiniteHeight() {
        var regions = Regions.one(new Size(100, Double.POSITIVE_INFINITY), Axes.splat(true));

        var ex = assertThrows(SourceException.class, () -> FlowLayout.layoutFragment(
            Engine.create(), BlockContent.box("a", 10), Locator.root(), Styles.defaults(), regions));

        assertEquals("cannot expand into infinite height", ex.getMessage());
    }

    @Test
    void rejectsExpansionIntoInfiniteWidth() {
        var regions = Regions.one(new Size(Double.POSITIVE_INFINITY, 100), new Axes<>(true, false));

        var ex = assertThrows(SourceException.class, () -> FlowLayout.layoutFragment(
            Engine.create(), BlockContent.box("a", 10), Locator.root(), Styles.defaults(), regions));

        assertEquals("cannot expand into infinite width", ex.getMessage());
    }

    @Test
    void measuresContentInInfiniteRegionWithoutExpansion() {
        var region = new Region(new Size(100, Double.POSITIVE_INFINITY), new Axes<>(true, false));

        var frame = FlowLayout.layoutFrame(
            Engine.create(),
            SequenceContent.of(BlockContent.box("a", 30), BlockContent.box("b", 30)),
            Locator.root(),
            Styles.defaults(),
            region
        );

        assertEquals(68, frame.height());
    }

    @Test
    void rejectsPagebreakInsideContainer() {
        var block = BlockContent.builder()
            .child(ParagraphContent.of("before"))
            .child(new PagebreakContent(false, Span.of("doc.yaml", 3)))
            .build();

        var ex = assertThrows(SourceException.class, () -> layout(pages(100, 100), block));

        assertEquals("pagebreaks are not allowed inside of containers", ex.getMessage());
        assertEquals(Span.of("doc.yaml", 3), ex.diagnostics().get(0).span());
    }

    @Test
    void rejectsExcessiveNesting() {
        Content content = BlockContent.box("core", 10);
        for (int i = 0; i < 80; i++) {
            content = BlockContent.builder().child(content).build();
        }
        var nested = content;

        var ex = assertThrows(SourceException.class, () -> layout(pages(100, 100), nested));

        assertEquals("maximum layout depth exceeded", ex.getMessage());
    }

    @Test
    void producesIdenticalFramesForIdenticalInput() {
        var children = new ArrayList<Content>();
        for (int i = 0; i < 12; i++) {
            children.add(ParagraphContent.of("Lorem ipsum dolor sit amet consectetur " + i));
            children.add(BlockContent.box("box" + i, 25));
        }
        var content = children.toArray(new Content[0]);

        var first = layout(pages(120, 150), content);
        var second = layout(pages(120, 150), content);

        assertTrue(first.size() > 1);
        assertEquals(FrameJson.toJson(first), FrameJson.toJson(second));
    }

    @Test
    void servesRepeatedNestedLayoutsFromCache() {
        var outer = BlockContent.builder().above(0).below(0);
        for (int i = 0; i < 30; i++) {
            outer.child(BlockContent.builder().label("inner").height(10).above(0).below(0).build());
        }
        var block = outer.build();
        var engine = Engine.create();

        var first = layout(engine, Styles.defaults(), pages(100, 100), 1, Rel.ZERO, block);
        int misses = engine.cache().misses();
        var second = layout(engine, Styles.defaults(), pages(100, 100), 1, Rel.ZERO, block);

        assertEquals(3, first.size());
        assertEquals(misses, engine.cache().misses());
        assertTrue(engine.cache().hits() > 0);
        assertEquals(FrameJson.toJson(first), FrameJson.toJson(second));
    }
}
