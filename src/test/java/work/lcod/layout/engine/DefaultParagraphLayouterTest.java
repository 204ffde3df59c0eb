package work.lcod.layout.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.ParLineMarker;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.TextContent;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.frame.FrameItem;
import work.lcod.layout.geom.FixedAlignment;

class DefaultParagraphLayouterTest {
    private final ParagraphLayouter layouter = new DefaultParagraphLayouter(new MonospaceShaper());

    private List<Frame> lines(Styles styles, double width, boolean numberLines, Content... inlines) {
        return layouter.layout(Engine.create(), Locator.root(), List.of(inlines), styles, width, numberLines);
    }

    private static List<String> words(Frame line) {
        return line.items().stream()
            .filter(item -> item.item() instanceof FrameItem.Text)
            .map(item -> ((FrameItem.Text) item.item()).text())
            .toList();
    }

    @Test
    void wrapsWordsGreedily() {
        // 11pt text: four glyphs take 22pt, a space 5.5pt.
        var lines = lines(Styles.defaults(), 50, false, TextContent.of("aaaa bbbb cccc"));

        assertEquals(2, lines.size());
        assertEquals(List.of("aaaa", "bbbb"), words(lines.get(0)));
        assertEquals(List.of("cccc"), words(lines.get(1)));
        assertEquals(27.5, lines.get(0).items().get(1).pos().x(), 1e-9);
        assertEquals(50, lines.get(0).width());
        assertEquals(11, lines.get(0).height());
    }

    @Test
    void overlongWordGetsALineOfItsOwn() {
        var lines = lines(Styles.defaults(), 20, false, TextContent.of("a bbbbbbbb c"));

        assertEquals(3, lines.size());
        assertEquals(44, lines.get(1).width());
    }

    @Test
    void footnoteMarkerSticksToThePrecedingWord() {
        var note = FootnoteContent.of("1", "Note");

        var lines = lines(Styles.defaults(), 25, false, TextContent.of("aaaa"), note);

        assertEquals(1, lines.size());
        var notes = lines.get(0).find(FootnoteContent.class);
        assertEquals(1, notes.size());
        assertEquals("0/fn0", notes.get(0).tag().location().key());
        var marker = lines.get(0).items().stream()
            .filter(item -> item.item() instanceof FrameItem.TagItem)
            .findFirst()
            .orElseThrow();
        assertEquals(22, marker.pos().x(), 1e-9);
    }

    @Test
    void numberedLinesStartWithAMarker() {
        var lines = lines(Styles.defaults(), 50, true, TextContent.of("aaaa bbbb cccc"));

        for (int i = 0; i < lines.size(); i++) {
            var markers = lines.get(i).find(ParLineMarker.class);
            assertEquals(1, markers.size());
            assertEquals("0/line" + i, markers.get(0).tag().location().key());
        }
    }

    @Test
    void alignsLinesWithinTheWidth() {
        var styles = Styles.builder().parAlign(FixedAlignment.END).build();

        var line = lines(styles, 50, false, TextContent.of("aaaa")).get(0);

        assertEquals(28, line.items().get(0).pos().x(), 1e-9);
    }

    @Test
    void emptyParagraphHasNoLines() {
        assertTrue(lines(Styles.defaults(), 50, false, TextContent.of("   ")).isEmpty());
    }

    @Test
    void rejectsBlockContent() {
        var ex = assertThrows(SourceException.class,
            () -> lines(Styles.defaults(), 50, false, BlockContent.box("box", 10)));

        assertEquals("unexpected block-level content in a paragraph", ex.getMessage());
    }
}
